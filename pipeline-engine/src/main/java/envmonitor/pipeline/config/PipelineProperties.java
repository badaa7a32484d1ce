package envmonitor.pipeline.config;

import envmonitor.config.PipelineConfig;
import envmonitor.config.SensorTypeLimits;
import envmonitor.domain.sensors.SensorType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Enlace de {@code envmonitor.pipeline.*}. Lo que no se configure toma el valor de
 * {@link PipelineConfig#defaults()}.
 */
@Data
@ConfigurationProperties(prefix = "envmonitor.pipeline")
public class PipelineProperties {

    private static final PipelineConfig DEFAULTS = PipelineConfig.defaults();

    private int windowCapacity = DEFAULTS.windowCapacity();
    private int minHistory = DEFAULTS.minHistory();
    private Duration stalenessTolerance = DEFAULTS.stalenessTolerance();
    private double stddevEpsilon = DEFAULTS.stddevEpsilon();
    private double modelWeight = DEFAULTS.modelWeight();
    private double modelScoreScale = DEFAULTS.modelScoreScale();
    private int slopeWindow = DEFAULTS.slopeWindow();
    private PipelineConfig.ModelGrouping modelGrouping = DEFAULTS.modelGrouping();
    private int workers = DEFAULTS.workers();
    private Map<String, TypeLimits> types = new LinkedHashMap<>();
    private Retrain retrain = new Retrain();
    private Alert alert = new Alert();

    @Data
    public static class TypeLimits {
        private Double min;
        private Double max;
        private Double warn;
        private Double critical;
    }

    @Data
    public static class Retrain {
        private Duration interval = DEFAULTS.retrain().interval();
        private Duration tickInterval = Duration.ofMinutes(1);
        private int everySamples = DEFAULTS.retrain().everySamples();
        private int snapshotSize = DEFAULTS.retrain().snapshotSize();
        private int minSamples = DEFAULTS.retrain().minSamples();
        private Duration timeout = DEFAULTS.retrain().timeout();
        private int treeCount = DEFAULTS.retrain().treeCount();
        private int subsampleSize = DEFAULTS.retrain().subsampleSize();
        private long seed = DEFAULTS.retrain().seed();
    }

    @Data
    public static class Alert {
        private int escalationOccurrences = DEFAULTS.alert().escalationOccurrences();
        private Duration quietPeriod = DEFAULTS.alert().quietPeriod();
        private Duration sweepInterval = DEFAULTS.alert().sweepInterval();
    }

    /**
     * Construye la configuración inmutable. No valida: de eso se encarga {@link PipelineConfig#validate()}.
     */
    public PipelineConfig toConfig() {
        Map<SensorType, SensorTypeLimits> limits = new EnumMap<>(DEFAULTS.typeLimits());
        types.forEach((code, override) -> {
            SensorType type = SensorType.fromString(code);
            if (type == SensorType.UNKNOWN) {
                throw new IllegalArgumentException("Unknown sensor type in envmonitor.pipeline.types: " + code);
            }
            SensorTypeLimits base = limits.get(type);
            limits.put(type, new SensorTypeLimits(
                    override.getMin() != null ? override.getMin() : base.validMin(),
                    override.getMax() != null ? override.getMax() : base.validMax(),
                    override.getWarn() != null ? override.getWarn() : base.warningThreshold(),
                    override.getCritical() != null ? override.getCritical() : base.criticalThreshold()));
        });

        return PipelineConfig.builder()
                .windowCapacity(windowCapacity)
                .minHistory(minHistory)
                .stalenessTolerance(stalenessTolerance)
                .stddevEpsilon(stddevEpsilon)
                .modelWeight(modelWeight)
                .modelScoreScale(modelScoreScale)
                .slopeWindow(slopeWindow)
                .modelGrouping(modelGrouping)
                .workers(workers)
                .typeLimits(limits)
                .retrain(PipelineConfig.RetrainConfig.builder()
                        .interval(retrain.interval)
                        .everySamples(retrain.everySamples)
                        .snapshotSize(retrain.snapshotSize)
                        .minSamples(retrain.minSamples)
                        .timeout(retrain.timeout)
                        .treeCount(retrain.treeCount)
                        .subsampleSize(retrain.subsampleSize)
                        .seed(retrain.seed)
                        .build())
                .alert(PipelineConfig.AlertConfig.builder()
                        .escalationOccurrences(alert.escalationOccurrences)
                        .quietPeriod(alert.quietPeriod)
                        .sweepInterval(alert.sweepInterval)
                        .build())
                .build();
    }
}
