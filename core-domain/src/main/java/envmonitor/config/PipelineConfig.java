package envmonitor.config;

import envmonitor.domain.exception.ConfigurationException;
import envmonitor.domain.sensors.SensorType;
import lombok.Builder;
import lombok.With;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Configuración completa del pipeline de ingesta y detección. Objeto de valor inmutable;
 * se valida entera al arrancar con {@link #validate()} y un fallo es fatal.
 *
 * @param windowCapacity     Capacidad N de la ventana deslizante por sensor.
 * @param minHistory         Muestras mínimas antes de puntuar; por debajo la lectura es NORMAL con score 0.
 * @param stalenessTolerance Retraso máximo admitido respecto al último timestamp aceptado del sensor.
 * @param stddevEpsilon      Desviación típica por debajo de la cual el z-score se fuerza a 0.
 * @param modelWeight        Peso del modelo en el combined score, en [0, 1].
 * @param modelScoreScale    Escala que lleva la puntuación del modelo ([0.5, 1] → [0, scale]) a unidades de z.
 * @param slopeWindow        Número de muestras k para la pendiente a corto plazo.
 * @param modelGrouping      Un modelo por tipo de sensor o por sensor.
 * @param workers            Número de carriles de ejecución (particiones por sensor).
 * @param typeLimits         Rangos y umbrales por tipo de sensor.
 * @param retrain            Política de reentrenamiento.
 * @param alert              Política de alertas.
 */
@Builder
@With
public record PipelineConfig(
        int windowCapacity,
        int minHistory,
        Duration stalenessTolerance,
        double stddevEpsilon,
        double modelWeight,
        double modelScoreScale,
        int slopeWindow,
        ModelGrouping modelGrouping,
        int workers,
        Map<SensorType, SensorTypeLimits> typeLimits,
        RetrainConfig retrain,
        AlertConfig alert) {

    public PipelineConfig {
        typeLimits = typeLimits == null ? Map.of() : Map.copyOf(typeLimits);
    }

    /**
     * Estrategia de agrupación de modelos.
     */
    public enum ModelGrouping {
        /** Un modelo compartido por todos los sensores del mismo tipo. */
        SENSOR_TYPE,
        /** Un modelo por sensor. */
        SENSOR_ID
    }

    /**
     * @param interval      Cadencia temporal; {@link Duration#ZERO} la desactiva.
     * @param everySamples  Cadencia por muestras aceptadas en el grupo; 0 la desactiva.
     * @param snapshotSize  W: lecturas recientes no críticas que entran en el snapshot de entrenamiento.
     * @param minSamples    Por debajo de esta cantidad el ajuste se omite.
     * @param timeout       Tiempo máximo de un ajuste antes de cancelarlo.
     * @param treeCount     Árboles del bosque de aislamiento.
     * @param subsampleSize Muestras por árbol.
     * @param seed          Semilla base para reproducibilidad.
     */
    @Builder
    @With
    public record RetrainConfig(
            Duration interval,
            int everySamples,
            int snapshotSize,
            int minSamples,
            Duration timeout,
            int treeCount,
            int subsampleSize,
            long seed) {
    }

    /**
     * @param escalationOccurrences Ocurrencias a partir de las cuales OPEN pasa a ESCALATED.
     * @param quietPeriod           Tiempo sin anomalías tras el cual la alerta se resuelve.
     * @param sweepInterval         Cadencia del barrido de resolución.
     */
    @Builder
    @With
    public record AlertConfig(
            int escalationOccurrences,
            Duration quietPeriod,
            Duration sweepInterval) {
    }

    public SensorTypeLimits limitsFor(SensorType type) {
        SensorTypeLimits limits = typeLimits.get(type);
        if (limits == null) {
            throw new IllegalArgumentException("No limits configured for sensor type " + type);
        }
        return limits;
    }

    /**
     * Comprueba todos los invariantes y lanza {@link ConfigurationException} con la lista
     * completa de violaciones. Devuelve la propia instancia para encadenar.
     */
    public PipelineConfig validate() {
        List<String> errors = new ArrayList<>();

        if (windowCapacity <= 0) errors.add("windowCapacity must be > 0 (was " + windowCapacity + ")");
        if (minHistory < 2) errors.add("minHistory must be >= 2 (was " + minHistory + ")");
        if (windowCapacity > 0 && minHistory > windowCapacity) {
            errors.add("minHistory (" + minHistory + ") cannot exceed windowCapacity (" + windowCapacity + ")");
        }
        if (isNotPositive(stalenessTolerance)) errors.add("stalenessTolerance must be a positive duration");
        if (!(stddevEpsilon > 0)) errors.add("stddevEpsilon must be > 0");
        if (!(modelWeight >= 0.0 && modelWeight <= 1.0)) errors.add("modelWeight must be within [0, 1] (was " + modelWeight + ")");
        if (!(modelScoreScale > 0)) errors.add("modelScoreScale must be > 0");
        if (slopeWindow < 2) errors.add("slopeWindow must be >= 2 (was " + slopeWindow + ")");
        if (modelGrouping == null) errors.add("modelGrouping is required");
        if (workers <= 0) errors.add("workers must be > 0 (was " + workers + ")");

        for (SensorType type : SensorType.getValidTypes()) {
            SensorTypeLimits limits = typeLimits.get(type);
            if (limits == null) {
                errors.add("missing limits for sensor type " + type.getCode());
                continue;
            }
            String p = type.getCode() + ": ";
            if (!(limits.validMin() < limits.validMax())) {
                errors.add(p + "validMin (" + limits.validMin() + ") must be < validMax (" + limits.validMax() + ")");
            }
            if (limits.validMin() < type.getDomainMin() || limits.validMax() > type.getDomainMax()) {
                errors.add(p + "valid range [" + limits.validMin() + ", " + limits.validMax()
                        + "] exceeds the physical domain [" + type.getDomainMin() + ", " + type.getDomainMax() + "]");
            }
            if (!(limits.warningThreshold() > 0)) errors.add(p + "warningThreshold must be > 0");
            if (!(limits.warningThreshold() < limits.criticalThreshold())) {
                errors.add(p + "warningThreshold (" + limits.warningThreshold()
                        + ") must be < criticalThreshold (" + limits.criticalThreshold() + ")");
            }
        }

        if (retrain == null) {
            errors.add("retrain configuration is required");
        } else {
            if (retrain.interval() == null || retrain.interval().isNegative()) errors.add("retrain.interval must be >= 0");
            if (retrain.everySamples() < 0) errors.add("retrain.everySamples must be >= 0");
            if (retrain.minSamples() < 2) errors.add("retrain.minSamples must be >= 2");
            if (retrain.snapshotSize() < retrain.minSamples()) {
                errors.add("retrain.snapshotSize (" + retrain.snapshotSize()
                        + ") must be >= retrain.minSamples (" + retrain.minSamples() + ")");
            }
            if (isNotPositive(retrain.timeout())) errors.add("retrain.timeout must be a positive duration");
            if (retrain.treeCount() <= 0) errors.add("retrain.treeCount must be > 0");
            if (retrain.subsampleSize() < 2) errors.add("retrain.subsampleSize must be >= 2");
        }

        if (alert == null) {
            errors.add("alert configuration is required");
        } else {
            if (alert.escalationOccurrences() < 2) errors.add("alert.escalationOccurrences must be >= 2");
            if (isNotPositive(alert.quietPeriod())) errors.add("alert.quietPeriod must be a positive duration");
            if (isNotPositive(alert.sweepInterval())) errors.add("alert.sweepInterval must be a positive duration");
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        return this;
    }

    private static boolean isNotPositive(Duration d) {
        return d == null || d.isNegative() || d.isZero();
    }

    /**
     * Valores por defecto documentados. También sirven de base en los tests.
     */
    public static PipelineConfig defaults() {
        Map<SensorType, SensorTypeLimits> limits = new EnumMap<>(SensorType.class);
        limits.put(SensorType.TEMPERATURE, new SensorTypeLimits(-40.0, 125.0, 3.0, 5.0));
        limits.put(SensorType.HUMIDITY, new SensorTypeLimits(0.0, 100.0, 3.0, 5.0));
        limits.put(SensorType.AIR_QUALITY, new SensorTypeLimits(0.0, 500.0, 3.0, 5.0));

        return PipelineConfig.builder()
                .windowCapacity(100)
                .minHistory(10)
                .stalenessTolerance(Duration.ofSeconds(30))
                .stddevEpsilon(1e-9)
                .modelWeight(0.3)
                .modelScoreScale(10.0)
                .slopeWindow(5)
                .modelGrouping(ModelGrouping.SENSOR_TYPE)
                .workers(Math.max(1, Runtime.getRuntime().availableProcessors()))
                .typeLimits(limits)
                .retrain(RetrainConfig.builder()
                        .interval(Duration.ofHours(1))
                        .everySamples(500)
                        .snapshotSize(1000)
                        .minSamples(50)
                        .timeout(Duration.ofSeconds(30))
                        .treeCount(100)
                        .subsampleSize(256)
                        .seed(42L)
                        .build())
                .alert(AlertConfig.builder()
                        .escalationOccurrences(5)
                        .quietPeriod(Duration.ofMinutes(5))
                        .sweepInterval(Duration.ofSeconds(10))
                        .build())
                .build();
    }
}
