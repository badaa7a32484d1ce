package envmonitor.pipeline.service.detection;

import envmonitor.config.PipelineConfig;
import envmonitor.config.SensorTypeLimits;
import envmonitor.domain.anomaly.AnomalyScore;
import envmonitor.domain.anomaly.Classification;
import envmonitor.domain.reading.Reading;
import envmonitor.pipeline.service.state.StreamState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Puntúa una lectura aceptada combinando un z-score rápido con el modelo no supervisado
 * del grupo, cuando existe.
 * <p>
 * El estado que recibe es el previo a la lectura, de modo que el valor puntuado no
 * contamina su propia línea base.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnomalyDetector {

    private final PipelineConfig config;
    private final FeatureExtractor featureExtractor;

    /**
     * @param prior   estado del sensor antes de aplicar la lectura
     * @param model   modelo vigente del grupo, o {@code null}
     * @param reading lectura aceptada
     */
    public AnomalyScore score(StreamState prior, AnomalyModel model, Reading reading) {
        double value = reading.requireValue();
        SensorTypeLimits limits = config.limitsFor(reading.sensorType());

        // 1. Histórico insuficiente: normal, sin puntuación
        if (prior.size() < config.minHistory()) {
            return AnomalyScore.builder()
                    .sensorId(reading.sensorId())
                    .timestamp(reading.timestamp())
                    .statisticalScore(0.0)
                    .combinedScore(0.0)
                    .classification(Classification.NORMAL)
                    .build();
        }

        // 2. Z-score contra la ventana
        double statistical = statisticalScore(prior, value);

        // 3. Modelo (opcional)
        Double modelScore = null;
        Long modelVersion = null;
        if (model != null) {
            try {
                modelScore = model.score(featureExtractor.extract(prior, value));
                modelVersion = model.version();
            } catch (RuntimeException e) {
                log.warn("Model {} v{} failed to score {}#{}; using statistical score only: {}",
                        model.group(), model.version(), reading.sensorId(), reading.sequenceNo(), e.getMessage());
            }
        }

        double combined = combine(statistical, modelScore);
        Classification classification = limits.classify(combined);

        if (classification.isAnomalous()) {
            log.debug("{}#{} value={} z={} model={} combined={} -> {}", reading.sensorId(), reading.sequenceNo(),
                    value, String.format("%.2f", statistical), modelScore, String.format("%.2f", combined), classification);
        }

        return AnomalyScore.builder()
                .sensorId(reading.sensorId())
                .timestamp(reading.timestamp())
                .statisticalScore(statistical)
                .modelScore(modelScore)
                .modelVersion(modelVersion)
                .combinedScore(combined)
                .classification(classification)
                .build();
    }

    double statisticalScore(StreamState prior, double value) {
        double stdDev = prior.stdDev().orElse(0.0);
        if (stdDev < config.stddevEpsilon()) {
            return 0.0;
        }
        return Math.abs(value - prior.mean().orElse(value)) / stdDev;
    }

    /**
     * La puntuación del modelo (0.5 = indistinguible, 1 = aislado de inmediato) se lleva a
     * unidades comparables al z-score antes de mezclar.
     */
    double combine(double statistical, Double modelScore) {
        if (modelScore == null) {
            return statistical;
        }
        double w = config.modelWeight();
        double modelContribution = Math.max(0.0, modelScore - 0.5) * 2.0 * config.modelScoreScale();
        return (1.0 - w) * statistical + w * modelContribution;
    }
}
