package envmonitor.pipeline.service.orchestration;

import envmonitor.config.PipelineConfig;
import envmonitor.domain.alert.AlertEvent;
import envmonitor.domain.alert.AlertTransition;
import envmonitor.domain.anomaly.AnomalyScore;
import envmonitor.domain.anomaly.Classification;
import envmonitor.domain.dto.DataQualitySnapshot;
import envmonitor.domain.dto.ModelStatusDTO;
import envmonitor.domain.dto.ProcessingOutcome;
import envmonitor.domain.exception.ResourceNotFoundException;
import envmonitor.domain.reading.CleanedReading;
import envmonitor.domain.reading.Reading;
import envmonitor.domain.validation.RejectionReason;
import envmonitor.domain.validation.ValidationResult;
import envmonitor.pipeline.service.alert.AlertEngine;
import envmonitor.pipeline.service.detection.AnomalyDetector;
import envmonitor.pipeline.service.detection.AnomalyModel;
import envmonitor.pipeline.service.detection.FeatureExtractor;
import envmonitor.pipeline.service.detection.ModelRegistry;
import envmonitor.pipeline.service.detection.ModelRetrainer;
import envmonitor.pipeline.service.detection.RetrainResult;
import envmonitor.pipeline.service.state.SensorStreamRegistry;
import envmonitor.pipeline.service.state.StreamState;
import envmonitor.pipeline.service.validation.ReadingValidator;
import envmonitor.pipeline.sink.PipelineEventSink;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Punto de entrada del pipeline.
 * <p>
 * Cada lectura se procesa dentro del carril de su sensor: validación, actualización del estado,
 * puntuación, alertas y publicación ocurren de forma atómica respecto a otras operaciones del
 * mismo sensor. Un fallo inesperado al procesar una lectura se registra y se cuenta, pero no
 * afecta al resto de lecturas ni de sensores.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private final PipelineConfig config;
    private final Clock clock;
    private final SensorPartitionExecutor lanes;
    private final ReadingValidator validator;
    private final SensorStreamRegistry streams;
    private final FeatureExtractor featureExtractor;
    private final AnomalyDetector detector;
    private final ModelRegistry models;
    private final ModelRetrainer retrainer;
    private final AlertEngine alertEngine;
    private final DataQualityMetrics metrics;
    private final List<PipelineEventSink> sinks;

    public CompletableFuture<ProcessingOutcome> submit(Reading reading) {
        String key = reading == null || reading.sensorId() == null ? "" : reading.sensorId();
        return lanes.submit(key, () -> processSafely(reading));
    }

    /**
     * Barrido de resolución: encola en cada carril la comprobación del periodo de silencio
     * de los sensores con alerta viva.
     */
    public CompletableFuture<List<AlertTransition>> sweepAlerts() {
        Instant now = clock.instant();
        List<CompletableFuture<Optional<AlertTransition>>> pending = new ArrayList<>();
        for (String sensorId : alertEngine.sensorsWithActiveAlerts()) {
            pending.add(lanes.submit(sensorId, () -> {
                Optional<AlertTransition> resolved = alertEngine.sweep(sensorId, now);
                resolved.ifPresent(this::publishAlert);
                return resolved;
            }));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<AlertTransition> out = new ArrayList<>();
                    pending.forEach(f -> f.join().ifPresent(out::add));
                    return out;
                });
    }

    /**
     * Reconoce una alerta. Se ejecuta en el carril del sensor dueño para no competir con sus lecturas.
     *
     * @throws ResourceNotFoundException si la alerta no existe o ya está resuelta
     */
    public CompletableFuture<Optional<AlertTransition>> acknowledge(String alertId) {
        String sensorId = alertEngine.sensorOf(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert not found or already resolved: " + alertId));
        return lanes.submit(sensorId, () -> {
            Optional<AlertTransition> ack = alertEngine.acknowledge(alertId, clock.instant());
            ack.ifPresent(this::publishAlert);
            return ack;
        });
    }

    public CompletableFuture<RetrainResult> forceRetrain(String group) {
        if (!models.exists(group)) {
            throw new ResourceNotFoundException("Model group not found: " + group);
        }
        return retrainer.requestRetrain(group, ModelRetrainer.Trigger.MANUAL);
    }

    public List<AlertEvent> activeAlerts() {
        return alertEngine.activeAlerts();
    }

    public List<ModelStatusDTO> modelStatuses() {
        return models.statuses();
    }

    public DataQualitySnapshot qualitySnapshot() {
        return metrics.snapshot(streams.trackedSensors(), clock.instant());
    }

    public Optional<StreamState> stateOf(String sensorId) {
        return streams.find(sensorId);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping pipeline: draining sensor lanes");
        lanes.shutdown(10, TimeUnit.SECONDS);
    }

    /**
     * Un fallo antes de confirmar el estado deja el stream del sensor intacto y la lectura sale
     * como FAULTED. Los fallos de los sinks no cuentan: se registran y la lectura sigue aceptada.
     */
    private ProcessingOutcome processSafely(Reading reading) {
        try {
            return process(reading);
        } catch (RuntimeException e) {
            metrics.recordFault();
            String id = reading == null ? "<null>" : reading.sensorId() + "#" + reading.sequenceNo();
            log.warn("Processing fault on reading {}: {}", id, e.toString(), e);
            return ProcessingOutcome.faulted(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private ProcessingOutcome process(Reading reading) {
        // 1. Validación contra la marca de agua del sensor
        Optional<StreamState> existing = reading == null || reading.sensorId() == null
                ? Optional.empty()
                : streams.find(reading.sensorId());
        ValidationResult validation = validator.validate(reading, existing.map(StreamState::watermark).orElse(null));
        if (!validation.isAccepted()) {
            RejectionReason reason = validation.getReason().orElseThrow();
            metrics.recordRejected(reason);
            log.debug("Rejected {}: {} ({})", reading == null ? "<null>" : reading.sensorId(), reason, validation.getDetail());
            return ProcessingOutcome.rejected(reason, validation.getDetail());
        }

        // 2. Estado previo y puntuación contra él
        String group = models.groupOf(reading);
        AnomalyModel model = models.currentModel(group).orElse(null);
        StreamState prior = existing.orElseGet(() -> StreamState.empty(reading.sensorId(), config.windowCapacity()));
        AnomalyScore score = detector.score(prior, model, reading);

        // 3. Nuevo estado y muestra de entrenamiento, todavía sin publicar
        StreamState next = prior.update(reading).withModelVersion(model == null ? 0L : model.version());
        double[] trainingSample = prior.size() >= config.minHistory() && score.classification() != Classification.CRITICAL
                ? featureExtractor.extract(prior, reading.requireValue())
                : null;

        // 4. Decisión de alerta antes de confirmar nada: si falla, la lectura no deja rastro
        CleanedReading cleaned = new CleanedReading(reading, score);
        List<AlertTransition> transitions = new ArrayList<>(1);
        alertEngine.onScore(score, reading.sensorType(), clock.instant()).ifPresent(transitions::add);

        // 5. Confirmación del estado y de la muestra (solo lecturas no críticas con línea base suficiente)
        streams.put(next);
        metrics.recordAccepted();
        if (trainingSample != null) {
            long pending = models.recordTrainingSample(group, trainingSample);
            retrainer.onSampleRecorded(group, pending);
        }

        // 6. Publicación
        publishReading(cleaned);
        transitions.forEach(this::publishAlert);
        return ProcessingOutcome.accepted(cleaned, transitions);
    }

    private void publishReading(CleanedReading cleaned) {
        for (PipelineEventSink sink : sinks) {
            try {
                sink.onReading(cleaned);
            } catch (RuntimeException e) {
                log.warn("Sink {} failed on reading {}: {}", sink.getClass().getSimpleName(), cleaned.sensorId(), e.getMessage());
            }
        }
    }

    private void publishAlert(AlertTransition transition) {
        for (PipelineEventSink sink : sinks) {
            try {
                sink.onAlert(transition);
            } catch (RuntimeException e) {
                log.warn("Sink {} failed on alert {}: {}", sink.getClass().getSimpleName(),
                        transition.alert().alertId(), e.getMessage());
            }
        }
    }
}
