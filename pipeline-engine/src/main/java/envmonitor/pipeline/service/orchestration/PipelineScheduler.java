package envmonitor.pipeline.service.orchestration;

import envmonitor.pipeline.service.detection.ModelRetrainer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Tareas periódicas del pipeline: barrido de resolución de alertas y cadencia temporal de
 * reentrenamiento. Ninguna bloquea el hilo del scheduler más allá de encolar trabajo.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "envmonitor.pipeline.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineScheduler {

    private final PipelineOrchestrator orchestrator;
    private final ModelRetrainer retrainer;

    @Scheduled(fixedDelayString = "${envmonitor.pipeline.alert.sweep-interval:PT10S}")
    public void sweepAlerts() {
        try {
            orchestrator.sweepAlerts()
                    .whenComplete((resolved, error) -> {
                        if (error != null) {
                            log.error("Alert sweep failed", error);
                        } else if (!resolved.isEmpty()) {
                            log.info("Alert sweep resolved {} alert(s)", resolved.size());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Alert sweep failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${envmonitor.pipeline.retrain.tick-interval:PT1M}",
            initialDelayString = "${envmonitor.pipeline.retrain.tick-interval:PT1M}")
    public void retrainTick() {
        try {
            int launched = retrainer.tick();
            if (launched > 0) {
                log.info("Scheduled retrain launched for {} group(s)", launched);
            }
        } catch (RuntimeException e) {
            log.error("Retrain tick failed", e);
        }
    }
}
