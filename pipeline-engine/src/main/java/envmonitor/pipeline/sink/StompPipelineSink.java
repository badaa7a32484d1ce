package envmonitor.pipeline.sink;

import envmonitor.config.ApiRoutes;
import envmonitor.domain.alert.AlertTransition;
import envmonitor.domain.reading.CleanedReading;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Difunde lecturas limpias y transiciones de alerta por STOMP para el dashboard en tiempo real.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompPipelineSink implements PipelineEventSink {

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onReading(CleanedReading reading) {
        String destination = ApiRoutes.TOPIC_READINGS + reading.sensorId();
        messagingTemplate.convertAndSend(destination, reading);
        log.trace("Sent reading to {}", destination);
    }

    @Override
    public void onAlert(AlertTransition transition) {
        messagingTemplate.convertAndSend(ApiRoutes.TOPIC_ALERTS, transition);
        log.debug("Sent alert transition {} for {} to {}", transition.kind(), transition.sensorId(), ApiRoutes.TOPIC_ALERTS);
    }
}
