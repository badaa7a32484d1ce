package envmonitor.pipeline.sink;

import envmonitor.domain.alert.AlertEvent;
import envmonitor.domain.alert.AlertSeverity;
import envmonitor.domain.alert.AlertState;
import envmonitor.domain.alert.AlertTransition;
import envmonitor.domain.anomaly.AnomalyScore;
import envmonitor.domain.anomaly.Classification;
import envmonitor.domain.reading.CleanedReading;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import static envmonitor.pipeline.support.Readings.T0;
import static envmonitor.pipeline.support.Readings.temperature;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StompPipelineSinkTest {

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    @InjectMocks
    private StompPipelineSink sink;

    @Test
    void readingsGoToPerSensorTopic() {
        CleanedReading cleaned = new CleanedReading(temperature("temp-1", 21.0, 1), AnomalyScore.builder()
                .sensorId("temp-1").timestamp(T0).classification(Classification.NORMAL).build());

        sink.onReading(cleaned);

        verify(messagingTemplate).convertAndSend(eq("/topic/readings/temp-1"), same((Object) cleaned));
    }

    @Test
    void alertTransitionsGoToSharedTopic() {
        AlertEvent alert = AlertEvent.builder().alertId("a-1").sensorId("temp-1")
                .severity(AlertSeverity.WARNING).state(AlertState.OPEN).firstSeen(T0).lastSeen(T0).build();
        AlertTransition transition = new AlertTransition(AlertTransition.Kind.CREATED, null, alert, T0);

        sink.onAlert(transition);

        verify(messagingTemplate).convertAndSend(eq("/topic/alerts"), same((Object) transition));
    }
}
