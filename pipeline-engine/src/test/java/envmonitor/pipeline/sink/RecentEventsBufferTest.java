package envmonitor.pipeline.sink;

import envmonitor.domain.alert.AlertEvent;
import envmonitor.domain.alert.AlertState;
import envmonitor.domain.alert.AlertTransition;
import envmonitor.domain.anomaly.AnomalyScore;
import envmonitor.domain.anomaly.Classification;
import envmonitor.domain.reading.CleanedReading;
import org.junit.jupiter.api.Test;

import static envmonitor.pipeline.support.Readings.T0;
import static envmonitor.pipeline.support.Readings.temperature;
import static org.assertj.core.api.Assertions.assertThat;

class RecentEventsBufferTest {

    private final RecentEventsBuffer buffer = new RecentEventsBuffer();

    private static AlertTransition transition(String alertId) {
        AlertEvent alert = AlertEvent.builder().alertId(alertId).sensorId("temp-1").state(AlertState.OPEN).build();
        return new AlertTransition(AlertTransition.Kind.CREATED, null, alert, T0);
    }

    @Test
    void transitionsAreNewestFirstAndBounded() {
        for (int i = 0; i < RecentEventsBuffer.MAX_TRANSITIONS + 10; i++) {
            buffer.onAlert(transition("a-" + i));
        }

        assertThat(buffer.recentTransitions(2)).extracting(t -> t.alert().alertId())
                .containsExactly("a-" + (RecentEventsBuffer.MAX_TRANSITIONS + 9), "a-" + (RecentEventsBuffer.MAX_TRANSITIONS + 8));
        assertThat(buffer.recentTransitions(Integer.MAX_VALUE)).hasSize(RecentEventsBuffer.MAX_TRANSITIONS);
    }

    @Test
    void keepsOnlyLatestReadingPerSensor() {
        AnomalyScore normal = AnomalyScore.builder().classification(Classification.NORMAL).build();
        buffer.onReading(new CleanedReading(temperature("temp-2", 20.0, 1), normal));
        buffer.onReading(new CleanedReading(temperature("temp-1", 20.0, 1), normal));
        buffer.onReading(new CleanedReading(temperature("temp-1", 21.0, 2), normal));

        assertThat(buffer.latestReadings()).extracting(CleanedReading::sensorId).containsExactly("temp-1", "temp-2");
        assertThat(buffer.latestReadings().get(0).reading().value()).isEqualTo(21.0);
    }
}
