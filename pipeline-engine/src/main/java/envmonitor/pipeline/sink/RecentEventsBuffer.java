package envmonitor.pipeline.sink;

import envmonitor.domain.alert.AlertTransition;
import envmonitor.domain.reading.CleanedReading;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Memoria corta en proceso: últimas transiciones de alerta y última lectura limpia de cada sensor.
 * Alimenta los endpoints de consulta; la persistencia real es cosa de los consumidores.
 */
@Component
public class RecentEventsBuffer implements PipelineEventSink {

    static final int MAX_TRANSITIONS = 500;

    private final Deque<AlertTransition> transitions = new ArrayDeque<>();
    private final Map<String, CleanedReading> latestBySensor = new ConcurrentHashMap<>();

    @Override
    public void onReading(CleanedReading reading) {
        latestBySensor.put(reading.sensorId(), reading);
    }

    @Override
    public synchronized void onAlert(AlertTransition transition) {
        if (transitions.size() == MAX_TRANSITIONS) {
            transitions.removeFirst();
        }
        transitions.addLast(transition);
    }

    /**
     * Transiciones más recientes primero.
     */
    public synchronized List<AlertTransition> recentTransitions(int limit) {
        List<AlertTransition> out = new ArrayList<>(Math.min(limit, transitions.size()));
        var it = transitions.descendingIterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(it.next());
        }
        return out;
    }

    public List<CleanedReading> latestReadings() {
        return latestBySensor.values().stream()
                .sorted(Comparator.comparing(CleanedReading::sensorId))
                .collect(Collectors.toList());
    }
}
