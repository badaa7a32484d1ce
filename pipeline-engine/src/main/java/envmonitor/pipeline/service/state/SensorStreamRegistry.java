package envmonitor.pipeline.service.state;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Guarda el {@link StreamState} vigente de cada sensor.
 * <p>
 * El mapa es concurrente solo para permitir lecturas desde la API; cada entrada la escribe
 * exclusivamente el carril de ejecución al que está asignado su sensor.
 */
@Component
public class SensorStreamRegistry {

    private final Map<String, StreamState> states = new ConcurrentHashMap<>();

    public Optional<StreamState> find(String sensorId) {
        return Optional.ofNullable(states.get(sensorId));
    }

    public void put(StreamState state) {
        states.put(state.getSensorId(), state);
    }

    public int trackedSensors() {
        return states.size();
    }
}
