package envmonitor.domain.reading;

import envmonitor.domain.sensors.SensorType;
import lombok.Builder;
import lombok.With;

import java.time.Instant;

/**
 * Una medida puntual de un sensor. Inmutable.
 *
 * @param sensorId       Identificador del sensor (clave de partición del pipeline).
 * @param sensorType     Magnitud medida.
 * @param value          Valor medido. {@code null} si el dispositivo no envió valor.
 * @param timestamp      Marca de tiempo de reloj de pared del dispositivo.
 * @param monotonicNanos Marca monótona del emisor, útil para ordenar ráfagas con el mismo timestamp.
 * @param sequenceNo     Número de secuencia por sensor, no decreciente. Puede tener huecos.
 */
@Builder
@With
public record Reading(
        String sensorId,
        SensorType sensorType,
        Double value,
        Instant timestamp,
        long monotonicNanos,
        long sequenceNo) {

    /**
     * Valor primitivo; solo debe llamarse sobre lecturas ya aceptadas por el validador.
     */
    public double requireValue() {
        if (value == null) {
            throw new IllegalStateException("Reading " + sensorId + "#" + sequenceNo + " has no value");
        }
        return value;
    }
}
