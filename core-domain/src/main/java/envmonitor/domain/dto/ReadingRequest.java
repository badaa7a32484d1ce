package envmonitor.domain.dto;

import envmonitor.domain.reading.Reading;
import envmonitor.domain.sensors.SensorType;

import java.time.Instant;

/**
 * Cuerpo JSON de ingesta. Se traduce a {@link Reading} sin validar: la validación
 * es responsabilidad del pipeline, que cuenta el rechazo como métrica de calidad.
 */
public record ReadingRequest(
        String sensorId,
        String sensorType,
        Double value,
        Instant timestamp,
        Long monotonicNanos,
        Long sequenceNo) {

    public Reading toReading() {
        return Reading.builder()
                .sensorId(sensorId)
                .sensorType(SensorType.fromString(sensorType))
                .value(value)
                .timestamp(timestamp)
                .monotonicNanos(monotonicNanos == null ? 0L : monotonicNanos)
                .sequenceNo(sequenceNo == null ? -1L : sequenceNo)
                .build();
    }
}
