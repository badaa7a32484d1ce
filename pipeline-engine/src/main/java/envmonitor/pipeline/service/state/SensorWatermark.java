package envmonitor.pipeline.service.state;

import java.time.Instant;

/**
 * Última secuencia y último timestamp aceptados para un sensor.
 */
public record SensorWatermark(long lastSequenceNo, Instant lastTimestamp) {
}
