package envmonitor.domain.alert;

import envmonitor.domain.sensors.SensorType;
import lombok.Builder;
import lombok.With;

import java.time.Instant;

/**
 * Instantánea inmutable de una alerta. El motor de alertas sustituye la instantánea
 * en cada transición; los consumidores reciben copias, nunca una referencia viva.
 *
 * @param alertId         Identificador único (UUID).
 * @param sensorId        Sensor al que pertenece. Como mucho una alerta no resuelta por sensor.
 * @param sensorType      Tipo de sensor, para enrutar notificaciones.
 * @param firstSeen       Timestamp de la primera lectura anómala.
 * @param lastSeen        Timestamp de la última lectura anómala registrada.
 * @param severity        Gravedad máxima observada. Nunca baja.
 * @param occurrenceCount Número de lecturas anómalas registradas. Nunca baja.
 * @param state           Estado actual.
 * @param peakScore       Mayor combined score observado.
 * @param acknowledgedAt  Momento del reconocimiento por un operador, o {@code null}.
 * @param resolvedAt      Momento de la resolución, o {@code null}.
 */
@Builder(toBuilder = true)
@With
public record AlertEvent(
        String alertId,
        String sensorId,
        SensorType sensorType,
        Instant firstSeen,
        Instant lastSeen,
        AlertSeverity severity,
        long occurrenceCount,
        AlertState state,
        double peakScore,
        Instant acknowledgedAt,
        Instant resolvedAt) {
}
