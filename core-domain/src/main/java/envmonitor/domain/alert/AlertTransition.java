package envmonitor.domain.alert;

import java.time.Instant;

/**
 * Delta emitido por el motor de alertas hacia los consumidores (notificaciones, escalado).
 *
 * @param kind          Qué ha pasado.
 * @param previousState Estado anterior, {@code null} si la alerta se acaba de crear.
 * @param alert         Instantánea de la alerta tras aplicar la transición.
 * @param at            Momento de la transición según el reloj del pipeline.
 */
public record AlertTransition(Kind kind, AlertState previousState, AlertEvent alert, Instant at) {

    public enum Kind {
        CREATED,
        OCCURRENCE,
        ESCALATED,
        ACKNOWLEDGED,
        RESOLVED
    }

    public String sensorId() {
        return alert.sensorId();
    }
}
