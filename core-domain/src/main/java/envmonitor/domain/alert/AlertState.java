package envmonitor.domain.alert;

/**
 * Estados del ciclo de vida de una alerta. RESOLVED es terminal; el sensor puede abrir
 * una alerta nueva más adelante.
 */
public enum AlertState {
    OPEN,
    ESCALATED,
    ACKNOWLEDGED,
    RESOLVED;

    /**
     * Solo OPEN puede escalar automáticamente. ACKNOWLEDGED suprime la escalada.
     */
    public boolean canAutoEscalate() {
        return this == OPEN;
    }

    public boolean canBeAcknowledged() {
        return this == OPEN || this == ESCALATED;
    }
}
