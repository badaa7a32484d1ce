package envmonitor.domain.anomaly;

/**
 * Clasificación de una lectura. El orden de declaración es el orden de gravedad.
 */
public enum Classification {
    NORMAL,
    WARNING,
    CRITICAL;

    public boolean isAnomalous() {
        return this != NORMAL;
    }

    public boolean isMoreSevereThan(Classification other) {
        return this.ordinal() > other.ordinal();
    }
}
