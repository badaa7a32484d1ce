package envmonitor.domain.alert;

import envmonitor.domain.anomaly.Classification;

public enum AlertSeverity {
    WARNING, CRITICAL;

    /**
     * Traduce la clasificación del detector. NORMAL no genera alerta.
     */
    public static AlertSeverity from(Classification classification) {
        return switch (classification) {
            case WARNING -> WARNING;
            case CRITICAL -> CRITICAL;
            case NORMAL -> throw new IllegalArgumentException("NORMAL readings do not carry an alert severity");
        };
    }

    public boolean isMoreSevereThan(AlertSeverity other) {
        return this.ordinal() > other.ordinal();
    }
}
