package envmonitor.pipeline.service.detection;

/**
 * Resultado de un intento de reentrenamiento.
 *
 * @param group   grupo de modelado
 * @param outcome qué ocurrió
 * @param version versión del modelo publicado, o del intento fallido (0 si no llegó a empezar)
 * @param detail  explicación legible
 */
public record RetrainResult(String group, Outcome outcome, long version, String detail) {

    public enum Outcome {
        /** Modelo nuevo publicado. */
        SWAPPED,
        /** El ajuste falló; se conserva el modelo anterior. */
        FIT_FAILED,
        /** El ajuste superó el timeout y se canceló. */
        TIMED_OUT,
        /** Ya había un reentrenamiento en curso para el grupo. */
        DEFERRED
    }

    public boolean isSwapped() {
        return outcome == Outcome.SWAPPED;
    }

    static RetrainResult swapped(String group, long version) {
        return new RetrainResult(group, Outcome.SWAPPED, version, "model v" + version + " published");
    }

    static RetrainResult fitFailed(String group, long version, String detail) {
        return new RetrainResult(group, Outcome.FIT_FAILED, version, detail);
    }

    static RetrainResult timedOut(String group, long version, String detail) {
        return new RetrainResult(group, Outcome.TIMED_OUT, version, detail);
    }

    static RetrainResult deferred(String group) {
        return new RetrainResult(group, Outcome.DEFERRED, 0L, "retrain already in progress");
    }
}
