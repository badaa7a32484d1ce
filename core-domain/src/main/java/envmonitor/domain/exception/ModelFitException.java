package envmonitor.domain.exception;

/**
 * No se ha podido ajustar un modelo (pocas muestras, varianza degenerada, timeout).
 * Se recupera conservando la versión anterior del modelo.
 */
public class ModelFitException extends Exception {

    public ModelFitException(String message) {
        super(message);
    }
}
