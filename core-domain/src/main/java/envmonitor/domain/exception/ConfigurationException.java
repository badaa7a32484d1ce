package envmonitor.domain.exception;

import java.util.List;

/**
 * Configuración inconsistente detectada al arrancar. Es fatal: el pipeline no debe
 * ejecutarse con umbrales o rangos incoherentes.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> violations;

    public ConfigurationException(List<String> violations) {
        super("Invalid pipeline configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
