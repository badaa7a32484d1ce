package envmonitor.domain.dto;

import java.time.Instant;

/**
 * Estado del modelo vigente de un grupo. {@code version} es 0 si el grupo aún no tiene modelo.
 */
public record ModelStatusDTO(
        String group,
        long version,
        Instant trainedAt,
        int trainingSamples,
        int bufferedSamples,
        boolean retrainInProgress) {
}
