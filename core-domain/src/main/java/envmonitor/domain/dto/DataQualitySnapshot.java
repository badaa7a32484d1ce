package envmonitor.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Contadores de calidad de datos expuestos al dashboard.
 *
 * @param accepted          Lecturas aceptadas.
 * @param rejectedByReason  Rechazos por motivo (etiqueta del motivo -> total).
 * @param processingFaults  Fallos aislados durante el procesado de una lectura.
 * @param trackedSensors    Sensores con estado vivo en el pipeline.
 * @param generatedAt       Momento de la instantánea.
 */
public record DataQualitySnapshot(
        long accepted,
        Map<String, Long> rejectedByReason,
        long processingFaults,
        int trackedSensors,
        Instant generatedAt) {

    @JsonProperty("totalRejected")
    public long totalRejected() {
        return rejectedByReason.values().stream().mapToLong(Long::longValue).sum();
    }
}
