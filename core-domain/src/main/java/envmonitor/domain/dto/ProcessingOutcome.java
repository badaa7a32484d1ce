package envmonitor.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import envmonitor.domain.alert.AlertTransition;
import envmonitor.domain.reading.CleanedReading;
import envmonitor.domain.validation.RejectionReason;

import java.util.List;

/**
 * Resultado del procesado de una lectura por el pipeline.
 *
 * @param status      ACCEPTED, REJECTED o FAULTED.
 * @param rejection   Motivo del rechazo, solo si REJECTED.
 * @param detail      Texto explicativo para rechazos y fallos.
 * @param cleaned     Lectura anotada, solo si ACCEPTED.
 * @param transitions Transiciones de alerta provocadas por la lectura (puede estar vacía).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingOutcome(
        Status status,
        RejectionReason rejection,
        String detail,
        CleanedReading cleaned,
        List<AlertTransition> transitions) {

    public enum Status {
        ACCEPTED, REJECTED, FAULTED
    }

    public ProcessingOutcome {
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    public static ProcessingOutcome accepted(CleanedReading cleaned, List<AlertTransition> transitions) {
        return new ProcessingOutcome(Status.ACCEPTED, null, null, cleaned, transitions);
    }

    public static ProcessingOutcome rejected(RejectionReason reason, String detail) {
        return new ProcessingOutcome(Status.REJECTED, reason, detail, null, List.of());
    }

    public static ProcessingOutcome faulted(String detail) {
        return new ProcessingOutcome(Status.FAULTED, null, detail, null, List.of());
    }
}
