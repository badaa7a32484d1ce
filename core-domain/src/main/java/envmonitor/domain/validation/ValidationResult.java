package envmonitor.domain.validation;

import java.util.Objects;
import java.util.Optional;

/**
 * Resultado de validar una lectura: aceptada, o rechazada con un motivo y un detalle legible.
 * Una lectura rechazada nunca llega al estado del stream ni al detector.
 */
public final class ValidationResult {

    private static final ValidationResult ACCEPTED = new ValidationResult(null, null);

    private final RejectionReason reason;
    private final String detail;

    private ValidationResult(RejectionReason reason, String detail) {
        this.reason = reason;
        this.detail = detail;
    }

    public static ValidationResult accepted() {
        return ACCEPTED;
    }

    public static ValidationResult rejected(RejectionReason reason, String detail) {
        return new ValidationResult(Objects.requireNonNull(reason, "reason"), detail);
    }

    public boolean isAccepted() {
        return reason == null;
    }

    public Optional<RejectionReason> getReason() {
        return Optional.ofNullable(reason);
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationResult that)) return false;
        return reason == that.reason && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reason, detail);
    }

    @Override
    public String toString() {
        return isAccepted() ? "Accepted" : "Rejected{" + reason.getTag() + ": " + detail + "}";
    }
}
