package envmonitor.domain.validation;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RejectionReason {
    OUT_OF_RANGE("out_of_range"),
    MALFORMED("malformed"),
    STALE("stale"),
    DUPLICATE_SEQUENCE("duplicate_sequence");

    // Etiqueta usada en métricas y en la API
    private final String tag;
}
