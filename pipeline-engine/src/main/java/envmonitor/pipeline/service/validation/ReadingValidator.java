package envmonitor.pipeline.service.validation;

import envmonitor.config.PipelineConfig;
import envmonitor.config.SensorTypeLimits;
import envmonitor.domain.reading.Reading;
import envmonitor.domain.sensors.SensorType;
import envmonitor.domain.validation.RejectionReason;
import envmonitor.domain.validation.ValidationResult;
import envmonitor.pipeline.service.state.SensorWatermark;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Comprobaciones estructurales, de rango, de secuencia y de retraso sobre una lectura.
 * <p>
 * No tiene efectos secundarios: solo clasifica. El orden de las comprobaciones es
 * identidad/estructura, secuencia duplicada, valor, retraso y rango; así una secuencia
 * repetida se rechaza como duplicada sea cual sea su valor.
 */
@Component
@RequiredArgsConstructor
public class ReadingValidator {

    private final PipelineConfig config;

    /**
     * @param reading lectura entrante
     * @param prior   marca de agua del sensor, {@code null} si aún no hay lecturas aceptadas
     */
    public ValidationResult validate(Reading reading, SensorWatermark prior) {
        if (reading == null) {
            return ValidationResult.rejected(RejectionReason.MALFORMED, "null reading");
        }
        if (reading.sensorId() == null || reading.sensorId().isBlank()) {
            return ValidationResult.rejected(RejectionReason.MALFORMED, "missing sensor id");
        }
        if (reading.sensorType() == null || reading.sensorType() == SensorType.UNKNOWN) {
            return ValidationResult.rejected(RejectionReason.MALFORMED, "unknown sensor type");
        }
        if (reading.timestamp() == null) {
            return ValidationResult.rejected(RejectionReason.MALFORMED, "missing timestamp");
        }
        if (reading.sequenceNo() < 0) {
            return ValidationResult.rejected(RejectionReason.MALFORMED, "missing or negative sequence number");
        }

        if (prior != null && reading.sequenceNo() <= prior.lastSequenceNo()) {
            return ValidationResult.rejected(RejectionReason.DUPLICATE_SEQUENCE,
                    "sequence " + reading.sequenceNo() + " <= last accepted " + prior.lastSequenceNo());
        }

        Double value = reading.value();
        if (value == null) {
            return ValidationResult.rejected(RejectionReason.MALFORMED, "missing value");
        }
        if (!Double.isFinite(value)) {
            return ValidationResult.rejected(RejectionReason.MALFORMED, "non-finite value " + value);
        }

        if (prior != null) {
            Instant oldestAllowed = prior.lastTimestamp().minus(config.stalenessTolerance());
            if (reading.timestamp().isBefore(oldestAllowed)) {
                return ValidationResult.rejected(RejectionReason.STALE,
                        "timestamp " + reading.timestamp() + " is older than " + oldestAllowed);
            }
        }

        SensorTypeLimits limits = config.limitsFor(reading.sensorType());
        if (!limits.isPlausible(value)) {
            return ValidationResult.rejected(RejectionReason.OUT_OF_RANGE,
                    String.format("%s value %.3f outside [%.3f, %.3f]",
                            reading.sensorType().getCode(), value, limits.validMin(), limits.validMax()));
        }

        return ValidationResult.accepted();
    }
}
