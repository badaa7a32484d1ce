package envmonitor.config;

import envmonitor.domain.anomaly.Classification;
import lombok.Builder;
import lombok.With;

/**
 * Parámetros por tipo de sensor.
 *
 * @param validMin          Cota inferior de plausibilidad física (sanity check, no detección de novedad).
 * @param validMax          Cota superior de plausibilidad física.
 * @param warningThreshold  Combined score a partir del cual la lectura es WARNING.
 * @param criticalThreshold Combined score a partir del cual la lectura es CRITICAL.
 */
@Builder
@With
public record SensorTypeLimits(
        double validMin,
        double validMax,
        double warningThreshold,
        double criticalThreshold) {

    public boolean isPlausible(double value) {
        return value >= validMin && value <= validMax;
    }

    public Classification classify(double combinedScore) {
        if (combinedScore >= criticalThreshold) return Classification.CRITICAL;
        if (combinedScore >= warningThreshold) return Classification.WARNING;
        return Classification.NORMAL;
    }
}
