package envmonitor.domain.anomaly;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.time.Instant;

/**
 * Puntuación derivada de una lectura. No es autoritativa: se puede recalcular
 * a partir del estado del stream, el modelo y la lectura.
 *
 * @param sensorId         Sensor puntuado.
 * @param timestamp        Timestamp de la lectura puntuada.
 * @param statisticalScore |z| contra la media y desviación del histórico del sensor.
 * @param modelScore       Puntuación del modelo no supervisado en [0, 1], o {@code null} si no había modelo.
 * @param modelVersion     Versión del modelo usado, o {@code null}.
 * @param combinedScore    Mezcla ponderada que decide la clasificación.
 * @param classification   Resultado tras aplicar los umbrales del tipo de sensor.
 */
@Builder
public record AnomalyScore(
        String sensorId,
        Instant timestamp,
        double statisticalScore,
        Double modelScore,
        Long modelVersion,
        double combinedScore,
        Classification classification) {

    @JsonIgnore
    public boolean isAnomalous() {
        return classification.isAnomalous();
    }
}
