package envmonitor.domain.reading;

import envmonitor.domain.anomaly.AnomalyScore;

/**
 * Lectura aceptada y anotada con su puntuación de anomalía, tal y como se publica
 * hacia el dashboard y los consumidores de series temporales.
 */
public record CleanedReading(Reading reading, AnomalyScore score) {

    public String sensorId() {
        return reading.sensorId();
    }
}
