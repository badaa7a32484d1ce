package envmonitor.pipeline.service.detection;

import java.time.Instant;

/**
 * Puntuador no supervisado ya entrenado. Las implementaciones deben ser inmutables:
 * una instancia publicada se comparte entre hilos sin sincronización.
 */
public interface AnomalyModel {

    /**
     * Puntuación de anomalía en [0, 1]. En torno a 0.5 o menos es normal; cerca de 1 es muy anómalo.
     */
    double score(double[] features);

    String group();

    long version();

    Instant trainedAt();

    int trainingSamples();
}
