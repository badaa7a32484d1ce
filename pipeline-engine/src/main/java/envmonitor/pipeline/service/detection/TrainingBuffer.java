package envmonitor.pipeline.service.detection;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Historial acotado de vectores de características de un grupo. Lo alimentan varios
 * carriles a la vez (varios sensores por grupo), así que el acceso está sincronizado;
 * el reentrenamiento trabaja sobre una copia obtenida con {@link #snapshot()}.
 */
final class TrainingBuffer {

    private final int capacity;
    private final Deque<double[]> samples;

    TrainingBuffer(int capacity) {
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(capacity);
    }

    synchronized void add(double[] features) {
        if (samples.size() == capacity) {
            samples.removeFirst();
        }
        samples.addLast(features.clone());
    }

    synchronized double[][] snapshot() {
        double[][] out = new double[samples.size()][];
        int i = 0;
        for (double[] row : samples) {
            out[i++] = row.clone();
        }
        return out;
    }

    synchronized int size() {
        return samples.size();
    }
}
