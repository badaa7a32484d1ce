package envmonitor.pipeline.service.detection;

import lombok.Getter;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Todo lo que comparte un grupo de modelado: la referencia al modelo vigente (el único
 * estado mutable compartido entre la ruta caliente y el reentrenamiento), el buffer de
 * entrenamiento y los contadores de cadencia.
 */
final class ModelGroup {

    @Getter
    private final String name;
    private final AtomicReference<AnomalyModel> current = new AtomicReference<>();
    private final TrainingBuffer buffer;
    private final AtomicBoolean retraining = new AtomicBoolean(false);
    private final AtomicLong versionSequence = new AtomicLong();
    private final AtomicLong samplesSinceRetrain = new AtomicLong();
    private final AtomicReference<Instant> lastRetrainAttempt;

    ModelGroup(String name, int bufferCapacity, Instant createdAt) {
        this.name = name;
        this.buffer = new TrainingBuffer(bufferCapacity);
        this.lastRetrainAttempt = new AtomicReference<>(createdAt);
    }

    Optional<AnomalyModel> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Publica un modelo nuevo. Un modelo más antiguo que el vigente se descarta.
     */
    boolean swap(AnomalyModel candidate) {
        while (true) {
            AnomalyModel existing = current.get();
            if (existing != null && existing.version() >= candidate.version()) {
                return false;
            }
            if (current.compareAndSet(existing, candidate)) {
                return true;
            }
        }
    }

    TrainingBuffer buffer() {
        return buffer;
    }

    long recordSample(double[] features) {
        buffer.add(features);
        return samplesSinceRetrain.incrementAndGet();
    }

    long samplesSinceRetrain() {
        return samplesSinceRetrain.get();
    }

    long nextVersion() {
        return versionSequence.incrementAndGet();
    }

    boolean tryStartRetrain(Instant now) {
        if (!retraining.compareAndSet(false, true)) {
            return false;
        }
        lastRetrainAttempt.set(now);
        samplesSinceRetrain.set(0);
        return true;
    }

    void finishRetrain() {
        retraining.set(false);
    }

    boolean isRetraining() {
        return retraining.get();
    }

    Instant lastRetrainAttempt() {
        return lastRetrainAttempt.get();
    }
}
