package envmonitor.pipeline.service.orchestration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Ejecutor particionado por sensor.
 * <p>
 * Mantiene K carriles de un solo hilo. Cada sensor se asigna siempre al mismo carril por hash,
 * así que todas sus tareas (lecturas, reconocimientos, barridos) se ejecutan en orden de envío y
 * nunca en paralelo entre sí, mientras que sensores de carriles distintos avanzan en paralelo.
 */
@Slf4j
public class SensorPartitionExecutor implements AutoCloseable {

    private final List<ExecutorService> lanes;

    public SensorPartitionExecutor(int laneCount) {
        if (laneCount <= 0) {
            throw new IllegalArgumentException("laneCount must be > 0");
        }
        List<ExecutorService> created = new ArrayList<>(laneCount);
        for (int i = 0; i < laneCount; i++) {
            CustomizableThreadFactory factory = new CustomizableThreadFactory("sensor-lane-" + i + "-");
            factory.setDaemon(true);
            created.add(Executors.newSingleThreadExecutor(factory));
        }
        this.lanes = List.copyOf(created);
        log.info("SensorPartitionExecutor inicializado con {} carriles", laneCount);
    }

    public <T> CompletableFuture<T> submit(String sensorKey, Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, lanes.get(laneOf(sensorKey)));
    }

    public int laneOf(String sensorKey) {
        String key = sensorKey == null ? "" : sensorKey;
        return Math.floorMod(key.hashCode(), lanes.size());
    }

    public int laneCount() {
        return lanes.size();
    }

    public boolean isShutdown() {
        return lanes.stream().anyMatch(ExecutorService::isShutdown);
    }

    /**
     * Deja de aceptar tareas y espera a que los carriles vacíen su cola.
     */
    public void shutdown(long timeout, TimeUnit unit) {
        lanes.forEach(ExecutorService::shutdown);
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        for (ExecutorService lane : lanes) {
            long remaining = deadline - System.nanoTime();
            try {
                if (remaining <= 0 || !lane.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Sensor lane did not drain in time; forcing shutdown");
                    lane.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lane.shutdownNow();
            }
        }
    }

    @Override
    public void close() {
        shutdown(10, TimeUnit.SECONDS);
    }
}
