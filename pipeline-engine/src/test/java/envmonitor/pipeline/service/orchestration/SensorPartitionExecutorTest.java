package envmonitor.pipeline.service.orchestration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SensorPartitionExecutorTest {

    private final SensorPartitionExecutor executor = new SensorPartitionExecutor(4);

    @AfterEach
    void tearDown() {
        executor.shutdown(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Las tareas de un mismo sensor se ejecutan en orden de envío")
    void preservesPerSensorOrder() {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            int n = i;
            futures.add(executor.submit("temp-1", () -> {
                seen.add(n);
                return null;
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        assertThat(seen).hasSize(500).isSorted();
    }

    @Test
    @DisplayName("Un mismo sensor nunca se procesa en dos hilos a la vez")
    void neverRunsSameSensorConcurrently() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            futures.add(executor.submit("hum-2", () -> {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                Thread.onSpinWait();
                inFlight.decrementAndGet();
                return null;
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        assertThat(maxInFlight.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Sensores distintos pueden usar carriles distintos")
    void spreadsSensorsAcrossLanes() {
        ConcurrentHashMap<Integer, Boolean> lanes = new ConcurrentHashMap<>();
        for (int i = 0; i < 100; i++) {
            lanes.put(executor.laneOf("sensor-" + i), true);
        }

        assertThat(lanes.keySet()).hasSizeGreaterThan(1);
        assertThat(executor.laneOf(null)).isEqualTo(executor.laneOf(""));
        assertThat(executor.laneCount()).isEqualTo(4);
    }

    @Test
    void rejectsInvalidLaneCount() {
        assertThatThrownBy(() -> new SensorPartitionExecutor(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
