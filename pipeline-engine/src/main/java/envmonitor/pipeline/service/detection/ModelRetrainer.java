package envmonitor.pipeline.service.detection;

import envmonitor.config.PipelineConfig;
import envmonitor.domain.exception.ModelFitException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reentrenamiento en segundo plano de los modelos de cada grupo.
 * <p>
 * Garantías:
 * <ul>
 *     <li>Como mucho un reentrenamiento en curso por grupo. Si llega otro mientras tanto, se descarta (DEFERRED).</li>
 *     <li>El ajuste trabaja sobre una copia del buffer y corre en hilos de baja prioridad; nunca bloquea los carriles.</li>
 *     <li>El ajuste tiene un timeout; al vencer se interrumpe el hilo y el entrenador aborta entre árboles.
 *     El grupo no se libera hasta que el ajuste se detiene de verdad.</li>
 *     <li>Un fallo de ajuste conserva el modelo anterior (o ninguno) y solo se registra en el log.</li>
 * </ul>
 */
@Slf4j
@Component
public class ModelRetrainer {

    public enum Trigger {
        SCHEDULE, SAMPLE_COUNT, MANUAL
    }

    private final ModelRegistry registry;
    private final ModelTrainer trainer;
    private final PipelineConfig config;
    private final Clock clock;

    // Supervisores: esperan al ajuste con timeout
    private final ExecutorService supervisors;
    // Ajustes propiamente dichos (prioridad mínima)
    private final ExecutorService fitters;

    public ModelRetrainer(ModelRegistry registry, ModelTrainer trainer, PipelineConfig config, Clock clock) {
        this.registry = registry;
        this.trainer = trainer;
        this.config = config;
        this.clock = clock;

        CustomizableThreadFactory supervisorFactory = new CustomizableThreadFactory("model-retrain-");
        supervisorFactory.setDaemon(true);
        this.supervisors = Executors.newCachedThreadPool(supervisorFactory);

        CustomizableThreadFactory fitFactory = new CustomizableThreadFactory("model-fit-");
        fitFactory.setDaemon(true);
        fitFactory.setThreadPriority(Thread.MIN_PRIORITY);
        this.fitters = Executors.newCachedThreadPool(fitFactory);
    }

    /**
     * Pide un reentrenamiento del grupo. Nunca bloquea: devuelve un future que se completa al terminar
     * el intento (o inmediatamente con DEFERRED si ya había uno en curso).
     */
    public CompletableFuture<RetrainResult> requestRetrain(String group, Trigger trigger) {
        ModelGroup g = registry.groupFor(group);
        if (!g.tryStartRetrain(clock.instant())) {
            if (trigger == Trigger.SAMPLE_COUNT) {
                log.debug("Retrain for {} deferred ({}): previous run still in progress", group, trigger);
            } else {
                log.warn("Retrain for {} deferred ({}): previous run still in progress", group, trigger);
            }
            return CompletableFuture.completedFuture(RetrainResult.deferred(group));
        }

        CompletableFuture<RetrainResult> result = new CompletableFuture<>();
        try {
            supervisors.execute(() -> result.complete(runRetrain(g, trigger)));
        } catch (RejectedExecutionException e) {
            g.finishRetrain();
            log.warn("Retrain for {} rejected: executor is shutting down", group);
            result.complete(RetrainResult.fitFailed(group, 0L, "retrain executor is shut down"));
        }
        return result;
    }

    /**
     * Llamado desde la ruta caliente tras añadir una muestra al buffer del grupo.
     */
    public void onSampleRecorded(String group, long samplesSinceRetrain) {
        int every = config.retrain().everySamples();
        if (every <= 0 || samplesSinceRetrain < every) {
            return;
        }
        ModelGroup g = registry.groupFor(group);
        if (!g.isRetraining()) {
            requestRetrain(group, Trigger.SAMPLE_COUNT);
        }
    }

    /**
     * Tick periódico: lanza los reentrenamientos cuya cadencia temporal ha vencido.
     *
     * @return número de reentrenamientos lanzados
     */
    public int tick() {
        Duration interval = config.retrain().interval();
        if (interval.isZero()) {
            return 0;
        }
        Instant now = clock.instant();
        int launched = 0;
        for (ModelGroup g : registry.allGroups()) {
            if (g.isRetraining()) continue;
            if (!now.isBefore(g.lastRetrainAttempt().plus(interval))) {
                requestRetrain(g.getName(), Trigger.SCHEDULE);
                launched++;
            }
        }
        return launched;
    }

    /**
     * El grupo queda bloqueado hasta que terminan tanto el supervisor como la tarea de ajuste.
     * Tras un timeout el ajuste puede seguir corriendo si no atiende la interrupción; mientras
     * tanto cualquier petición nueva para el grupo sale como DEFERRED.
     */
    private RetrainResult runRetrain(ModelGroup g, Trigger trigger) {
        String group = g.getName();
        long version = g.nextVersion();
        long timeoutMs = config.retrain().timeout().toMillis();
        FitLease lease = new FitLease(g);
        Future<AnomalyModel> fit = null;
        try {
            double[][] snapshot = g.buffer().snapshot();
            log.info("Retraining {} (trigger={}, v{}, {} samples)", group, trigger, version, snapshot.length);

            fit = fitters.submit(() -> {
                if (!lease.claimForFit()) {
                    return null;
                }
                try {
                    return trainer.fit(group, version, snapshot);
                } finally {
                    lease.release();
                }
            });
            AnomalyModel model = fit.get(timeoutMs, TimeUnit.MILLISECONDS);

            if (g.swap(model)) {
                log.info("Model for {} swapped to v{} ({} samples)", group, version, model.trainingSamples());
                return RetrainResult.swapped(group, version);
            }
            log.warn("Model v{} for {} discarded: a newer version is already published", version, group);
            return RetrainResult.fitFailed(group, version, "superseded by a newer model");

        } catch (TimeoutException e) {
            fit.cancel(true);
            log.warn("Retrain for {} timed out after {} ms; keeping previous model. The group stays locked until the fit stops",
                    group, timeoutMs);
            return RetrainResult.timedOut(group, version, "fit exceeded " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ModelFitException) {
                log.warn("Model fit skipped for {}: {}. Keeping previous model.", group, cause.getMessage());
            } else {
                log.warn("Model fit failed for {}; keeping previous model", group, cause);
            }
            return RetrainResult.fitFailed(group, version, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (fit != null) fit.cancel(true);
            log.warn("Retrain for {} interrupted", group);
            return RetrainResult.fitFailed(group, version, "interrupted");
        } catch (RejectedExecutionException e) {
            log.warn("Retrain for {} rejected: executor is shutting down", group);
            return RetrainResult.fitFailed(group, version, "fit executor is shut down");
        } finally {
            lease.releaseSupervisor();
        }
    }

    /**
     * Reparto del bloqueo de reentrenamiento entre supervisor y tarea de ajuste. El último
     * de los dos en terminar libera el grupo.
     */
    private static final class FitLease {
        private final ModelGroup group;
        private final AtomicBoolean fitClaimed = new AtomicBoolean(false);
        private final AtomicInteger holders = new AtomicInteger(2);

        FitLease(ModelGroup group) {
            this.group = group;
        }

        /** La tarea de ajuste solo arranca si el supervisor no la ha dado ya por perdida. */
        boolean claimForFit() {
            return fitClaimed.compareAndSet(false, true);
        }

        void release() {
            if (holders.decrementAndGet() == 0) {
                group.finishRetrain();
            }
        }

        void releaseSupervisor() {
            // Ajuste nunca arrancado (rechazado o cancelado antes de ejecutarse): se libera su parte aquí
            if (fitClaimed.compareAndSet(false, true)) {
                release();
            }
            release();
        }
    }

    @PreDestroy
    public void shutdown() {
        supervisors.shutdownNow();
        fitters.shutdownNow();
    }
}
