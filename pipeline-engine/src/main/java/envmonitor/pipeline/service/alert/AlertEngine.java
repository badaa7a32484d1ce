package envmonitor.pipeline.service.alert;

import envmonitor.config.PipelineConfig;
import envmonitor.domain.alert.AlertEvent;
import envmonitor.domain.alert.AlertSeverity;
import envmonitor.domain.alert.AlertState;
import envmonitor.domain.alert.AlertTransition;
import envmonitor.domain.anomaly.AnomalyScore;
import envmonitor.domain.exception.ResourceNotFoundException;
import envmonitor.domain.sensors.SensorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Máquina de estados de alertas por sensor: OPEN → ESCALATED → ACKNOWLEDGED → RESOLVED.
 * <p>
 * Invariante: como mucho una alerta no resuelta por sensor. Las alertas resueltas salen del
 * mapa de activas; el sensor puede abrir una nueva más tarde.
 * <p>
 * Concurrencia: los métodos que mutan una alerta ({@link #onScore}, {@link #acknowledge},
 * {@link #sweep}) deben invocarse desde el carril del sensor afectado. Los mapas son concurrentes
 * para que la API pueda consultarlos sin pasar por los carriles.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertEngine {

    private final PipelineConfig config;

    private final Map<String, Tracked> activeBySensor = new ConcurrentHashMap<>();
    private final Map<String, String> sensorByAlertId = new ConcurrentHashMap<>();

    /**
     * Alerta viva y el instante (reloj del pipeline) en que se registró su última anomalía.
     * El periodo de silencio se mide con ese reloj, no con los timestamps de los dispositivos.
     */
    private record Tracked(AlertEvent alert, Instant lastAnomalyAt) {
    }

    /**
     * Aplica la clasificación de una lectura. Una lectura normal no produce transiciones:
     * la resolución depende solo del barrido temporal.
     */
    public Optional<AlertTransition> onScore(AnomalyScore score, SensorType sensorType, Instant now) {
        if (!score.isAnomalous()) {
            return Optional.empty();
        }
        String sensorId = score.sensorId();
        AlertSeverity severity = AlertSeverity.from(score.classification());
        Tracked tracked = activeBySensor.get(sensorId);

        if (tracked == null) {
            AlertEvent created = AlertEvent.builder()
                    .alertId(UUID.randomUUID().toString())
                    .sensorId(sensorId)
                    .sensorType(sensorType)
                    .firstSeen(score.timestamp())
                    .lastSeen(score.timestamp())
                    .severity(severity)
                    .occurrenceCount(1)
                    .state(AlertState.OPEN)
                    .peakScore(score.combinedScore())
                    .build();
            activeBySensor.put(sensorId, new Tracked(created, now));
            sensorByAlertId.put(created.alertId(), sensorId);
            log.info("Alert {} opened for sensor {} ({}, score {})", created.alertId(), sensorId, severity,
                    String.format("%.2f", score.combinedScore()));
            return Optional.of(new AlertTransition(AlertTransition.Kind.CREATED, null, created, now));
        }

        AlertEvent previous = tracked.alert();
        boolean severityIncreased = severity.isMoreSevereThan(previous.severity());
        long count = previous.occurrenceCount() + 1;

        AlertEvent updated = previous.toBuilder()
                .occurrenceCount(count)
                .lastSeen(latest(previous.lastSeen(), score.timestamp()))
                .severity(severityIncreased ? severity : previous.severity())
                .peakScore(Math.max(previous.peakScore(), score.combinedScore()))
                .build();

        AlertTransition.Kind kind = AlertTransition.Kind.OCCURRENCE;
        if (previous.state().canAutoEscalate()
                && (count >= config.alert().escalationOccurrences() || severityIncreased)) {
            updated = updated.withState(AlertState.ESCALATED);
            kind = AlertTransition.Kind.ESCALATED;
            log.info("Alert {} for sensor {} escalated (occurrences={}, severity={})",
                    updated.alertId(), sensorId, count, updated.severity());
        }

        activeBySensor.put(sensorId, new Tracked(updated, now));
        return Optional.of(new AlertTransition(kind, previous.state(), updated, now));
    }

    /**
     * Reconocimiento externo. OPEN/ESCALATED pasan a ACKNOWLEDGED; reconocer una alerta ya
     * reconocida no produce transición.
     *
     * @throws ResourceNotFoundException si no hay ninguna alerta activa con ese id
     */
    public Optional<AlertTransition> acknowledge(String alertId, Instant now) {
        String sensorId = sensorByAlertId.get(alertId);
        Tracked tracked = sensorId == null ? null : activeBySensor.get(sensorId);
        if (tracked == null || !tracked.alert().alertId().equals(alertId)) {
            throw new ResourceNotFoundException("No active alert with id " + alertId);
        }
        AlertEvent previous = tracked.alert();
        if (!previous.state().canBeAcknowledged()) {
            return Optional.empty();
        }
        AlertEvent acknowledged = previous.toBuilder()
                .state(AlertState.ACKNOWLEDGED)
                .acknowledgedAt(now)
                .build();
        activeBySensor.put(sensorId, new Tracked(acknowledged, tracked.lastAnomalyAt()));
        log.info("Alert {} for sensor {} acknowledged", alertId, sensorId);
        return Optional.of(new AlertTransition(AlertTransition.Kind.ACKNOWLEDGED, previous.state(), acknowledged, now));
    }

    /**
     * Resuelve la alerta del sensor si lleva el periodo de silencio configurado sin anomalías.
     * Idempotente: una vez resuelta la alerta deja de estar activa y los barridos siguientes no hacen nada.
     */
    public Optional<AlertTransition> sweep(String sensorId, Instant now) {
        Tracked tracked = activeBySensor.get(sensorId);
        if (tracked == null) {
            return Optional.empty();
        }
        Duration quiet = config.alert().quietPeriod();
        if (now.isBefore(tracked.lastAnomalyAt().plus(quiet))) {
            return Optional.empty();
        }
        AlertEvent previous = tracked.alert();
        AlertEvent resolved = previous.toBuilder()
                .state(AlertState.RESOLVED)
                .resolvedAt(now)
                .build();
        activeBySensor.remove(sensorId);
        sensorByAlertId.remove(previous.alertId());
        log.info("Alert {} for sensor {} resolved after {} of silence ({} occurrences)",
                previous.alertId(), sensorId, quiet, previous.occurrenceCount());
        return Optional.of(new AlertTransition(AlertTransition.Kind.RESOLVED, previous.state(), resolved, now));
    }

    public Optional<AlertEvent> activeFor(String sensorId) {
        Tracked tracked = activeBySensor.get(sensorId);
        return tracked == null ? Optional.empty() : Optional.of(tracked.alert());
    }

    public Optional<String> sensorOf(String alertId) {
        return Optional.ofNullable(sensorByAlertId.get(alertId));
    }

    public Set<String> sensorsWithActiveAlerts() {
        return Set.copyOf(activeBySensor.keySet());
    }

    public List<AlertEvent> activeAlerts() {
        return activeBySensor.values().stream()
                .map(Tracked::alert)
                .sorted(Comparator.comparing(AlertEvent::firstSeen))
                .collect(Collectors.toList());
    }

    private static Instant latest(Instant a, Instant b) {
        return b.isAfter(a) ? b : a;
    }
}
