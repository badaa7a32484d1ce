package envmonitor.pipeline.api;

import envmonitor.config.ApiRoutes;
import envmonitor.domain.alert.AlertEvent;
import envmonitor.domain.alert.AlertTransition;
import envmonitor.pipeline.service.orchestration.PipelineOrchestrator;
import envmonitor.pipeline.sink.RecentEventsBuffer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping(ApiRoutes.ALERTS)
@RequiredArgsConstructor
@Tag(name = "Alertas", description = "Ciclo de vida de las alertas de anomalía")
public class AlertController {

    private final PipelineOrchestrator orchestrator;
    private final RecentEventsBuffer recentEvents;

    @GetMapping("/active")
    @Operation(summary = "Alertas no resueltas (OPEN, ESCALATED y ACKNOWLEDGED)")
    public List<AlertEvent> getActiveAlerts() {
        return orchestrator.activeAlerts();
    }

    @GetMapping("/recent")
    @Operation(summary = "Últimas transiciones de alerta, más recientes primero")
    public List<AlertTransition> getRecentTransitions(@RequestParam(defaultValue = "50") int limit) {
        return recentEvents.recentTransitions(Math.max(0, limit));
    }

    /**
     * Reconocer una alerta ya reconocida no cambia nada y responde 204.
     */
    @PostMapping("/{id}/ack")
    @Operation(summary = "Reconocer (Acknowledge) una alerta")
    public ResponseEntity<AlertTransition> acknowledgeAlert(@PathVariable String id) {
        Optional<AlertTransition> transition = orchestrator.acknowledge(id).join();
        return transition.map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
