package envmonitor.pipeline.api;

import envmonitor.domain.alert.AlertEvent;
import envmonitor.domain.alert.AlertSeverity;
import envmonitor.domain.alert.AlertState;
import envmonitor.domain.alert.AlertTransition;
import envmonitor.domain.exception.ResourceNotFoundException;
import envmonitor.domain.sensors.SensorType;
import envmonitor.pipeline.service.orchestration.PipelineOrchestrator;
import envmonitor.pipeline.sink.RecentEventsBuffer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AlertController.class)
class AlertControllerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PipelineOrchestrator orchestrator;

    @MockBean
    private RecentEventsBuffer recentEvents;

    private static AlertEvent alert(AlertState state) {
        return AlertEvent.builder()
                .alertId("a-1")
                .sensorId("temp-1")
                .sensorType(SensorType.TEMPERATURE)
                .firstSeen(T0)
                .lastSeen(T0)
                .severity(AlertSeverity.CRITICAL)
                .occurrenceCount(1)
                .state(state)
                .peakScore(9.5)
                .build();
    }

    @Test
    void getActiveAlerts_ShouldReturnList() throws Exception {
        given(orchestrator.activeAlerts()).willReturn(List.of(alert(AlertState.OPEN)));

        mockMvc.perform(get("/api/v1/alerts/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].alertId").value("a-1"))
                .andExpect(jsonPath("$[0].state").value("OPEN"))
                .andExpect(jsonPath("$[0].severity").value("CRITICAL"))
                .andExpect(jsonPath("$[0].firstSeen").value("2024-05-01T10:00:00Z"));
    }

    @Test
    void acknowledge_ShouldReturnTransition() throws Exception {
        AlertTransition ack = new AlertTransition(AlertTransition.Kind.ACKNOWLEDGED, AlertState.OPEN,
                alert(AlertState.ACKNOWLEDGED), T0);
        given(orchestrator.acknowledge("a-1")).willReturn(CompletableFuture.completedFuture(Optional.of(ack)));

        mockMvc.perform(post("/api/v1/alerts/a-1/ack"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("ACKNOWLEDGED"))
                .andExpect(jsonPath("$.alert.state").value("ACKNOWLEDGED"));
    }

    @Test
    void acknowledgeTwice_ShouldReturnNoContent() throws Exception {
        given(orchestrator.acknowledge("a-1")).willReturn(CompletableFuture.completedFuture(Optional.empty()));

        mockMvc.perform(post("/api/v1/alerts/a-1/ack"))
                .andExpect(status().isNoContent());
    }

    @Test
    void acknowledgeUnknown_ShouldReturn404() throws Exception {
        given(orchestrator.acknowledge("ghost")).willThrow(new ResourceNotFoundException("Alert not found or already resolved: ghost"));

        mockMvc.perform(post("/api/v1/alerts/ghost/ack"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.message").value("Alert not found or already resolved: ghost"));
    }

    @Test
    void recent_ShouldHonourLimit() throws Exception {
        AlertTransition created = new AlertTransition(AlertTransition.Kind.CREATED, null, alert(AlertState.OPEN), T0);
        given(recentEvents.recentTransitions(5)).willReturn(List.of(created));

        mockMvc.perform(get("/api/v1/alerts/recent").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].kind").value("CREATED"));
    }
}
