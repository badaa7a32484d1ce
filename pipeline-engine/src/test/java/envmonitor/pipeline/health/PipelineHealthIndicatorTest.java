package envmonitor.pipeline.health;

import envmonitor.domain.dto.DataQualitySnapshot;
import envmonitor.domain.dto.ModelStatusDTO;
import envmonitor.pipeline.service.orchestration.PipelineOrchestrator;
import envmonitor.pipeline.service.orchestration.SensorPartitionExecutor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineHealthIndicatorTest {

    @Mock
    private SensorPartitionExecutor lanes;

    @Mock
    private PipelineOrchestrator orchestrator;

    @InjectMocks
    private PipelineHealthIndicator indicator;

    @Test
    void reportsUpWithModelAndQualityDetails() {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        when(lanes.isShutdown()).thenReturn(false);
        when(lanes.laneCount()).thenReturn(4);
        when(orchestrator.modelStatuses()).thenReturn(List.of(
                new ModelStatusDTO("temperature", 2, now, 120, 40, false),
                new ModelStatusDTO("humidity", 0, null, 0, 12, true)));
        when(orchestrator.qualitySnapshot()).thenReturn(
                new DataQualitySnapshot(150, Map.of("stale", 3L), 1, 7, now));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("lanes", 4)
                .containsEntry("trackedSensors", 7)
                .containsEntry("modelGroups", 2)
                .containsEntry("trainedModels", 1L)
                .containsEntry("retrainsInProgress", 1L)
                .containsEntry("processingFaults", 1L);
    }

    @Test
    void reportsOutOfServiceOnceLanesAreShutDown() {
        when(lanes.isShutdown()).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
        verifyNoInteractions(orchestrator);
    }
}
