package envmonitor.pipeline.health;

import envmonitor.domain.dto.DataQualitySnapshot;
import envmonitor.domain.dto.ModelStatusDTO;
import envmonitor.pipeline.service.orchestration.PipelineOrchestrator;
import envmonitor.pipeline.service.orchestration.SensorPartitionExecutor;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Expone en /actuator/health si los carriles aceptan trabajo y cómo van los modelos.
 */
@Component("pipeline")
@RequiredArgsConstructor
public class PipelineHealthIndicator implements HealthIndicator {

    private final SensorPartitionExecutor lanes;
    private final PipelineOrchestrator orchestrator;

    @Override
    public Health health() {
        if (lanes.isShutdown()) {
            return Health.outOfService().withDetail("lanes", "shut down").build();
        }
        List<ModelStatusDTO> models = orchestrator.modelStatuses();
        DataQualitySnapshot quality = orchestrator.qualitySnapshot();
        return Health.up()
                .withDetail("lanes", lanes.laneCount())
                .withDetail("trackedSensors", quality.trackedSensors())
                .withDetail("modelGroups", models.size())
                .withDetail("trainedModels", models.stream().filter(m -> m.version() > 0).count())
                .withDetail("retrainsInProgress", models.stream().filter(ModelStatusDTO::retrainInProgress).count())
                .withDetail("processingFaults", quality.processingFaults())
                .build();
    }
}
