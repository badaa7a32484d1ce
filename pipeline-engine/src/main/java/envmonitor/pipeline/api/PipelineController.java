package envmonitor.pipeline.api;

import envmonitor.config.ApiRoutes;
import envmonitor.domain.dto.DataQualitySnapshot;
import envmonitor.pipeline.service.orchestration.PipelineOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(ApiRoutes.PIPELINE)
@RequiredArgsConstructor
@Tag(name = "Pipeline", description = "Calidad de datos del pipeline")
public class PipelineController {

    private final PipelineOrchestrator orchestrator;

    @GetMapping("/quality")
    @Operation(summary = "Contadores de lecturas aceptadas, rechazadas por motivo y fallos")
    public DataQualitySnapshot getQuality() {
        return orchestrator.qualitySnapshot();
    }
}
