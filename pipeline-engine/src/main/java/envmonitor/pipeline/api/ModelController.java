package envmonitor.pipeline.api;

import envmonitor.config.ApiRoutes;
import envmonitor.domain.dto.ModelStatusDTO;
import envmonitor.pipeline.service.detection.RetrainResult;
import envmonitor.pipeline.service.orchestration.PipelineOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping(ApiRoutes.MODELS)
@RequiredArgsConstructor
@Tag(name = "Modelos", description = "Estado y reentrenamiento de los modelos de anomalía")
public class ModelController {

    private final PipelineOrchestrator orchestrator;

    @GetMapping
    @Operation(summary = "Versión vigente y buffer de entrenamiento de cada grupo")
    public List<ModelStatusDTO> getModels() {
        return orchestrator.modelStatuses();
    }

    /**
     * Lanza el reentrenamiento y responde 202 sin esperar al ajuste.
     * Si ya había uno en curso la respuesta lo indica con DEFERRED.
     */
    @PostMapping("/{group}/retrain")
    @Operation(summary = "Forzar el reentrenamiento de un grupo")
    public ResponseEntity<Object> retrain(@PathVariable String group) {
        RetrainResult immediate = orchestrator.forceRetrain(group).getNow(null);
        if (immediate != null) {
            return ResponseEntity.accepted().body(immediate);
        }
        return ResponseEntity.accepted().body(Map.of("group", group, "status", "STARTED"));
    }
}
