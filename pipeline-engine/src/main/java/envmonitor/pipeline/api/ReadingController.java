package envmonitor.pipeline.api;

import envmonitor.config.ApiRoutes;
import envmonitor.domain.dto.ProcessingOutcome;
import envmonitor.domain.dto.ReadingRequest;
import envmonitor.domain.reading.CleanedReading;
import envmonitor.pipeline.service.orchestration.PipelineOrchestrator;
import envmonitor.pipeline.sink.RecentEventsBuffer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping(ApiRoutes.READINGS)
@RequiredArgsConstructor
@Tag(name = "Ingesta", description = "Entrada de lecturas de sensores")
public class ReadingController {

    private final PipelineOrchestrator orchestrator;
    private final RecentEventsBuffer recentEvents;

    /**
     * Procesa una lectura y devuelve el resultado. Un rechazo no es un error HTTP:
     * la lectura se ha recibido y clasificado, y el motivo viaja en el cuerpo.
     */
    @PostMapping
    @Operation(summary = "Ingerir una lectura y devolver su resultado (aceptada, rechazada o fallo)")
    public ResponseEntity<ProcessingOutcome> ingest(@RequestBody ReadingRequest request) {
        ProcessingOutcome outcome = orchestrator.submit(request.toReading()).join();
        return ResponseEntity.accepted().body(outcome);
    }

    @GetMapping("/latest")
    @Operation(summary = "Última lectura limpia de cada sensor")
    public List<CleanedReading> latest() {
        return recentEvents.latestReadings();
    }
}
