package envmonitor.pipeline.api;

import envmonitor.domain.exception.ConfigurationException;
import envmonitor.domain.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.CompletionException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Alerta o grupo de modelos inexistente.
     * Log: WARN (error del cliente, no del sistema).
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Object> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return body(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, ConfigurationException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Object> handleBadRequest(RuntimeException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage());
    }

    /**
     * Las operaciones que pasan por los carriles de sensor llegan envueltas; se desenvuelven
     * para responder con el estado de la causa real.
     */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Object> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ResourceNotFoundException notFound) {
            return handleNotFound(notFound);
        }
        if (cause instanceof IllegalArgumentException badRequest) {
            return handleBadRequest(badRequest);
        }
        return handleGeneralErrors(cause instanceof Exception e ? e : ex);
    }

    /**
     * Todo lo demás. Log: ERROR con traza completa.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected System Error occurred", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support referencing this timestamp.");
    }

    private static ResponseEntity<Object> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", status.value(),
                "error", error,
                "message", message == null ? "" : message
        ));
    }
}
