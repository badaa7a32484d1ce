package envmonitor.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Punto de entrada del motor de pipeline.
 * <p>
 * Arranca el contexto: API REST, broker STOMP, actuator y tareas programadas.
 */
@EnableScheduling
@SpringBootApplication(scanBasePackages = "envmonitor")
public class PipelineEngineApplication {

    public static void main(String[] args) {
        // El puerto se puede configurar vía args: --server.port=9090
        SpringApplication.run(PipelineEngineApplication.class, args);
    }
}
