package envmonitor.pipeline.config;

import envmonitor.config.PipelineConfig;
import envmonitor.pipeline.service.orchestration.SensorPartitionExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfiguration {

    /**
     * Configuración validada al arrancar: si algo no cuadra, el contexto no levanta.
     */
    @Bean
    public PipelineConfig pipelineConfig(PipelineProperties properties) {
        return properties.toConfig().validate();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock pipelineClock() {
        return Clock.systemUTC();
    }

    // El orquestador drena los carriles en su @PreDestroy
    @Bean(destroyMethod = "")
    public SensorPartitionExecutor sensorPartitionExecutor(PipelineConfig config) {
        return new SensorPartitionExecutor(config.workers());
    }

    /**
     * Deja trazada la configuración efectiva en cuanto el contexto está listo.
     */
    @Bean
    public CommandLineRunner pipelineBootstrapReport(PipelineConfig config) {
        return args -> {
            log.info(">>> BOOTSTRAP: pipeline configurado con {} carriles, ventana {} (histórico mínimo {})",
                    config.workers(), config.windowCapacity(), config.minHistory());
            log.info(">>> BOOTSTRAP: modelos por {}, peso {}, reentreno cada {} o {} muestras",
                    config.modelGrouping(), config.modelWeight(),
                    config.retrain().interval(), config.retrain().everySamples());
            config.typeLimits().forEach((type, limits) ->
                    log.info(">>> BOOTSTRAP: {} rango [{}, {}] {} umbrales warn={} crit={}",
                            type.getCode(), limits.validMin(), limits.validMax(), type.getUnit(),
                            limits.warningThreshold(), limits.criticalThreshold()));
            log.info(">>> BOOTSTRAP: SISTEMA LISTO PARA INGESTA.");
        };
    }
}
