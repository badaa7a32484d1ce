package envmonitor.pipeline.service.detection;

import envmonitor.config.PipelineConfig;
import envmonitor.domain.dto.ModelStatusDTO;
import envmonitor.domain.reading.Reading;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registro de grupos de modelado. Resuelve a qué grupo pertenece una lectura según
 * {@link PipelineConfig.ModelGrouping} y guarda, por grupo, la referencia atómica al modelo vigente.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelRegistry {

    private final PipelineConfig config;
    private final Clock clock;
    private final Map<String, ModelGroup> groups = new ConcurrentHashMap<>();

    public String groupOf(Reading reading) {
        return switch (config.modelGrouping()) {
            case SENSOR_TYPE -> "type:" + reading.sensorType().getCode();
            case SENSOR_ID -> "sensor:" + reading.sensorId();
        };
    }

    public Optional<AnomalyModel> currentModel(String group) {
        ModelGroup g = groups.get(group);
        return g == null ? Optional.empty() : g.current();
    }

    /**
     * Añade un vector al buffer de entrenamiento del grupo y devuelve cuántas muestras
     * lleva acumuladas desde el último reentrenamiento.
     */
    public long recordTrainingSample(String group, double[] features) {
        return groupFor(group).recordSample(features);
    }

    public boolean exists(String group) {
        return groups.containsKey(group);
    }

    public List<ModelStatusDTO> statuses() {
        return groups.values().stream()
                .sorted(Comparator.comparing(ModelGroup::getName))
                .map(g -> {
                    Optional<AnomalyModel> m = g.current();
                    return new ModelStatusDTO(
                            g.getName(),
                            m.map(AnomalyModel::version).orElse(0L),
                            m.map(AnomalyModel::trainedAt).orElse(null),
                            m.map(AnomalyModel::trainingSamples).orElse(0),
                            g.buffer().size(),
                            g.isRetraining());
                })
                .collect(Collectors.toList());
    }

    ModelGroup groupFor(String group) {
        return groups.computeIfAbsent(group,
                name -> new ModelGroup(name, config.retrain().snapshotSize(), clock.instant()));
    }

    List<ModelGroup> allGroups() {
        return List.copyOf(groups.values());
    }
}
