package envmonitor.pipeline.sink;

import envmonitor.domain.alert.AlertTransition;
import envmonitor.domain.reading.CleanedReading;

/**
 * Consumidor externo de las salidas del pipeline. Para un mismo sensor los eventos llegan en orden.
 * Las implementaciones no deben bloquear: se invocan desde el carril del sensor.
 */
public interface PipelineEventSink {

    void onReading(CleanedReading reading);

    void onAlert(AlertTransition transition);
}
