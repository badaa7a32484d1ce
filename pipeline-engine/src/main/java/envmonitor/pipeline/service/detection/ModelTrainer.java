package envmonitor.pipeline.service.detection;

import envmonitor.domain.exception.ModelFitException;

/**
 * Ajusta un modelo nuevo a partir de un snapshot de vectores de características.
 * Debe comprobar la interrupción del hilo para admitir cancelación cooperativa.
 */
public interface ModelTrainer {

    AnomalyModel fit(String group, long version, double[][] samples) throws ModelFitException;
}
