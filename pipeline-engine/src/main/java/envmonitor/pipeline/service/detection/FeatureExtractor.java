package envmonitor.pipeline.service.detection;

import envmonitor.config.PipelineConfig;
import envmonitor.pipeline.service.state.StreamState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Construye el vector de características que consume el modelo no supervisado:
 * <ol>
 *     <li>valor de la lectura,</li>
 *     <li>desviación respecto a la media de la ventana,</li>
 *     <li>pendiente a corto plazo (mínimos cuadrados) sobre las últimas k muestras, incluida la actual.</li>
 * </ol>
 * Siempre se calcula contra el estado previo a la lectura.
 */
@Component
@RequiredArgsConstructor
public class FeatureExtractor {

    public static final int DIMENSIONS = 3;

    private final PipelineConfig config;

    public double[] extract(StreamState prior, double value) {
        double windowMean = prior.mean().orElse(value);
        double[] tail = prior.recent(config.slopeWindow() - 1);
        double[] series = new double[tail.length + 1];
        System.arraycopy(tail, 0, series, 0, tail.length);
        series[tail.length] = value;
        return new double[]{value, value - windowMean, slope(series)};
    }

    static double slope(double[] ys) {
        int n = ys.length;
        if (n < 2) return 0.0;
        double xMean = (n - 1) / 2.0;
        double yMean = 0.0;
        for (double y : ys) yMean += y;
        yMean /= n;
        double num = 0.0;
        double den = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            num += dx * (ys[i] - yMean);
            den += dx * dx;
        }
        return num / den;
    }
}
