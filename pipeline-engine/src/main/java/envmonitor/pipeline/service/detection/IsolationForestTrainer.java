package envmonitor.pipeline.service.detection;

import envmonitor.config.PipelineConfig;
import envmonitor.domain.exception.ModelFitException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

@Slf4j
@Component
@RequiredArgsConstructor
public class IsolationForestTrainer implements ModelTrainer {

    private final PipelineConfig config;
    private final Clock clock;

    @Override
    public AnomalyModel fit(String group, long version, double[][] samples) throws ModelFitException {
        PipelineConfig.RetrainConfig retrain = config.retrain();

        if (samples.length < retrain.minSamples()) {
            throw new ModelFitException(String.format(
                    "Insufficient samples for group %s: %d < %d", group, samples.length, retrain.minSamples()));
        }
        int dims = samples[0].length;
        if (!hasSpread(samples, dims)) {
            throw new ModelFitException("Degenerate training set for group " + group + ": every feature is constant");
        }

        int psi = Math.min(retrain.subsampleSize(), samples.length);
        int heightLimit = (int) Math.ceil(Math.log(psi) / Math.log(2));
        Random random = new Random(retrain.seed() * 31 + version);

        List<IsolationForest.Node> trees = new ArrayList<>(retrain.treeCount());
        for (int t = 0; t < retrain.treeCount(); t++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ModelFitException("Fit interrupted for group " + group + " after " + t + " trees");
            }
            double[][] subsample = subsample(samples, psi, random);
            trees.add(grow(subsample, 0, subsample.length, 0, heightLimit, dims, random));
        }

        log.debug("Fitted isolation forest for {} (v{}, {} samples, psi={}, height={})",
                group, version, samples.length, psi, heightLimit);
        return new IsolationForest(group, version, clock.instant(), samples.length, dims, psi, trees);
    }

    private static boolean hasSpread(double[][] samples, int dims) {
        for (int f = 0; f < dims; f++) {
            double min = samples[0][f];
            double max = min;
            for (double[] row : samples) {
                min = Math.min(min, row[f]);
                max = Math.max(max, row[f]);
            }
            if (max > min) return true;
        }
        return false;
    }

    // Muestreo sin reemplazo (Fisher-Yates parcial sobre índices)
    private static double[][] subsample(double[][] samples, int size, Random random) {
        int n = samples.length;
        int[] idx = new int[n];
        for (int i = 0; i < n; i++) idx[i] = i;
        double[][] out = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = idx[i];
            idx[i] = idx[j];
            idx[j] = tmp;
            out[i] = samples[idx[i]];
        }
        return out;
    }

    /**
     * Crece un árbol sobre rows[from, to). Reordena in situ el subarray.
     */
    private static IsolationForest.Node grow(double[][] rows, int from, int to, int depth, int heightLimit,
                                             int dims, Random random) {
        int size = to - from;
        if (depth >= heightLimit || size <= 1) {
            return new IsolationForest.Leaf(size);
        }

        // Solo se puede cortar por características con rango no nulo en este nodo
        int[] candidates = new int[dims];
        double[] mins = new double[dims];
        double[] maxs = new double[dims];
        int count = 0;
        for (int f = 0; f < dims; f++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int i = from; i < to; i++) {
                min = Math.min(min, rows[i][f]);
                max = Math.max(max, rows[i][f]);
            }
            if (max > min) {
                candidates[count] = f;
                mins[count] = min;
                maxs[count] = max;
                count++;
            }
        }
        if (count == 0) {
            return new IsolationForest.Leaf(size);
        }

        int pick = random.nextInt(count);
        int feature = candidates[pick];
        double threshold = mins[pick] + random.nextDouble() * (maxs[pick] - mins[pick]);
        if (threshold <= mins[pick]) {
            threshold = Math.nextUp(mins[pick]);
        }

        int mid = from;
        for (int i = from; i < to; i++) {
            if (rows[i][feature] < threshold) {
                double[] tmp = rows[mid];
                rows[mid] = rows[i];
                rows[i] = tmp;
                mid++;
            }
        }

        return new IsolationForest.Split(feature, threshold,
                grow(rows, from, mid, depth + 1, heightLimit, dims, random),
                grow(rows, mid, to, depth + 1, heightLimit, dims, random));
    }
}
