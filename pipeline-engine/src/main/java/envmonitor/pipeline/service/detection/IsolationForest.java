package envmonitor.pipeline.service.detection;

import java.time.Instant;
import java.util.List;

/**
 * Bosque de aislamiento (Liu, Ting &amp; Zhou, 2008). Cada árbol parte el espacio con cortes
 * aleatorios; los puntos anómalos quedan aislados a poca profundidad. La puntuación es
 * {@code 2^(-E[h(x)] / c(psi))}, donde {@code c} es la longitud media de una búsqueda fallida
 * en un BST con {@code psi} elementos.
 * <p>
 * Inmutable una vez construido; lo crea {@link IsolationForestTrainer}.
 */
public final class IsolationForest implements AnomalyModel {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final String group;
    private final long version;
    private final Instant trainedAt;
    private final int trainingSamples;
    private final int dimensions;
    private final double normalizer;
    private final List<Node> trees;

    IsolationForest(String group, long version, Instant trainedAt, int trainingSamples,
                    int dimensions, int subsampleSize, List<Node> trees) {
        this.group = group;
        this.version = version;
        this.trainedAt = trainedAt;
        this.trainingSamples = trainingSamples;
        this.dimensions = dimensions;
        this.normalizer = averagePathLength(subsampleSize);
        this.trees = List.copyOf(trees);
    }

    @Override
    public double score(double[] features) {
        if (features.length != dimensions) {
            throw new IllegalArgumentException("Expected " + dimensions + " features, got " + features.length);
        }
        double total = 0.0;
        for (Node tree : trees) {
            total += pathLength(tree, features, 0);
        }
        double mean = total / trees.size();
        if (normalizer <= 0.0) return 0.5;
        return Math.pow(2.0, -mean / normalizer);
    }

    private static double pathLength(Node node, double[] x, int depth) {
        Node current = node;
        int d = depth;
        while (current instanceof Split split) {
            current = x[split.feature()] < split.threshold() ? split.left() : split.right();
            d++;
        }
        return d + averagePathLength(((Leaf) current).size());
    }

    /**
     * c(n): longitud media de camino de una búsqueda fallida en un BST de n nodos.
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    @Override
    public String group() {
        return group;
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public Instant trainedAt() {
        return trainedAt;
    }

    @Override
    public int trainingSamples() {
        return trainingSamples;
    }

    public int treeCount() {
        return trees.size();
    }

    @Override
    public String toString() {
        return "IsolationForest{group=" + group + ", v" + version + ", trees=" + trees.size()
                + ", samples=" + trainingSamples + "}";
    }

    interface Node {
    }

    record Split(int feature, double threshold, Node left, Node right) implements Node {
    }

    record Leaf(int size) implements Node {
    }
}
