package org.aid.metrics;

import org.aid.model.ClusterAssignment;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.stream.IntStream;

/**
 * Mean silhouette coefficient over all clustered points.
 *
 * For point i in cluster A: a = mean distance to the other members of A,
 * b = smallest mean distance to the members of any other cluster,
 * s = (b - a) / max(a, b). Points alone in their cluster score 0.
 * Noise points ({@link ClusterAssignment#NOISE}) are left out.
 */
public final class Silhouette {

    private Silhouette() {
    }

    /**
     * @return the mean coefficient, or empty when fewer than two clusters
     *         exist or every clustered point is its own cluster
     */
    public static OptionalDouble mean(DistanceMatrix distances, int[] labels, boolean parallel) {
        Objects.requireNonNull(distances, "distances must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        if (distances.size() != labels.length) {
            throw new IllegalArgumentException(
                    "Distance matrix has " + distances.size() + " rows but got " + labels.length + " labels");
        }

        // label -> member count, noise excluded
        Map<Integer, Integer> sizes = new HashMap<>();
        int clustered = 0;
        for (int label : labels) {
            if (label == ClusterAssignment.NOISE) continue;
            sizes.merge(label, 1, Integer::sum);
            clustered++;
        }
        if (sizes.size() < 2 || sizes.size() >= clustered) {
            return OptionalDouble.empty();
        }

        double[] s = new double[labels.length];
        IntStream points = IntStream.range(0, labels.length);
        if (parallel) {
            points = points.parallel();
        }
        points.forEach(i -> s[i] = pointCoefficient(distances, labels, sizes, i));

        // summed in index order whatever the evaluation order was
        double sum = 0.0;
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] != ClusterAssignment.NOISE) sum += s[i];
        }
        return OptionalDouble.of(sum / clustered);
    }

    private static double pointCoefficient(DistanceMatrix distances, int[] labels, Map<Integer, Integer> sizes, int i) {
        int own = labels[i];
        if (own == ClusterAssignment.NOISE) return 0.0;
        int ownSize = sizes.get(own);
        if (ownSize <= 1) return 0.0;

        Map<Integer, Double> sumByCluster = new HashMap<>();
        for (int j = 0; j < labels.length; j++) {
            if (j == i || labels[j] == ClusterAssignment.NOISE) continue;
            sumByCluster.merge(labels[j], distances.get(i, j), Double::sum);
        }

        double a = sumByCluster.getOrDefault(own, 0.0) / (ownSize - 1);
        double b = Double.POSITIVE_INFINITY;
        for (Map.Entry<Integer, Double> e : sumByCluster.entrySet()) {
            if (e.getKey() == own) continue;
            b = Math.min(b, e.getValue() / sizes.get(e.getKey()));
        }

        double denom = Math.max(a, b);
        return denom == 0.0 ? 0.0 : (b - a) / denom;
    }
}
