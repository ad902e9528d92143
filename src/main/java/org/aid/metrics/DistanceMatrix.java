package org.aid.metrics;

import org.aid.model.FeatureMatrix;

import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Symmetric pairwise distance table over the records of a matrix.
 *
 * Each row is computed independently, so rows may be filled in parallel;
 * every task writes only its own row, and the result is identical to the
 * sequential computation.
 */
public final class DistanceMatrix {

    private final double[][] d;

    private DistanceMatrix(double[][] d) {
        this.d = d;
    }

    public static DistanceMatrix compute(FeatureMatrix matrix, DistanceMetric metric, boolean parallel) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        Objects.requireNonNull(metric, "metric must not be null");

        int n = matrix.size();
        double[][] d = new double[n][n];
        IntStream rows = IntStream.range(0, n);
        if (parallel) {
            rows = rows.parallel();
        }
        rows.forEach(i -> {
            for (int j = 0; j < n; j++) {
                d[i][j] = (i == j) ? 0.0 : metric.distance(matrix.row(i), matrix.row(j));
            }
        });
        return new DistanceMatrix(d);
    }

    public static DistanceMatrix euclidean(FeatureMatrix matrix) {
        return compute(matrix, EuclideanDistance.INSTANCE, false);
    }

    public int size() {
        return d.length;
    }

    public double get(int i, int j) {
        return d[i][j];
    }
}
