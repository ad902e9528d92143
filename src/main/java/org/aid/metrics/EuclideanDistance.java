package org.aid.metrics;

import org.aid.model.FeatureVector;

/**
 * Euclidean (L2) distance: sqrt(sum_i (a_i - b_i)^2).
 */
public final class EuclideanDistance implements DistanceMetric {

    public static final EuclideanDistance INSTANCE = new EuclideanDistance();

    @Override
    public double distance(FeatureVector a, FeatureVector b) {
        requireNonNull(a, "a");
        requireNonNull(b, "b");
        if (a.dim() != b.dim()) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.dim() + " vs " + b.dim());
        }
        return Math.sqrt(a.squaredDistanceTo(b));
    }

    @Override
    public String name() {
        return "euclidean";
    }

    @Override
    public String toString() {
        return name();
    }

    private static void requireNonNull(Object x, String paramName) {
        if (x == null) {
            throw new IllegalArgumentException(paramName + " must not be null");
        }
    }
}
