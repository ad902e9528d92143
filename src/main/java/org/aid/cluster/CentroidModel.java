package org.aid.cluster;

import org.aid.error.ConfigurationException;
import org.aid.model.FeatureVector;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fitted centroid model. Centroid {@code i} belongs to cluster id {@code i};
 * ids are already ordered by descending training cluster size.
 *
 * @param featureNames feature order the centroids were fitted in
 * @param centroids k x dim centroid coordinates
 * @param seed random seed used for initialization
 * @param inertia total within-cluster squared distance on the training data
 * @param iterations Lloyd iterations of the kept run
 * @param converged false when the kept run stopped at the iteration cap
 */
public record CentroidModel(List<String> featureNames,
                            double[][] centroids,
                            long seed,
                            double inertia,
                            int iterations,
                            boolean converged) {

    public CentroidModel {
        Objects.requireNonNull(featureNames, "featureNames must not be null");
        Objects.requireNonNull(centroids, "centroids must not be null");
        if (centroids.length == 0) {
            throw new IllegalArgumentException("centroids must not be empty");
        }
        for (double[] c : centroids) {
            if (c == null || c.length != featureNames.size()) {
                throw new IllegalArgumentException("every centroid must have " + featureNames.size() + " values");
            }
        }
        featureNames = List.copyOf(featureNames);
        centroids = deepCopy(centroids);
    }

    @Override
    public double[][] centroids() {
        return deepCopy(centroids);
    }

    public int k() {
        return centroids.length;
    }

    public FeatureVector centroid(int clusterId) {
        return new FeatureVector(centroids[clusterId]);
    }

    /**
     * Nearest centroid for an unseen standardized vector; ties go to the lower id.
     *
     * @throws ConfigurationException if the vector dimension differs from the model's
     */
    public int predict(FeatureVector vector) {
        Objects.requireNonNull(vector, "vector must not be null");
        if (vector.dim() != featureNames.size()) {
            throw ConfigurationException.of("features", vector.dim(),
                    "model was fitted on " + featureNames.size() + " features");
        }
        int best = 0;
        double bestD = Double.POSITIVE_INFINITY;
        for (int c = 0; c < centroids.length; c++) {
            double d = vector.squaredDistanceTo(new FeatureVector(centroids[c]));
            if (d < bestD) {
                bestD = d;
                best = c;
            }
        }
        return best;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CentroidModel other)) return false;
        return seed == other.seed
                && Double.compare(inertia, other.inertia) == 0
                && iterations == other.iterations
                && converged == other.converged
                && featureNames.equals(other.featureNames)
                && Arrays.deepEquals(centroids, other.centroids);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(featureNames, seed, inertia, iterations, converged) + Arrays.deepHashCode(centroids);
    }

    private static double[][] deepCopy(double[][] src) {
        double[][] out = new double[src.length][];
        for (int i = 0; i < src.length; i++) {
            out[i] = Arrays.copyOf(src[i], src[i].length);
        }
        return out;
    }
}
