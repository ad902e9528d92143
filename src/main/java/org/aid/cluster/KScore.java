package org.aid.cluster;

import java.util.OptionalDouble;

/**
 * Quality of the best centroid fit for one candidate k.
 *
 * @param k candidate cluster count
 * @param inertia total within-cluster squared distance (elbow curve)
 * @param silhouette mean silhouette coefficient, null where undefined (k = 1 or k = n)
 * @param converged whether the kept run stabilized before the iteration cap
 */
public record KScore(int k, double inertia, Double silhouette, boolean converged) {

    public OptionalDouble silhouetteScore() {
        return silhouette == null ? OptionalDouble.empty() : OptionalDouble.of(silhouette);
    }
}
