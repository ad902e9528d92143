package org.aid.cluster;

import org.aid.error.ConfigurationException;
import org.aid.metrics.EuclideanDistance;
import org.aid.metrics.Neighbor;
import org.aid.metrics.RadiusNeighbors;
import org.aid.model.ClusterAssignment;
import org.aid.model.FeatureMatrix;
import org.aid.model.FeatureVector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fitted density clustering: the core points with their cluster labels and the
 * parameters they were found with. An unseen vector joins the cluster of the
 * nearest core point within {@code eps}, and is noise otherwise.
 *
 * @param featureNames feature order of the core points
 * @param eps neighborhood radius used for the fit
 * @param minSamples core point threshold used for the fit
 * @param coreIds identifiers of the core points, in record order
 * @param corePoints core point coordinates, parallel to {@code coreIds}
 * @param coreLabels cluster label of each core point, parallel to {@code coreIds}
 */
public record DensityModel(List<String> featureNames,
                           double eps,
                           int minSamples,
                           List<String> coreIds,
                           double[][] corePoints,
                           int[] coreLabels) {

    public DensityModel {
        Objects.requireNonNull(featureNames, "featureNames must not be null");
        Objects.requireNonNull(coreIds, "coreIds must not be null");
        Objects.requireNonNull(corePoints, "corePoints must not be null");
        Objects.requireNonNull(coreLabels, "coreLabels must not be null");
        if (coreIds.size() != corePoints.length || coreIds.size() != coreLabels.length) {
            throw new IllegalArgumentException("coreIds, corePoints and coreLabels must have the same length");
        }
        featureNames = List.copyOf(featureNames);
        coreIds = List.copyOf(coreIds);
        double[][] points = new double[corePoints.length][];
        for (int i = 0; i < corePoints.length; i++) {
            points[i] = Arrays.copyOf(corePoints[i], corePoints[i].length);
        }
        corePoints = points;
        coreLabels = Arrays.copyOf(coreLabels, coreLabels.length);
    }

    @Override
    public double[][] corePoints() {
        double[][] out = new double[corePoints.length][];
        for (int i = 0; i < corePoints.length; i++) {
            out[i] = Arrays.copyOf(corePoints[i], corePoints[i].length);
        }
        return out;
    }

    @Override
    public int[] coreLabels() {
        return Arrays.copyOf(coreLabels, coreLabels.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DensityModel other)) return false;
        return Double.compare(eps, other.eps) == 0
                && minSamples == other.minSamples
                && featureNames.equals(other.featureNames)
                && coreIds.equals(other.coreIds)
                && Arrays.deepEquals(corePoints, other.corePoints)
                && Arrays.equals(coreLabels, other.coreLabels);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(featureNames, eps, minSamples, coreIds);
        h = 31 * h + Arrays.deepHashCode(corePoints);
        return 31 * h + Arrays.hashCode(coreLabels);
    }

    public DensityParams params() {
        return new DensityParams(eps, minSamples);
    }

    /**
     * @return the label of the nearest core point within eps (ties to the
     *         earlier core point), or {@link ClusterAssignment#NOISE}
     */
    public int predict(FeatureVector vector) {
        Objects.requireNonNull(vector, "vector must not be null");
        if (vector.dim() != featureNames.size()) {
            throw ConfigurationException.of("features", vector.dim(),
                    "model was fitted on " + featureNames.size() + " features");
        }
        if (coreIds.isEmpty()) {
            return ClusterAssignment.NOISE;
        }

        List<FeatureVector> rows = new ArrayList<>(corePoints.length);
        for (double[] p : corePoints) {
            rows.add(new FeatureVector(p));
        }
        FeatureMatrix cores = new FeatureMatrix(coreIds, rows, featureNames);
        Optional<Neighbor> nearest = new RadiusNeighbors(cores, EuclideanDistance.INSTANCE).nearest(vector);
        return nearest.filter(nb -> nb.distance() <= eps)
                .map(nb -> coreLabels[nb.index()])
                .orElse(ClusterAssignment.NOISE);
    }
}
