package org.aid.evaluation;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Low-dimensional coordinates of every record, for plotting and sanity checks.
 *
 * @param ids record identifiers in matrix order
 * @param coordinates one row per record, one column per kept component
 * @param explainedVarianceRatio share of total variance per kept component, descending
 */
public record Projection(List<String> ids, double[][] coordinates, double[] explainedVarianceRatio) {

    public Projection {
        Objects.requireNonNull(ids, "ids must not be null");
        Objects.requireNonNull(coordinates, "coordinates must not be null");
        Objects.requireNonNull(explainedVarianceRatio, "explainedVarianceRatio must not be null");
        if (ids.size() != coordinates.length) {
            throw new IllegalArgumentException("Got " + ids.size() + " ids but " + coordinates.length + " rows");
        }
        ids = List.copyOf(ids);
        double[][] rows = new double[coordinates.length][];
        for (int i = 0; i < coordinates.length; i++) {
            rows[i] = Arrays.copyOf(coordinates[i], coordinates[i].length);
        }
        coordinates = rows;
        explainedVarianceRatio = Arrays.copyOf(explainedVarianceRatio, explainedVarianceRatio.length);
    }

    public int dims() {
        return explainedVarianceRatio.length;
    }

    public double[] coordinatesOf(int index) {
        return Arrays.copyOf(coordinates[index], coordinates[index].length);
    }

    public double totalExplainedVariance() {
        double sum = 0.0;
        for (double r : explainedVarianceRatio) sum += r;
        return sum;
    }
}
