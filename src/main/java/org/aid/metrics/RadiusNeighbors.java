package org.aid.metrics;

import org.aid.model.FeatureMatrix;
import org.aid.model.FeatureVector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Neighbor queries by scanning all records of a matrix.
 *
 * Radius queries return neighbors in record order (not by distance), which
 * keeps density expansion deterministic.
 */
public final class RadiusNeighbors {

    private final FeatureMatrix matrix;
    private final DistanceMetric metric;

    public RadiusNeighbors(FeatureMatrix matrix, DistanceMetric metric) {
        this.matrix = Objects.requireNonNull(matrix, "matrix must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
    }

    /**
     * All records within {@code radius} of record {@code index}, the record
     * itself included, ascending by index.
     */
    public List<Neighbor> withinRadius(int index, double radius) {
        return withinRadius(matrix.row(index), radius);
    }

    /**
     * All records within {@code radius} (inclusive) of an arbitrary vector,
     * ascending by index.
     */
    public List<Neighbor> withinRadius(FeatureVector query, double radius) {
        Objects.requireNonNull(query, "query must not be null");
        if (radius < 0.0) throw new IllegalArgumentException("radius must be >= 0");

        List<Neighbor> out = new ArrayList<>();
        for (int i = 0; i < matrix.size(); i++) {
            double d = metric.distance(query, matrix.row(i));
            if (d <= radius) {
                out.add(new Neighbor(i, d));
            }
        }
        return out;
    }

    /**
     * Closest record to the query; ties resolve to the lower index.
     */
    public Optional<Neighbor> nearest(FeatureVector query) {
        Objects.requireNonNull(query, "query must not be null");
        Neighbor best = null;
        for (int i = 0; i < matrix.size(); i++) {
            double d = metric.distance(query, matrix.row(i));
            if (best == null || d < best.distance()) {
                best = new Neighbor(i, d);
            }
        }
        return Optional.ofNullable(best);
    }

    public DistanceMetric metric() {
        return metric;
    }
}
