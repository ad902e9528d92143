package org.aid.model;

import org.aid.error.DataShapeException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable mapping of record identifier to cluster label, in record order.
 *
 * Valid cluster ids are 0..k-1. {@link #NOISE} (-1) is reserved for records a
 * density fit left outside every cluster.
 */
public final class ClusterAssignment {

    public static final int NOISE = -1;

    private final String algorithm;
    private final List<String> ids;
    private final int[] labels;
    private final ConvergenceWarning warning;

    public ClusterAssignment(String algorithm, List<String> ids, int[] labels) {
        this(algorithm, ids, labels, null);
    }

    public ClusterAssignment(String algorithm, List<String> ids, int[] labels, ConvergenceWarning warning) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm must not be null");
        Objects.requireNonNull(ids, "ids must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        if (ids.size() != labels.length) {
            throw new DataShapeException("Got " + ids.size() + " identifiers but " + labels.length + " labels");
        }
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] < NOISE) {
                throw new IllegalArgumentException("Invalid label " + labels[i] + " for id=" + ids.get(i));
            }
        }
        this.ids = List.copyOf(ids);
        this.labels = Arrays.copyOf(labels, labels.length);
        this.warning = warning;
    }

    /** Name of the clusterer that produced this assignment ("kmeans", "hierarchical", "dbscan"). */
    public String algorithm() {
        return algorithm;
    }

    public int size() {
        return labels.length;
    }

    public List<String> ids() {
        return ids;
    }

    public String id(int index) {
        return ids.get(index);
    }

    public int label(int index) {
        return labels[index];
    }

    public int[] labelsCopy() {
        return Arrays.copyOf(labels, labels.length);
    }

    public int labelOf(String id) {
        int i = ids.indexOf(id);
        if (i < 0) {
            throw new IllegalArgumentException("Unknown id: " + id);
        }
        return labels[i];
    }

    public boolean isNoise(int index) {
        return labels[index] == NOISE;
    }

    /**
     * @return the distinct non-noise cluster ids, ascending
     */
    public SortedSet<Integer> clusterIds() {
        SortedSet<Integer> out = new TreeSet<>();
        for (int label : labels) {
            if (label != NOISE) out.add(label);
        }
        return out;
    }

    public int clusterCount() {
        return clusterIds().size();
    }

    public int noiseCount() {
        int n = 0;
        for (int label : labels) {
            if (label == NOISE) n++;
        }
        return n;
    }

    /** Record indexes carrying the given label, ascending. */
    public List<Integer> memberIndexes(int label) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == label) out.add(i);
        }
        return out;
    }

    /** Identifier -> label as an ordered map, for flat table export. */
    public Map<String, Integer> asMap() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (int i = 0; i < labels.length; i++) {
            out.put(ids.get(i), labels[i]);
        }
        return out;
    }

    public Optional<ConvergenceWarning> convergenceWarning() {
        return Optional.ofNullable(warning);
    }

    /**
     * Fails with {@link DataShapeException} unless this assignment lists the
     * matrix identifiers in the same order.
     */
    public void requireAlignedWith(FeatureMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        if (!ids.equals(matrix.ids())) {
            throw new DataShapeException(
                    "Assignment from " + algorithm + " does not match the feature matrix records"
            );
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClusterAssignment other)) return false;
        return algorithm.equals(other.algorithm) && ids.equals(other.ids) && Arrays.equals(labels, other.labels);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(algorithm, ids) + Arrays.hashCode(labels);
    }

    @Override
    public String toString() {
        return "ClusterAssignment(" + algorithm + ", records=" + labels.length
                + ", clusters=" + clusterCount() + ", noise=" + noiseCount() + ")";
    }
}
