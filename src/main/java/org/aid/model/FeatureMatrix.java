package org.aid.model;

import org.aid.error.DataShapeException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable, ordered set of standardized feature vectors, one per record.
 *
 * Strict mode:
 * - at least one record
 * - every vector has the same dimension, equal to the number of feature names
 * - identifiers are unique
 *
 * Record order is significant: clusterers iterate records in this order and
 * every {@link ClusterAssignment} produced from the matrix keeps it.
 */
public final class FeatureMatrix {

    private final List<String> ids;
    private final List<FeatureVector> rows;
    private final List<String> featureNames;
    private final Map<String, Integer> indexById;

    // Computed lazily, content never changes
    private volatile String fingerprint;

    public FeatureMatrix(List<String> ids, List<FeatureVector> rows, List<String> featureNames) {
        Objects.requireNonNull(ids, "ids must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        Objects.requireNonNull(featureNames, "featureNames must not be null");

        if (ids.isEmpty() || rows.isEmpty()) {
            throw new DataShapeException("Feature matrix must contain at least one record");
        }
        if (ids.size() != rows.size()) {
            throw new DataShapeException("Got " + ids.size() + " identifiers but " + rows.size() + " vectors");
        }

        int dim = featureNames.size();
        if (dim == 0) {
            throw new DataShapeException("Feature matrix must name at least one feature");
        }

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            String id = ids.get(i);
            FeatureVector row = rows.get(i);
            if (id == null || id.isBlank()) {
                throw new DataShapeException("Blank identifier at row " + i);
            }
            if (row == null) {
                throw new DataShapeException("Missing vector for id=" + id);
            }
            if (row.dim() != dim) {
                throw new DataShapeException(
                        "Inconsistent vector length for id=" + id + ". Expected=" + dim + ", but got=" + row.dim()
                );
            }
            if (index.putIfAbsent(id, i) != null) {
                throw new DataShapeException("Duplicate identifier: " + id);
            }
        }

        this.ids = List.copyOf(ids);
        this.rows = List.copyOf(rows);
        this.featureNames = List.copyOf(featureNames);
        this.indexById = Map.copyOf(index);
    }

    /**
     * Convenience for anonymous data: ids become "r0".."rN", features "f0".."fD".
     */
    public static FeatureMatrix fromRows(double[][] values) {
        if (values == null || values.length == 0) {
            throw new DataShapeException("Feature matrix must contain at least one record");
        }
        List<String> ids = new ArrayList<>(values.length);
        List<FeatureVector> rows = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            ids.add("r" + i);
            rows.add(new FeatureVector(values[i]));
        }
        List<String> names = new ArrayList<>();
        for (int j = 0; j < values[0].length; j++) {
            names.add("f" + j);
        }
        return new FeatureMatrix(ids, rows, names);
    }

    /** Number of records. */
    public int size() {
        return rows.size();
    }

    /** Number of features per record. */
    public int dim() {
        return featureNames.size();
    }

    public String id(int index) {
        return ids.get(index);
    }

    public FeatureVector row(int index) {
        return rows.get(index);
    }

    /** All identifiers in record order (unmodifiable). */
    public List<String> ids() {
        return ids;
    }

    /** All vectors in record order (unmodifiable). */
    public List<FeatureVector> rows() {
        return rows;
    }

    public List<String> featureNames() {
        return featureNames;
    }

    public boolean contains(String id) {
        return indexById.containsKey(id);
    }

    public OptionalInt indexOf(String id) {
        Integer i = indexById.get(id);
        return i == null ? OptionalInt.empty() : OptionalInt.of(i);
    }

    /**
     * @return the vector for the id, or throws if not found.
     */
    public FeatureVector require(String id) {
        Integer i = indexById.get(id);
        if (i == null) {
            throw new IllegalArgumentException("Unknown id: " + id);
        }
        return rows.get(i);
    }

    /**
     * Column index of a feature name, or -1 when the matrix does not carry it.
     */
    public int featureIndex(String featureName) {
        return featureNames.indexOf(featureName);
    }

    /**
     * SHA-256 over feature names, identifiers and raw values in record order.
     * Two matrices with the same fingerprint produce the same fits.
     */
    public String fingerprint() {
        String local = fingerprint;
        if (local != null) {
            return local;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (String name : featureNames) {
                digest.update(name.getBytes(StandardCharsets.UTF_8));
                digest.update((byte) 0);
            }
            ByteBuffer buf = ByteBuffer.allocate(Double.BYTES);
            for (int i = 0; i < rows.size(); i++) {
                digest.update(ids.get(i).getBytes(StandardCharsets.UTF_8));
                digest.update((byte) 0);
                FeatureVector row = rows.get(i);
                for (int j = 0; j < row.dim(); j++) {
                    buf.clear();
                    buf.putDouble(row.get(j));
                    digest.update(buf.array());
                }
            }
            local = HexFormat.of().formatHex(digest.digest());
            fingerprint = local;
            return local;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    @Override
    public String toString() {
        return "FeatureMatrix(records=" + size() + ", dim=" + dim() + ")";
    }
}
