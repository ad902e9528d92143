package org.aid.model;

import java.util.Arrays;
import java.util.Collection;

/**
 * An immutable vector of standardized indicator values for one record.
 */
public final class FeatureVector {

    private final double[] data;

    /**
     * Constructs a FeatureVector from the given array.
     * The input array is copied to keep immutability.
     *
     * @param values indicator values (must be non-null and non-empty)
     */
    public FeatureVector(double[] values) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
        this.data = Arrays.copyOf(values, values.length);
    }

    public static FeatureVector of(double... values) {
        return new FeatureVector(values);
    }

    /**
     * @return the number of indicators in this vector.
     */
    public int dim() {
        return data.length;
    }

    /**
     * Returns a defensive copy of the internal data.
     */
    public double[] toArrayCopy() {
        return Arrays.copyOf(data, data.length);
    }

    /**
     * Returns the value at the given indicator index.
     *
     * @throws IndexOutOfBoundsException if the index is invalid
     */
    public double get(int index) {
        if (index < 0 || index >= data.length) {
            throw new IndexOutOfBoundsException("index=" + index + ", dim=" + data.length);
        }
        return data[index];
    }

    /**
     * Weighted sum of the components: sum_i (x_i * w_i).
     *
     * @throws IllegalArgumentException if dimensions do not match.
     */
    public double dot(FeatureVector other) {
        requireSameDim(other);
        double sum = 0.0;
        for (int i = 0; i < data.length; i++) {
            sum += this.data[i] * other.data[i];
        }
        return sum;
    }

    public double norm() {
        return Math.sqrt(normSquared());
    }

    public double normSquared() {
        double sumSq = 0.0;
        for (double v : data) {
            sumSq += v * v;
        }
        return sumSq;
    }

    /**
     * Squared Euclidean distance to another vector, without the sqrt.
     * Centroid assignment and inertia work on this quantity directly.
     */
    public double squaredDistanceTo(FeatureVector other) {
        requireSameDim(other);
        double sumSq = 0.0;
        for (int i = 0; i < data.length; i++) {
            double d = this.data[i] - other.data[i];
            sumSq += d * d;
        }
        return sumSq;
    }

    public FeatureVector add(FeatureVector other) {
        requireSameDim(other);
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = this.data[i] + other.data[i];
        }
        return new FeatureVector(out);
    }

    public FeatureVector subtract(FeatureVector other) {
        requireSameDim(other);
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = this.data[i] - other.data[i];
        }
        return new FeatureVector(out);
    }

    public FeatureVector scale(double alpha) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = alpha * this.data[i];
        }
        return new FeatureVector(out);
    }

    /**
     * Component-wise mean of a collection of vectors.
     * Values are accumulated in the iteration order of the collection, so the
     * same members in the same order always give the same bits.
     */
    public static FeatureVector mean(Collection<FeatureVector> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot average empty vectors");
        }

        int dim = vectors.iterator().next().dim();
        double[] sum = new double[dim];

        for (FeatureVector v : vectors) {
            if (v.dim() != dim) {
                throw new IllegalArgumentException(
                        "Cannot average vectors with different dimensions. Expected " + dim + " but got " + v.dim()
                );
            }
            for (int i = 0; i < dim; i++) sum[i] += v.data[i];
        }

        int n = vectors.size();
        for (int i = 0; i < dim; i++) {
            sum[i] /= n;
        }
        return new FeatureVector(sum);
    }

    private void requireSameDim(FeatureVector other) {
        if (other == null) {
            throw new IllegalArgumentException("other must not be null");
        }
        if (this.data.length != other.data.length) {
            throw new IllegalArgumentException(
                    "Dimension mismatch: " + this.data.length + " vs " + other.data.length
            );
        }
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (obj.getClass() != this.getClass()) return false;

        FeatureVector other = (FeatureVector) obj;
        return Arrays.equals(this.data, other.data);
    }
}
