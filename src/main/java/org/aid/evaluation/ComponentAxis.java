package org.aid.evaluation;

import org.aid.model.FeatureVector;

/**
 * One principal axis in feature space.
 *
 * The axis is defined by:
 * - origin: the feature means of the fitted records
 * - direction: a unit eigenvector of their covariance matrix
 *
 * For any vector V: coordinate t = (V - origin) . direction
 */
public final class ComponentAxis {

    private final FeatureVector origin;
    private final FeatureVector direction; // unit length
    private final double variance;

    ComponentAxis(FeatureVector origin, FeatureVector directionUnit, double variance) {
        if (origin == null) throw new IllegalArgumentException("origin must not be null");
        if (directionUnit == null) throw new IllegalArgumentException("direction must not be null");
        if (origin.dim() != directionUnit.dim()) {
            throw new IllegalArgumentException("Dimension mismatch: origin vs direction");
        }
        this.origin = origin;
        this.direction = directionUnit;
        this.variance = variance;
    }

    public FeatureVector origin() {
        return origin;
    }

    public FeatureVector direction() {
        return direction;
    }

    /** Eigenvalue of this component: variance of the data along the axis. */
    public double variance() {
        return variance;
    }

    /**
     * Scalar coordinate of V along the axis.
     */
    public double coordinateOf(FeatureVector v) {
        if (v == null) throw new IllegalArgumentException("v must not be null");
        if (v.dim() != origin.dim()) {
            throw new IllegalArgumentException("Dimension mismatch: " + v.dim() + " vs " + origin.dim());
        }
        return v.subtract(origin).dot(direction);
    }
}
