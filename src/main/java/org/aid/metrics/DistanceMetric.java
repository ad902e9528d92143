package org.aid.metrics;

import org.aid.model.FeatureVector;

/**
 * Strategy interface for measuring distance between two feature vectors.
 * Implementations must define a distance where "smaller = closer".
 */
public interface DistanceMetric {

    /**
     * @param a first vector (non-null)
     * @param b second vector (non-null)
     * @return a non-negative distance, where smaller means more similar
     * @throws IllegalArgumentException if vectors are null or dimensions mismatch
     */
    double distance(FeatureVector a, FeatureVector b);

    /**
     * @return a short name for the metric (used in logs and model files).
     */
    String name();
}
