package org.aid.cluster;

/**
 * Marker for the parameter object of one clustering algorithm.
 * Implementations are immutable and usable as part of a cache key.
 */
public interface ClusteringParams {

    /**
     * @return a stable textual form, e.g. "k=3" or "eps=1.5,min_samples=3"
     */
    String describe();
}
