package org.aid.cluster;

import org.aid.model.ClusterAssignment;
import org.aid.model.FeatureMatrix;

/**
 * Single capability shared by the centroid, hierarchical and density
 * clusterers. Downstream evaluation and ranking only see the returned
 * {@link ClusterAssignment}, never the algorithm that produced it.
 *
 * Implementations must not mutate the matrix and must return the same
 * assignment for the same matrix and parameters.
 */
public interface Clusterer<P extends ClusteringParams> {

    ClusterAssignment fit(FeatureMatrix matrix, P params);

    /**
     * @return the algorithm name recorded in produced assignments
     */
    String name();
}
