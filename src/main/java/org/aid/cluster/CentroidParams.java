package org.aid.cluster;

import org.aid.error.ConfigurationException;

/**
 * @param k number of clusters (>= 1)
 */
public record CentroidParams(int k) implements ClusteringParams {

    public CentroidParams {
        if (k < 1) {
            throw ConfigurationException.of("k", k, "must be >= 1");
        }
    }

    @Override
    public String describe() {
        return "k=" + k;
    }
}
