package org.aid.cluster;

import org.aid.error.ConfigurationException;

/**
 * @param eps neighborhood radius (> 0)
 * @param minSamples points within eps, the point itself included, needed for a core point (> 0)
 */
public record DensityParams(double eps, int minSamples) implements ClusteringParams {

    public DensityParams {
        if (!(eps > 0.0) || Double.isInfinite(eps)) {
            throw ConfigurationException.of("eps", eps, "must be a positive finite number");
        }
        if (minSamples <= 0) {
            throw ConfigurationException.of("min_samples", minSamples, "must be >= 1");
        }
    }

    @Override
    public String describe() {
        return "eps=" + eps + ",min_samples=" + minSamples;
    }
}
