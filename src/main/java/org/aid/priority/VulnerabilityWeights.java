package org.aid.priority;

import org.aid.error.ConfigurationException;
import org.aid.model.FeatureVector;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Linear weights of the composite vulnerability score, keyed by feature name.
 * Positive weights raise vulnerability (mortality, fertility), negative
 * weights lower it (income, life expectancy, GDP). Features without a weight
 * count 0.
 */
public final class VulnerabilityWeights {

    private final Map<String, Double> byFeature;

    public VulnerabilityWeights(Map<String, Double> byFeature) {
        Objects.requireNonNull(byFeature, "byFeature must not be null");
        if (byFeature.isEmpty()) {
            throw ConfigurationException.of("vulnerability_weights", "{}", "at least one weight is required");
        }
        for (Map.Entry<String, Double> e : byFeature.entrySet()) {
            if (e.getValue() == null || !Double.isFinite(e.getValue())) {
                throw ConfigurationException.of("vulnerability_weights", e.getKey() + "=" + e.getValue(),
                        "weights must be finite numbers");
            }
        }
        this.byFeature = Map.copyOf(new LinkedHashMap<>(byFeature));
    }

    public Map<String, Double> asMap() {
        return byFeature;
    }

    /**
     * Lays the weights out in the given feature order.
     *
     * @throws ConfigurationException if a weighted feature is not among the features
     */
    public FeatureVector alignTo(List<String> featureNames) {
        Objects.requireNonNull(featureNames, "featureNames must not be null");
        for (String name : byFeature.keySet()) {
            if (!featureNames.contains(name)) {
                throw ConfigurationException.of("vulnerability_weights", name,
                        "feature is not part of the matrix " + featureNames);
            }
        }
        double[] w = new double[featureNames.size()];
        for (int j = 0; j < w.length; j++) {
            w[j] = byFeature.getOrDefault(featureNames.get(j), 0.0);
        }
        return new FeatureVector(w);
    }
}
