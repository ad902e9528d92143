package org.aid.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Statistical profile of one cluster: per-feature mean and population
 * standard deviation of the standardized indicators of its members.
 *
 * @param clusterId cluster label ({@link ClusterAssignment#NOISE} for the noise group)
 * @param size number of member records
 * @param featureNames feature order of {@code means} and {@code spreads}
 * @param means per-feature mean over members
 * @param spreads per-feature population standard deviation over members
 * @param memberIds member identifiers in record order
 */
public record ClusterProfile(int clusterId,
                             int size,
                             List<String> featureNames,
                             FeatureVector means,
                             FeatureVector spreads,
                             List<String> memberIds) {

    public ClusterProfile {
        Objects.requireNonNull(featureNames, "featureNames must not be null");
        Objects.requireNonNull(means, "means must not be null");
        Objects.requireNonNull(spreads, "spreads must not be null");
        Objects.requireNonNull(memberIds, "memberIds must not be null");
        if (size <= 0 || size != memberIds.size()) {
            throw new IllegalArgumentException("size must equal the number of members, got " + size);
        }
        if (means.dim() != featureNames.size() || spreads.dim() != featureNames.size()) {
            throw new IllegalArgumentException("Profile vectors must match " + featureNames.size() + " features");
        }
        featureNames = List.copyOf(featureNames);
        memberIds = List.copyOf(memberIds);
    }

    public boolean isNoise() {
        return clusterId == ClusterAssignment.NOISE;
    }

    public double mean(String featureName) {
        int i = featureNames.indexOf(featureName);
        if (i < 0) {
            throw new IllegalArgumentException("Unknown feature: " + featureName);
        }
        return means.get(i);
    }

    public Map<String, Double> meansByFeature() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < featureNames.size(); i++) {
            out.put(featureNames.get(i), means.get(i));
        }
        return out;
    }

    public Map<String, Double> spreadsByFeature() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < featureNames.size(); i++) {
            out.put(featureNames.get(i), spreads.get(i));
        }
        return out;
    }
}
