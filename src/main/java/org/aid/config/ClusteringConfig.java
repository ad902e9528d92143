package org.aid.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.aid.cluster.DensityParams;
import org.aid.error.ConfigurationException;
import org.aid.priority.TierThresholds;
import org.aid.priority.VulnerabilityWeights;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All tunables of one analysis run, bound from snake_case JSON.
 *
 * @param features raw indicator columns used as clustering features, in order
 * @param engineeredFeatures whether the derived child-mortality flag and trade ratio are appended
 * @param kMin smallest k of the search
 * @param kMax largest k of the search
 * @param k fixed cluster count; null lets the search choose
 * @param linkageCutK cluster count of the hierarchical cut
 * @param eps density neighborhood radius
 * @param minSamples density core point threshold
 * @param vulnerabilityWeights score weight per feature
 * @param tierThresholds score cut points of the automatic tiers
 * @param randomSeed seed of every randomized step
 * @param maxIterations Lloyd iteration cap per run
 * @param nInit seeded restarts per k
 * @param agreementThreshold adjusted Rand index below which methods disagree
 * @param pcaComponents dimensions of the diagnostic projection
 * @param parallel whether independent fits may run concurrently
 * @param outlierColumns raw indicator columns winsorized before standardization; empty disables clipping
 * @param iqrMultiplier IQR multiple of the winsorizing bounds
 * @param focusIndicator feature whose highest cluster mean marks the most vulnerable
 *                       cluster of the focus list; null uses the weighted profile score
 */
public record ClusteringConfig(
        @JsonProperty("features") List<String> features,
        @JsonProperty("engineered_features") boolean engineeredFeatures,
        @JsonProperty("k_min") int kMin,
        @JsonProperty("k_max") int kMax,
        @JsonProperty("k") Integer k,
        @JsonProperty("linkage_cut_k") int linkageCutK,
        @JsonProperty("eps") double eps,
        @JsonProperty("min_samples") int minSamples,
        @JsonProperty("vulnerability_weights") Map<String, Double> vulnerabilityWeights,
        @JsonProperty("tier_thresholds") TierThresholds tierThresholds,
        @JsonProperty("random_seed") long randomSeed,
        @JsonProperty("max_iterations") int maxIterations,
        @JsonProperty("n_init") int nInit,
        @JsonProperty("agreement_threshold") double agreementThreshold,
        @JsonProperty("pca_components") int pcaComponents,
        @JsonProperty("parallel") boolean parallel,
        @JsonProperty("outlier_columns") List<String> outlierColumns,
        @JsonProperty("iqr_multiplier") double iqrMultiplier,
        @JsonProperty("focus_indicator") String focusIndicator) {

    public ClusteringConfig {
        features = features == null ? List.of() : List.copyOf(features);
        outlierColumns = outlierColumns == null ? List.of() : List.copyOf(outlierColumns);
        vulnerabilityWeights = vulnerabilityWeights == null ? Map.of() : Map.copyOf(vulnerabilityWeights);
    }

    /**
     * Checks every field against its rule. Checks that need the data set
     * (k_max against the record count, weights against the feature set) run
     * where the data is known.
     *
     * @return this config, for chaining
     * @throws ConfigurationException naming the first invalid field
     */
    public ClusteringConfig validate() {
        if (features.isEmpty()) {
            throw ConfigurationException.of("features", features, "at least one feature is required");
        }
        if (new HashSet<>(features).size() != features.size()) {
            throw ConfigurationException.of("features", features, "feature names must be unique");
        }
        if (kMin < 1) {
            throw ConfigurationException.of("k_min", kMin, "must be >= 1");
        }
        if (kMax < kMin) {
            throw ConfigurationException.of("k_max", kMax, "must be >= k_min (" + kMin + ")");
        }
        if (k != null && k < 1) {
            throw ConfigurationException.of("k", k, "must be >= 1");
        }
        if (linkageCutK < 1) {
            throw ConfigurationException.of("linkage_cut_k", linkageCutK, "must be >= 1");
        }
        densityParams();
        weights();
        if (tierThresholds == null) {
            throw ConfigurationException.of("tier_thresholds", null, "lower and upper are required");
        }
        if (maxIterations < 1) {
            throw ConfigurationException.of("max_iterations", maxIterations, "must be >= 1");
        }
        if (nInit < 1) {
            throw ConfigurationException.of("n_init", nInit, "must be >= 1");
        }
        if (Double.isNaN(agreementThreshold) || agreementThreshold < -1.0 || agreementThreshold > 1.0) {
            throw ConfigurationException.of("agreement_threshold", agreementThreshold, "must be in [-1, 1]");
        }
        if (pcaComponents < 1 || pcaComponents > features.size() + (engineeredFeatures ? 2 : 0)) {
            throw ConfigurationException.of("pca_components", pcaComponents, "must be between 1 and the feature count");
        }
        if (new HashSet<>(outlierColumns).size() != outlierColumns.size()
                || outlierColumns.stream().anyMatch(String::isBlank)) {
            throw ConfigurationException.of("outlier_columns", outlierColumns, "column names must be non-empty and unique");
        }
        if (!Double.isFinite(iqrMultiplier) || iqrMultiplier < 0.0) {
            throw ConfigurationException.of("iqr_multiplier", iqrMultiplier, "must be a finite value >= 0");
        }
        if (focusIndicator != null && !features.contains(focusIndicator)) {
            throw ConfigurationException.of("focus_indicator", focusIndicator, "must be a configured feature");
        }
        return this;
    }

    public Optional<Integer> fixedK() {
        return Optional.ofNullable(k);
    }

    public Optional<String> focusFeature() {
        return Optional.ofNullable(focusIndicator);
    }

    public DensityParams densityParams() {
        return new DensityParams(eps, minSamples);
    }

    public VulnerabilityWeights weights() {
        return new VulnerabilityWeights(vulnerabilityWeights);
    }
}
