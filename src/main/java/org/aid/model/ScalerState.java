package org.aid.model;

import org.aid.error.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fitted z-score parameters: per feature, the mean and population standard
 * deviation observed over the training records. Applying the same state to an
 * unseen record puts it in the space the models were fitted in.
 *
 * @param featureNames ordered feature names
 * @param means per-feature mean
 * @param scales per-feature standard deviation (1.0 where the feature was constant)
 */
public record ScalerState(List<String> featureNames, double[] means, double[] scales) {

    public ScalerState {
        Objects.requireNonNull(featureNames, "featureNames must not be null");
        Objects.requireNonNull(means, "means must not be null");
        Objects.requireNonNull(scales, "scales must not be null");
        if (means.length != featureNames.size() || scales.length != featureNames.size()) {
            throw new IllegalArgumentException("means/scales must match " + featureNames.size() + " features");
        }
        for (double s : scales) {
            if (!(s > 0.0)) {
                throw new IllegalArgumentException("scales must be positive, got " + s);
            }
        }
        featureNames = List.copyOf(featureNames);
        means = Arrays.copyOf(means, means.length);
        scales = Arrays.copyOf(scales, scales.length);
    }

    @Override
    public double[] means() {
        return Arrays.copyOf(means, means.length);
    }

    @Override
    public double[] scales() {
        return Arrays.copyOf(scales, scales.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalerState other)) return false;
        return featureNames.equals(other.featureNames)
                && Arrays.equals(means, other.means)
                && Arrays.equals(scales, other.scales);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * featureNames.hashCode() + Arrays.hashCode(means)) + Arrays.hashCode(scales);
    }

    public FeatureVector transform(IndicatorRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        double[] out = new double[featureNames.size()];
        for (int j = 0; j < out.length; j++) {
            out[j] = (record.require(featureNames.get(j)) - means[j]) / scales[j];
        }
        return new FeatureVector(out);
    }

    /**
     * Standardizes a raw vector already laid out in {@link #featureNames()} order.
     */
    public FeatureVector transform(double[] raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        if (raw.length != featureNames.size()) {
            throw ConfigurationException.of("features", raw.length,
                    "expected " + featureNames.size() + " raw values");
        }
        double[] out = new double[raw.length];
        for (int j = 0; j < raw.length; j++) {
            out[j] = (raw[j] - means[j]) / scales[j];
        }
        return new FeatureVector(out);
    }

    public FeatureMatrix transform(List<IndicatorRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        List<String> ids = new ArrayList<>(records.size());
        List<FeatureVector> rows = new ArrayList<>(records.size());
        for (IndicatorRecord r : records) {
            ids.add(r.id());
            rows.add(transform(r));
        }
        return new FeatureMatrix(ids, rows, featureNames);
    }
}
