package org.aid.model;

import org.aid.error.DataShapeException;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Z-score standardization of raw indicator records (zero mean, unit
 * population variance per feature, computed over the full record set).
 */
public final class Standardizer {

    private static final Logger log = LoggerFactory.getLogger(Standardizer.class);

    /**
     * Learns per-feature mean and standard deviation from the records.
     * Constant features get a scale of 1.0 so they standardize to zero.
     */
    public ScalerState fit(List<IndicatorRecord> records, List<String> features) {
        Objects.requireNonNull(records, "records must not be null");
        Objects.requireNonNull(features, "features must not be null");
        if (records.isEmpty()) {
            throw new DataShapeException("Cannot standardize an empty record set");
        }
        if (features.isEmpty()) {
            throw new DataShapeException("At least one feature is required");
        }

        double[] means = new double[features.size()];
        double[] scales = new double[features.size()];
        StandardDeviation population = new StandardDeviation(false);

        for (int j = 0; j < features.size(); j++) {
            String feature = features.get(j);
            double[] column = new double[records.size()];
            for (int i = 0; i < records.size(); i++) {
                column[i] = records.get(i).require(feature);
            }
            means[j] = new Mean().evaluate(column);
            double sd = population.evaluate(column, means[j]);
            scales[j] = sd > 0.0 ? sd : 1.0;
            if (sd == 0.0) {
                log.warn("Feature '{}' is constant over {} records; leaving it unscaled", feature, records.size());
            }
        }

        log.info("Standardized {} features over {} records", features.size(), records.size());
        return new ScalerState(features, means, scales);
    }

    /**
     * Fit and transform in one step.
     */
    public FeatureMatrix fitTransform(List<IndicatorRecord> records, List<String> features) {
        return fit(records, features).transform(records);
    }
}
