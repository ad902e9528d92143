package org.aid.model;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw-record transformations applied before standardization: outlier
 * clipping and derived indicators.
 */
public final class FeatureEngineering {

    public static final String HIGH_CHILD_MORTALITY = "High_Child_Mortality";
    public static final String EXPORTS_IMPORTS_RATIO = "Exports_Imports_Ratio";

    private static final Logger log = LoggerFactory.getLogger(FeatureEngineering.class);

    private FeatureEngineering() {
    }

    /**
     * Adds a 0/1 flag that is 1 when {@code source} is strictly above its median
     * over the record set.
     */
    public static List<IndicatorRecord> withAboveMedianFlag(List<IndicatorRecord> records,
                                                            String source,
                                                            String flagName) {
        Objects.requireNonNull(records, "records must not be null");
        if (records.isEmpty()) return List.of();

        double[] column = new double[records.size()];
        for (int i = 0; i < records.size(); i++) {
            column[i] = records.get(i).require(source);
        }
        double median = new Median().evaluate(column);
        log.debug("Median of {} is {}", source, median);

        List<IndicatorRecord> out = new ArrayList<>(records.size());
        for (IndicatorRecord r : records) {
            out.add(with(r, flagName, r.require(source) > median ? 1.0 : 0.0));
        }
        return out;
    }

    /**
     * Adds {@code numerator / denominator}. A zero denominator yields 0.0 rather
     * than an infinite feature.
     */
    public static List<IndicatorRecord> withRatio(List<IndicatorRecord> records,
                                                  String numerator,
                                                  String denominator,
                                                  String ratioName) {
        Objects.requireNonNull(records, "records must not be null");
        List<IndicatorRecord> out = new ArrayList<>(records.size());
        for (IndicatorRecord r : records) {
            double den = r.require(denominator);
            double ratio = den == 0.0 ? 0.0 : r.require(numerator) / den;
            out.add(with(r, ratioName, ratio));
        }
        return out;
    }

    /**
     * Clip range {@code [Q1 - multiplier * IQR, Q3 + multiplier * IQR]} of one column.
     */
    public record IqrBounds(double lower, double upper) {

        public double clip(double value) {
            return Math.max(lower, Math.min(upper, value));
        }
    }

    /**
     * Quartiles use linear interpolation between order statistics (R-7).
     */
    public static IqrBounds iqrBounds(double[] column, double multiplier) {
        Objects.requireNonNull(column, "column must not be null");
        if (column.length == 0) {
            throw new IllegalArgumentException("column must not be empty");
        }
        Percentile quartile = new Percentile().withEstimationType(EstimationType.R_7);
        double q1 = quartile.evaluate(column, 25.0);
        double q3 = quartile.evaluate(column, 75.0);
        double iqr = q3 - q1;
        return new IqrBounds(q1 - multiplier * iqr, q3 + multiplier * iqr);
    }

    /**
     * Winsorizes each named column: values outside its IQR bounds are clipped
     * to the nearest bound. Bounds are computed per column over the whole
     * record set; other indicators are left untouched.
     */
    public static List<IndicatorRecord> winsorized(List<IndicatorRecord> records,
                                                   List<String> columns,
                                                   double multiplier) {
        Objects.requireNonNull(records, "records must not be null");
        Objects.requireNonNull(columns, "columns must not be null");
        if (records.isEmpty() || columns.isEmpty()) return records;

        Map<String, IqrBounds> bounds = new HashMap<>();
        for (String col : columns) {
            double[] column = new double[records.size()];
            for (int i = 0; i < records.size(); i++) {
                column[i] = records.get(i).require(col);
            }
            IqrBounds b = iqrBounds(column, multiplier);
            log.info("Winsorizing {} to [{}, {}]", col, b.lower(), b.upper());
            bounds.put(col, b);
        }

        List<IndicatorRecord> out = new ArrayList<>(records.size());
        for (IndicatorRecord r : records) {
            Map<String, Double> values = new HashMap<>(r.indicators());
            bounds.forEach((col, b) -> values.put(col, b.clip(r.require(col))));
            out.add(new IndicatorRecord(r.id(), values));
        }
        return out;
    }

    /**
     * The two derived indicators of the country data set.
     */
    public static List<IndicatorRecord> standardSet(List<IndicatorRecord> records) {
        List<IndicatorRecord> flagged = withAboveMedianFlag(records, "child_mort", HIGH_CHILD_MORTALITY);
        return withRatio(flagged, "exports", "imports", EXPORTS_IMPORTS_RATIO);
    }

    private static IndicatorRecord with(IndicatorRecord r, String name, double value) {
        Map<String, Double> values = new HashMap<>(r.indicators());
        values.put(name, value);
        return new IndicatorRecord(r.id(), values);
    }
}
