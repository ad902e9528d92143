package org.aid.model;

import java.util.Map;
import java.util.Objects;

/**
 * One raw input row (a country) with its unscaled indicator values.
 *
 * @param id unique record name
 * @param indicators indicator name -> raw value
 */
public record IndicatorRecord(String id, Map<String, Double> indicators) {

    public IndicatorRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must be non-empty");
        }
        Objects.requireNonNull(indicators, "indicators must not be null");
        indicators = Map.copyOf(indicators);
    }

    /**
     * @throws IllegalArgumentException if the record does not carry the indicator
     */
    public double require(String indicator) {
        Double v = indicators.get(indicator);
        if (v == null) {
            throw new IllegalArgumentException("Missing indicator '" + indicator + "' for id: " + id);
        }
        return v;
    }

    public boolean has(String indicator) {
        return indicators.containsKey(indicator);
    }
}
