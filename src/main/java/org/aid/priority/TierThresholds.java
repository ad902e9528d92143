package org.aid.priority;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.aid.error.ConfigurationException;

/**
 * Score cut points: above {@code upper} is HIGH, below {@code lower} is LOW,
 * anything in between (bounds included) is MEDIUM.
 */
public record TierThresholds(@JsonProperty("lower") double lower, @JsonProperty("upper") double upper) {

    public TierThresholds {
        if (Double.isNaN(lower) || Double.isNaN(upper) || lower > upper) {
            throw ConfigurationException.of("tier_thresholds", "[" + lower + ", " + upper + "]",
                    "lower must not exceed upper");
        }
    }

    public PriorityTier tierOf(double score) {
        if (score > upper) return PriorityTier.HIGH;
        if (score < lower) return PriorityTier.LOW;
        return PriorityTier.MEDIUM;
    }
}
