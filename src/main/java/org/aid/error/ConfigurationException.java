package org.aid.error;

/**
 * An invalid clustering or ranking parameter: k out of range, non-positive
 * eps/min_samples, mismatched feature dimensionality and similar.
 * Always fatal to the call that received the parameter.
 */
public class ConfigurationException extends IllegalArgumentException {

    private final String parameter;

    public ConfigurationException(String parameter, String message) {
        super(parameter + ": " + message);
        this.parameter = parameter;
    }

    /**
     * @return the configuration key of the offending parameter (e.g. "k_max")
     */
    public String parameter() {
        return parameter;
    }

    public static ConfigurationException of(String parameter, Object value, String rule) {
        return new ConfigurationException(parameter, "invalid value " + value + " (" + rule + ")");
    }
}
