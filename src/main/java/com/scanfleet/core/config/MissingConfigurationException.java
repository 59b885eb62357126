package com.scanfleet.core.config;

import java.util.List;

/**
 * Raised at startup when required analysis-server configuration is absent.
 * Nothing is processed once this is thrown.
 */
public class MissingConfigurationException extends RuntimeException {

    private final List<String> missing;

    public MissingConfigurationException(List<String> missing) {
        super("Missing required configuration: " + String.join(", ", missing));
        this.missing = List.copyOf(missing);
    }

    public List<String> getMissing() {
        return missing;
    }
}
