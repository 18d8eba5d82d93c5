package com.trenddigest.config;

import java.util.List;

/**
 * A required configuration key has no value. Raised before any pipeline stage runs.
 */
public final class ConfigMissingException extends IllegalStateException {
    private final List<String> missingKeys;

    public ConfigMissingException(List<String> missingKeys) {
        super("missing required config: " + String.join(", ", missingKeys));
        this.missingKeys = List.copyOf(missingKeys);
    }

    public List<String> missingKeys() {
        return missingKeys;
    }
}
