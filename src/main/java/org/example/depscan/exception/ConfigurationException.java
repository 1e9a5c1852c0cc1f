package org.example.depscan.exception;

import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when traversal configuration validation fails.
 * Carries every violated constraint, not just the first one.
 */
public class ConfigurationException extends DepscanException {

    private final List<String> validationErrors;

    public ConfigurationException(String message, List<String> validationErrors) {
        super(message);
        this.validationErrors = validationErrors != null
                ? List.copyOf(validationErrors)
                : Collections.emptyList();
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }
}
