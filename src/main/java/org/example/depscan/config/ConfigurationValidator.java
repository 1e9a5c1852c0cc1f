package org.example.depscan.config;

import org.example.depscan.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates traversal limits.
 * Throws ConfigurationException if validation fails.
 */
public class ConfigurationValidator {

    static final int MIN_DEPTH = 1;
    static final int MAX_DEPTH = 200;
    static final int MIN_NODES = 100;
    static final int MAX_NODES = 500_000;
    static final long MIN_PROCESSING_TIME_MS = 60_000L;
    static final long MAX_PROCESSING_TIME_MS = 3_600_000L;

    /**
     * Validates the traversal configuration.
     *
     * @param config the configuration to validate
     * @return list of validation errors (empty if valid)
     */
    public List<String> validate(TraversalConfiguration config) {
        List<String> errors = new ArrayList<>();

        if (config == null) {
            errors.add("configuration is required");
            return errors;
        }

        validateProcessingLimits(config, errors);
        validateMemoryLimits(config, errors);

        return errors;
    }

    /**
     * Validates configuration and throws exception if invalid.
     *
     * @param config the configuration to validate
     * @throws ConfigurationException if validation fails
     */
    public void validateOrThrow(TraversalConfiguration config) throws ConfigurationException {
        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Invalid traversal configuration:\n- " + String.join("\n- ", errors),
                    errors
            );
        }
    }

    private void validateProcessingLimits(TraversalConfiguration config, List<String> errors) {
        if (config.getMaxDepth() < MIN_DEPTH || config.getMaxDepth() > MAX_DEPTH) {
            errors.add("maxDepth must be between " + MIN_DEPTH + " and " + MAX_DEPTH +
                       ", but was: " + config.getMaxDepth());
        }

        if (config.getMaxNodes() < MIN_NODES || config.getMaxNodes() > MAX_NODES) {
            errors.add("maxNodes must be between " + MIN_NODES + " and " + MAX_NODES +
                       ", but was: " + config.getMaxNodes());
        }

        if (config.getMaxProcessingTimeMs() < MIN_PROCESSING_TIME_MS ||
            config.getMaxProcessingTimeMs() > MAX_PROCESSING_TIME_MS) {
            errors.add("maxProcessingTimeMs must be between 1 minute and 1 hour, but was: " +
                       config.getMaxProcessingTimeMs());
        }

        if (config.getMaxCircularRefs() <= 0) {
            errors.add("maxCircularRefs must be positive, but was: " + config.getMaxCircularRefs());
        }

        if (config.getMaxTransitiveNodes() <= 0) {
            errors.add("maxTransitiveNodes must be positive, but was: " + config.getMaxTransitiveNodes());
        } else if (config.getMaxTransitiveNodes() > config.getMaxNodes()) {
            errors.add("maxTransitiveNodes (" + config.getMaxTransitiveNodes() +
                       ") must not exceed maxNodes (" + config.getMaxNodes() + ")");
        }
    }

    private void validateMemoryLimits(TraversalConfiguration config, List<String> errors) {
        if (config.getMemoryCheckInterval() <= 0) {
            errors.add("memoryCheckInterval must be positive, but was: " + config.getMemoryCheckInterval());
        }

        if (config.getMemoryWarningMB() <= 0) {
            errors.add("memoryWarningMB must be positive, but was: " + config.getMemoryWarningMB());
        }

        if (config.getMemoryWarningMB() >= config.getMemoryCriticalMB()) {
            errors.add("memoryWarningMB (" + config.getMemoryWarningMB() +
                       ") must be less than memoryCriticalMB (" + config.getMemoryCriticalMB() + ")");
        }
    }
}
