package org.example.depscan.config;

import org.example.depscan.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Builds a validated {@link TraversalConfiguration} from environment variables.
 *
 * <p>Recognised variables:</p>
 * <ul>
 *   <li>{@code MAX_DEPENDENCY_DEPTH}</li>
 *   <li>{@code MAX_DEPENDENCY_NODES}</li>
 *   <li>{@code MAX_PROCESSING_TIME_MS}</li>
 *   <li>{@code MAX_CIRCULAR_REFS}</li>
 *   <li>{@code MEMORY_CHECK_INTERVAL}</li>
 *   <li>{@code MEMORY_WARNING_MB}</li>
 *   <li>{@code MEMORY_CRITICAL_MB}</li>
 *   <li>{@code MAX_TRANSITIVE_NODES}</li>
 *   <li>{@code ENABLE_DEBUG_METRICS}</li>
 * </ul>
 *
 * <p>Unset or blank variables fall back to the defaults. A value that is not
 * a number is logged and replaced by the default; a number outside its
 * allowed range fails the load.</p>
 */
public class EnvironmentConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentConfigurationLoader.class);

    public static final String MAX_DEPENDENCY_DEPTH = "MAX_DEPENDENCY_DEPTH";
    public static final String MAX_DEPENDENCY_NODES = "MAX_DEPENDENCY_NODES";
    public static final String MAX_PROCESSING_TIME_MS = "MAX_PROCESSING_TIME_MS";
    public static final String MAX_CIRCULAR_REFS = "MAX_CIRCULAR_REFS";
    public static final String MEMORY_CHECK_INTERVAL = "MEMORY_CHECK_INTERVAL";
    public static final String MEMORY_WARNING_MB = "MEMORY_WARNING_MB";
    public static final String MEMORY_CRITICAL_MB = "MEMORY_CRITICAL_MB";
    public static final String MAX_TRANSITIVE_NODES = "MAX_TRANSITIVE_NODES";
    public static final String ENABLE_DEBUG_METRICS = "ENABLE_DEBUG_METRICS";

    private final Map<String, String> environment;
    private final ConfigurationValidator validator;

    /**
     * Creates a loader reading the process environment.
     */
    public EnvironmentConfigurationLoader() {
        this(System.getenv());
    }

    public EnvironmentConfigurationLoader(Map<String, String> environment) {
        this(environment, new ConfigurationValidator());
    }

    public EnvironmentConfigurationLoader(Map<String, String> environment, ConfigurationValidator validator) {
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
        this.validator = Objects.requireNonNull(validator, "validator cannot be null");
    }

    /**
     * Loads and validates the configuration.
     *
     * @return the validated configuration snapshot
     * @throws ConfigurationException if any value is outside its allowed range
     */
    public TraversalConfiguration load() throws ConfigurationException {
        TraversalConfiguration config = loadUnvalidated();
        validator.validateOrThrow(config);
        log.debug("Loaded traversal configuration: {}", config);
        return config;
    }

    /**
     * Loads the configuration without range validation, for callers that apply
     * further overrides before validating.
     */
    public TraversalConfiguration loadUnvalidated() {
        return TraversalConfiguration.builder()
                .maxDepth(getInt(MAX_DEPENDENCY_DEPTH, TraversalConfiguration.DEFAULT_MAX_DEPTH))
                .maxNodes(getInt(MAX_DEPENDENCY_NODES, TraversalConfiguration.DEFAULT_MAX_NODES))
                .maxProcessingTimeMs(getLong(MAX_PROCESSING_TIME_MS, TraversalConfiguration.DEFAULT_MAX_PROCESSING_TIME_MS))
                .maxCircularRefs(getInt(MAX_CIRCULAR_REFS, TraversalConfiguration.DEFAULT_MAX_CIRCULAR_REFS))
                .memoryCheckInterval(getInt(MEMORY_CHECK_INTERVAL, TraversalConfiguration.DEFAULT_MEMORY_CHECK_INTERVAL))
                .memoryWarningMB(getLong(MEMORY_WARNING_MB, TraversalConfiguration.DEFAULT_MEMORY_WARNING_MB))
                .memoryCriticalMB(getLong(MEMORY_CRITICAL_MB, TraversalConfiguration.DEFAULT_MEMORY_CRITICAL_MB))
                .maxTransitiveNodes(getInt(MAX_TRANSITIVE_NODES, TraversalConfiguration.DEFAULT_MAX_TRANSITIVE_NODES))
                .debugMetrics(getBoolean(ENABLE_DEBUG_METRICS, false))
                .build();
    }

    private int getInt(String key, int defaultValue) {
        String value = environment.get(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for {}: {}, using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String value = environment.get(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for {}: {}, using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String value = environment.get(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim());
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
