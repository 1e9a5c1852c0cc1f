package org.example.depscan.config;

import java.util.Objects;

/**
 * Limits applied to a dependency graph traversal.
 *
 * <p>Instances are immutable snapshots: a traverser receives one at
 * construction and never sees later changes. Use {@link #toBuilder()} to
 * derive an adjusted copy.</p>
 */
public class TraversalConfiguration {

    public static final int DEFAULT_MAX_DEPTH = 50;
    public static final int DEFAULT_MAX_NODES = 50_000;
    public static final long DEFAULT_MAX_PROCESSING_TIME_MS = 900_000L;
    public static final int DEFAULT_MAX_CIRCULAR_REFS = 10_000;
    public static final int DEFAULT_MEMORY_CHECK_INTERVAL = 1_000;
    public static final long DEFAULT_MEMORY_WARNING_MB = 2_048L;
    public static final long DEFAULT_MEMORY_CRITICAL_MB = 6_144L;
    public static final int DEFAULT_MAX_TRANSITIVE_NODES = 10_000;

    /**
     * Maximum traversal depth. Roots are at depth 1.
     */
    private final int maxDepth;

    /**
     * Maximum number of frames processed by a full traversal.
     */
    private final int maxNodes;

    /**
     * Wall-clock budget of a single traversal.
     */
    private final long maxProcessingTimeMs;

    /**
     * Number of circular references after which a traversal gives up.
     */
    private final int maxCircularRefs;

    /**
     * Heap usage is sampled every this many processed nodes.
     */
    private final int memoryCheckInterval;

    private final long memoryWarningMB;
    private final long memoryCriticalMB;

    /**
     * Iteration cap of a single transitive rollup; smaller than {@link #maxNodes}
     * since a rollup runs once per direct dependency.
     */
    private final int maxTransitiveNodes;

    /**
     * Whether every memory sample is logged at debug level.
     */
    private final boolean debugMetrics;

    private TraversalConfiguration(Builder builder) {
        this.maxDepth = builder.maxDepth;
        this.maxNodes = builder.maxNodes;
        this.maxProcessingTimeMs = builder.maxProcessingTimeMs;
        this.maxCircularRefs = builder.maxCircularRefs;
        this.memoryCheckInterval = builder.memoryCheckInterval;
        this.memoryWarningMB = builder.memoryWarningMB;
        this.memoryCriticalMB = builder.memoryCriticalMB;
        this.maxTransitiveNodes = builder.maxTransitiveNodes;
        this.debugMetrics = builder.debugMetrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the configuration with every value at its default.
     */
    public static TraversalConfiguration defaults() {
        return builder().build();
    }

    /**
     * Returns a builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .maxDepth(maxDepth)
                .maxNodes(maxNodes)
                .maxProcessingTimeMs(maxProcessingTimeMs)
                .maxCircularRefs(maxCircularRefs)
                .memoryCheckInterval(memoryCheckInterval)
                .memoryWarningMB(memoryWarningMB)
                .memoryCriticalMB(memoryCriticalMB)
                .maxTransitiveNodes(maxTransitiveNodes)
                .debugMetrics(debugMetrics);
    }

    // Getters

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public long getMaxProcessingTimeMs() {
        return maxProcessingTimeMs;
    }

    public int getMaxCircularRefs() {
        return maxCircularRefs;
    }

    public int getMemoryCheckInterval() {
        return memoryCheckInterval;
    }

    public long getMemoryWarningMB() {
        return memoryWarningMB;
    }

    public long getMemoryCriticalMB() {
        return memoryCriticalMB;
    }

    public int getMaxTransitiveNodes() {
        return maxTransitiveNodes;
    }

    public boolean isDebugMetrics() {
        return debugMetrics;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraversalConfiguration that = (TraversalConfiguration) o;
        return maxDepth == that.maxDepth &&
                maxNodes == that.maxNodes &&
                maxProcessingTimeMs == that.maxProcessingTimeMs &&
                maxCircularRefs == that.maxCircularRefs &&
                memoryCheckInterval == that.memoryCheckInterval &&
                memoryWarningMB == that.memoryWarningMB &&
                memoryCriticalMB == that.memoryCriticalMB &&
                maxTransitiveNodes == that.maxTransitiveNodes &&
                debugMetrics == that.debugMetrics;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxDepth, maxNodes, maxProcessingTimeMs, maxCircularRefs,
                memoryCheckInterval, memoryWarningMB, memoryCriticalMB, maxTransitiveNodes, debugMetrics);
    }

    @Override
    public String toString() {
        return "TraversalConfiguration{" +
                "maxDepth=" + maxDepth +
                ", maxNodes=" + maxNodes +
                ", maxProcessingTimeMs=" + maxProcessingTimeMs +
                ", maxCircularRefs=" + maxCircularRefs +
                ", memoryCheckInterval=" + memoryCheckInterval +
                ", memoryWarningMB=" + memoryWarningMB +
                ", memoryCriticalMB=" + memoryCriticalMB +
                ", maxTransitiveNodes=" + maxTransitiveNodes +
                ", debugMetrics=" + debugMetrics +
                '}';
    }

    /**
     * Builder for TraversalConfiguration.
     */
    public static class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int maxNodes = DEFAULT_MAX_NODES;
        private long maxProcessingTimeMs = DEFAULT_MAX_PROCESSING_TIME_MS;
        private int maxCircularRefs = DEFAULT_MAX_CIRCULAR_REFS;
        private int memoryCheckInterval = DEFAULT_MEMORY_CHECK_INTERVAL;
        private long memoryWarningMB = DEFAULT_MEMORY_WARNING_MB;
        private long memoryCriticalMB = DEFAULT_MEMORY_CRITICAL_MB;
        private int maxTransitiveNodes = DEFAULT_MAX_TRANSITIVE_NODES;
        private boolean debugMetrics = false;

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxNodes(int maxNodes) {
            this.maxNodes = maxNodes;
            return this;
        }

        public Builder maxProcessingTimeMs(long maxProcessingTimeMs) {
            this.maxProcessingTimeMs = maxProcessingTimeMs;
            return this;
        }

        public Builder maxCircularRefs(int maxCircularRefs) {
            this.maxCircularRefs = maxCircularRefs;
            return this;
        }

        public Builder memoryCheckInterval(int memoryCheckInterval) {
            this.memoryCheckInterval = memoryCheckInterval;
            return this;
        }

        public Builder memoryWarningMB(long memoryWarningMB) {
            this.memoryWarningMB = memoryWarningMB;
            return this;
        }

        public Builder memoryCriticalMB(long memoryCriticalMB) {
            this.memoryCriticalMB = memoryCriticalMB;
            return this;
        }

        public Builder maxTransitiveNodes(int maxTransitiveNodes) {
            this.maxTransitiveNodes = maxTransitiveNodes;
            return this;
        }

        public Builder debugMetrics(boolean debugMetrics) {
            this.debugMetrics = debugMetrics;
            return this;
        }

        public TraversalConfiguration build() {
            return new TraversalConfiguration(this);
        }
    }
}
