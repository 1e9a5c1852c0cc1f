package org.example.depscan.model;

/**
 * Immutable snapshot of the counters gathered during one traversal.
 */
public class ProcessingMetrics {

    private final int totalNodes;
    private final int uniquePackages;
    private final int maxDepth;
    private final int circularReferences;
    private final long processingTimeMs;
    private final long memoryUsageMB;
    private final int warningsCount;
    private final int errorsCount;
    private final TerminationReason terminationReason;

    private ProcessingMetrics(Builder builder) {
        this.totalNodes = builder.totalNodes;
        this.uniquePackages = builder.uniquePackages;
        this.maxDepth = builder.maxDepth;
        this.circularReferences = builder.circularReferences;
        this.processingTimeMs = builder.processingTimeMs;
        this.memoryUsageMB = builder.memoryUsageMB;
        this.warningsCount = builder.warningsCount;
        this.errorsCount = builder.errorsCount;
        this.terminationReason = builder.terminationReason;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Metrics of a traversal that has not run yet.
     */
    public static ProcessingMetrics empty() {
        return builder().build();
    }

    /**
     * Number of stack/queue frames processed, including short-circuited re-encounters.
     */
    public int getTotalNodes() {
        return totalNodes;
    }

    public int getUniquePackages() {
        return uniquePackages;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getCircularReferences() {
        return circularReferences;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public long getMemoryUsageMB() {
        return memoryUsageMB;
    }

    public int getWarningsCount() {
        return warningsCount;
    }

    public int getErrorsCount() {
        return errorsCount;
    }

    public TerminationReason getTerminationReason() {
        return terminationReason;
    }

    /**
     * Returns true if a hard limit stopped the traversal early.
     */
    public boolean isTruncated() {
        return errorsCount > 0 || terminationReason.isTruncation();
    }

    @Override
    public String toString() {
        return String.format(
                "ProcessingMetrics{totalNodes=%d, uniquePackages=%d, maxDepth=%d, circularReferences=%d, " +
                "processingTimeMs=%d, memoryUsageMB=%d, warnings=%d, errors=%d, termination=%s}",
                totalNodes, uniquePackages, maxDepth, circularReferences,
                processingTimeMs, memoryUsageMB, warningsCount, errorsCount, terminationReason
        );
    }

    /**
     * Builder for ProcessingMetrics.
     */
    public static class Builder {
        private int totalNodes;
        private int uniquePackages;
        private int maxDepth;
        private int circularReferences;
        private long processingTimeMs;
        private long memoryUsageMB;
        private int warningsCount;
        private int errorsCount;
        private TerminationReason terminationReason = TerminationReason.COMPLETED;

        public Builder totalNodes(int totalNodes) {
            this.totalNodes = totalNodes;
            return this;
        }

        public Builder uniquePackages(int uniquePackages) {
            this.uniquePackages = uniquePackages;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder circularReferences(int circularReferences) {
            this.circularReferences = circularReferences;
            return this;
        }

        public Builder processingTimeMs(long processingTimeMs) {
            this.processingTimeMs = processingTimeMs;
            return this;
        }

        public Builder memoryUsageMB(long memoryUsageMB) {
            this.memoryUsageMB = memoryUsageMB;
            return this;
        }

        public Builder warningsCount(int warningsCount) {
            this.warningsCount = warningsCount;
            return this;
        }

        public Builder errorsCount(int errorsCount) {
            this.errorsCount = errorsCount;
            return this;
        }

        public Builder terminationReason(TerminationReason terminationReason) {
            this.terminationReason = terminationReason != null ? terminationReason : TerminationReason.COMPLETED;
            return this;
        }

        public ProcessingMetrics build() {
            return new ProcessingMetrics(this);
        }
    }
}
