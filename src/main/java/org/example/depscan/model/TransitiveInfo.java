package org.example.depscan.model;

import java.util.Objects;

/**
 * Rollup of the packages reachable below one dependency.
 */
public class TransitiveInfo {

    private static final TransitiveInfo NONE = new TransitiveInfo(0, 0, 0, 1, false);

    private final int count;
    private final int vulnerableCount;
    private final int outdatedCount;
    private final int maxDepth;
    private final boolean truncated;

    /**
     * Creates a new TransitiveInfo.
     *
     * @param count           distinct packages reachable below the start node
     * @param vulnerableCount sum of vulnerability counts of vulnerable descendants
     * @param outdatedCount   number of outdated descendants
     * @param maxDepth        depth of the deepest descendant (start node = 1)
     * @param truncated       whether the iteration cap stopped the walk early
     */
    public TransitiveInfo(int count, int vulnerableCount, int outdatedCount, int maxDepth, boolean truncated) {
        this.count = count;
        this.vulnerableCount = vulnerableCount;
        this.outdatedCount = outdatedCount;
        this.maxDepth = maxDepth;
        this.truncated = truncated;
    }

    /**
     * Rollup of a dependency without children.
     */
    public static TransitiveInfo none() {
        return NONE;
    }

    public int getCount() {
        return count;
    }

    public int getVulnerableCount() {
        return vulnerableCount;
    }

    public int getOutdatedCount() {
        return outdatedCount;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public boolean isTruncated() {
        return truncated;
    }

    /**
     * Returns a copy with the given max depth.
     */
    public TransitiveInfo withMaxDepth(int depth) {
        return new TransitiveInfo(count, vulnerableCount, outdatedCount, depth, truncated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransitiveInfo that = (TransitiveInfo) o;
        return count == that.count &&
               vulnerableCount == that.vulnerableCount &&
               outdatedCount == that.outdatedCount &&
               maxDepth == that.maxDepth &&
               truncated == that.truncated;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, vulnerableCount, outdatedCount, maxDepth, truncated);
    }

    @Override
    public String toString() {
        return "TransitiveInfo{count=" + count +
                ", vulnerable=" + vulnerableCount +
                ", outdated=" + outdatedCount +
                ", maxDepth=" + maxDepth +
                (truncated ? ", truncated" : "") +
                '}';
    }
}
