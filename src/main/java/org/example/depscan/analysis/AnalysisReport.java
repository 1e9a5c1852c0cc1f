package org.example.depscan.analysis;

import org.example.depscan.model.PackageCoordinate;
import org.example.depscan.model.ProcessingMetrics;

import java.util.Collections;
import java.util.List;

/**
 * Result of analysing one dependency graph: the packages found, the
 * circular paths, the traversal metrics and one rollup per direct
 * dependency with the aggregated totals.
 */
public class AnalysisReport {

    private final List<PackageCoordinate> packages;
    private final List<String> traversalCycles;
    private final List<String> detectedCycles;
    private final ProcessingMetrics metrics;
    private final List<DependencyRollup> rollups;

    public AnalysisReport(List<PackageCoordinate> packages,
                          List<String> traversalCycles,
                          List<String> detectedCycles,
                          ProcessingMetrics metrics,
                          List<DependencyRollup> rollups) {
        this.packages = Collections.unmodifiableList(packages);
        this.traversalCycles = Collections.unmodifiableList(traversalCycles);
        this.detectedCycles = Collections.unmodifiableList(detectedCycles);
        this.metrics = metrics;
        this.rollups = Collections.unmodifiableList(rollups);
    }

    public List<PackageCoordinate> getPackages() {
        return packages;
    }

    /**
     * Circular paths seen by the package traversal, from the root of each path.
     */
    public List<String> getTraversalCycles() {
        return traversalCycles;
    }

    /**
     * Cycles reported by the three-colour search, each starting at the node that closes it.
     */
    public List<String> getDetectedCycles() {
        return detectedCycles;
    }

    public boolean hasCycles() {
        return !detectedCycles.isEmpty() || !traversalCycles.isEmpty();
    }

    public ProcessingMetrics getMetrics() {
        return metrics;
    }

    public List<DependencyRollup> getRollups() {
        return rollups;
    }

    /**
     * Sum of the transitive counts of all direct dependencies.
     */
    public int getTotalTransitiveCount() {
        return rollups.stream().mapToInt(r -> r.getTransitiveInfo().getCount()).sum();
    }

    public int getTotalVulnerableCount() {
        return rollups.stream().mapToInt(r -> r.getTransitiveInfo().getVulnerableCount()).sum();
    }

    public int getTotalOutdatedCount() {
        return rollups.stream().mapToInt(r -> r.getTransitiveInfo().getOutdatedCount()).sum();
    }

    /**
     * Deepest transitive chain below any direct dependency, 0 without dependencies.
     */
    public int getMaxTransitiveDepth() {
        return rollups.stream().mapToInt(r -> r.getTransitiveInfo().getMaxDepth()).max().orElse(0);
    }

    @Override
    public String toString() {
        return String.format(
                "AnalysisReport{packages=%d, cycles=%d, directDependencies=%d, transitive=%d, " +
                "vulnerable=%d, outdated=%d, maxTransitiveDepth=%d, truncated=%s}",
                packages.size(), detectedCycles.size(), rollups.size(), getTotalTransitiveCount(),
                getTotalVulnerableCount(), getTotalOutdatedCount(), getMaxTransitiveDepth(),
                metrics.isTruncated()
        );
    }
}
