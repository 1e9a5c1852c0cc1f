package org.example.depscan.analysis;

import org.example.depscan.exception.MalformedNodeException;
import org.example.depscan.model.DependencyNode;
import org.example.depscan.model.PackageCoordinate;
import org.example.depscan.model.TransitiveInfo;
import org.example.depscan.traversal.IterativeDependencyTraverser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the full analysis of a dependency graph: package collection, cycle
 * detection and one transitive rollup per direct dependency.
 *
 * <p>The rollups are computed per root with a visited set of their own,
 * never from the traversal's visited set, so a package shared by several
 * direct dependencies is counted below each of them.</p>
 */
public class DependencyAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DependencyAnalyzer.class);

    private final IterativeDependencyTraverser traverser;

    public DependencyAnalyzer(IterativeDependencyTraverser traverser) {
        this.traverser = Objects.requireNonNull(traverser, "traverser cannot be null");
    }

    /**
     * Analyses the graph below the given direct dependencies.
     *
     * @param roots direct dependencies
     * @return the analysis report
     * @throws MalformedNodeException if a root is null
     */
    public AnalysisReport analyze(List<DependencyNode> roots) {
        List<DependencyNode> directDependencies = roots != null ? roots : List.of();

        List<PackageCoordinate> packages = traverser.collectAllPackages(directDependencies);
        List<String> traversalCycles = traverser.getCircularDependencies();
        List<String> detectedCycles = traverser.detectCycles(directDependencies);

        List<DependencyRollup> rollups = new ArrayList<>();
        for (DependencyNode root : directDependencies) {
            TransitiveInfo info = traverser.calculateTransitiveInfo(root);
            log.debug("{} has {} transitive deps, {} vulnerable, {} outdated, depth {}",
                    root.getKey(), info.getCount(), info.getVulnerableCount(),
                    info.getOutdatedCount(), info.getMaxDepth());
            rollups.add(new DependencyRollup(root.getCoordinate(), info));
        }

        AnalysisReport report = new AnalysisReport(
                packages, traversalCycles, detectedCycles, traverser.getMetrics(), rollups);
        log.info("Dependency analysis completed: {}", report);
        return report;
    }
}
