package org.example.depscan.traversal;

import org.example.depscan.exception.MalformedNodeException;
import org.example.depscan.model.DependencyNode;
import org.example.depscan.model.TransitiveInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Aggregates vulnerability and freshness data over everything reachable
 * below a single dependency.
 *
 * <p>Every call uses its own visited set. A package shared by two direct
 * dependencies is therefore counted in the rollup of each of them; only
 * repeated occurrences within one subgraph are collapsed.</p>
 *
 * <p>The walk is breadth-first over an explicit queue, so the reported
 * depth of each package is its shortest distance from the start node.</p>
 */
public class TransitiveDependencyAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TransitiveDependencyAnalyzer.class);

    private final int maxIterations;

    /**
     * @param maxIterations maximum number of nodes expanded per call
     */
    public TransitiveDependencyAnalyzer(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive, but was: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    /**
     * Computes the rollup of the subgraph below {@code node}. The node itself
     * is not part of the counts.
     *
     * @throws MalformedNodeException if node is null
     */
    public TransitiveInfo calculateTransitiveInfo(DependencyNode node) {
        if (node == null) {
            throw new MalformedNodeException("Dependency node is null", "<null>");
        }

        int count = 0;
        int vulnerableCount = 0;
        int outdatedCount = 0;
        int maxDepth = 1;
        boolean truncated = false;

        Set<String> visited = new HashSet<>();
        Deque<Frame> queue = new ArrayDeque<>();
        visited.add(node.getKey());
        queue.addLast(new Frame(node, 1));

        int iterations = 0;
        while (!queue.isEmpty()) {
            if (iterations >= maxIterations) {
                log.warn("Transitive rollup of {} stopped after {} iterations", node.getKey(), maxIterations);
                truncated = true;
                break;
            }

            Frame frame = queue.pollFirst();
            iterations++;

            for (DependencyNode child : frame.node.getDependencies().values()) {
                if (!visited.add(child.getKey())) {
                    continue;
                }

                count++;
                if (child.isVulnerable()) {
                    vulnerableCount += child.getVulnerabilityCount();
                }
                if (child.isOutdated()) {
                    outdatedCount++;
                }

                int childDepth = frame.depth + 1;
                maxDepth = Math.max(maxDepth, childDepth);
                queue.addLast(new Frame(child, childDepth));
            }
        }

        return new TransitiveInfo(count, vulnerableCount, outdatedCount, maxDepth, truncated);
    }

    /**
     * Returns the depth of the deepest package below {@code node}, counting
     * the node itself as depth 1.
     */
    public int calculateMaxDepth(DependencyNode node) {
        return calculateTransitiveInfo(node).getMaxDepth();
    }

    private static final class Frame {
        private final DependencyNode node;
        private final int depth;

        private Frame(DependencyNode node, int depth) {
            this.node = node;
            this.depth = depth;
        }
    }
}
