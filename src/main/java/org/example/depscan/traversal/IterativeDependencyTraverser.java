package org.example.depscan.traversal;

import org.example.depscan.config.TraversalConfiguration;
import org.example.depscan.exception.MalformedNodeException;
import org.example.depscan.model.DependencyDescriptor;
import org.example.depscan.model.DependencyNode;
import org.example.depscan.model.PackageCoordinate;
import org.example.depscan.model.PackageStatus;
import org.example.depscan.model.ProcessingMetrics;
import org.example.depscan.model.TerminationReason;
import org.example.depscan.model.TransitiveInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Walks resolved dependency graphs without recursion.
 *
 * <p>Dependency graphs can nest deeper than any call stack and are often
 * cyclic, so every walk here keeps its work list on the heap. Limits on
 * depth, processed nodes, wall-clock time, heap usage and circular
 * references are polled inline; hitting one stops the walk and returns
 * what was collected so far. Nothing is thrown for such a truncation,
 * it shows up in {@link #getMetrics()} instead.</p>
 *
 * <p>An instance keeps the visited set, cycle list and counters of the
 * last {@link #collectAllPackages} or {@link #processTreeIteratively}
 * call; both reset that state first. Instances may be reused for
 * sequential calls but are not thread-safe. Run one instance per thread
 * to traverse several graphs concurrently.</p>
 */
public class IterativeDependencyTraverser {

    private static final Logger log = LoggerFactory.getLogger(IterativeDependencyTraverser.class);

    private static final String DIRECT_DEPENDENCY = "dependencies";
    private static final String TRANSITIVE_DEPENDENCY = "transitive";

    private final TraversalConfiguration config;
    private final Clock clock;
    private final MemoryProbe memoryProbe;
    private final CycleDetector cycleDetector;
    private final TransitiveDependencyAnalyzer transitiveAnalyzer;

    private final Set<String> visitedNodes = new HashSet<>();
    private final Set<String> circularDependencies = new LinkedHashSet<>();
    private Counters counters = new Counters();
    private ProcessingMetrics metrics = ProcessingMetrics.empty();

    /**
     * Creates a traverser with the default limits.
     */
    public IterativeDependencyTraverser() {
        this(TraversalConfiguration.defaults());
    }

    public IterativeDependencyTraverser(TraversalConfiguration config) {
        this(config, Clock.systemUTC(), new HeapMemoryProbe());
    }

    /**
     * Creates a traverser with an explicit clock and memory probe.
     *
     * @param config      validated configuration snapshot
     * @param clock       source of wall-clock time for the time limit
     * @param memoryProbe source of heap usage samples
     */
    public IterativeDependencyTraverser(TraversalConfiguration config, Clock clock, MemoryProbe memoryProbe) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.memoryProbe = Objects.requireNonNull(memoryProbe, "memoryProbe cannot be null");
        this.cycleDetector = new CycleDetector(config.getMaxCircularRefs());
        this.transitiveAnalyzer = new TransitiveDependencyAnalyzer(config.getMaxTransitiveNodes());
    }

    // ========== Full traversal ==========

    /**
     * Collects every distinct package reachable from the roots, using the
     * configured depth and node limits.
     *
     * @see #collectAllPackages(Collection, int, int)
     */
    public List<PackageCoordinate> collectAllPackages(Collection<DependencyNode> roots) {
        return collectAllPackages(roots, config.getMaxDepth(), config.getMaxNodes());
    }

    /**
     * Collects every distinct package reachable from the roots.
     *
     * <p>Depth-first over an explicit stack; roots are at depth 1. A node
     * reached again while it is an ancestor on the current path is a
     * circular reference: it is recorded and not expanded. A node reached
     * again through a different path (a diamond) is skipped silently.
     * Children of a node at {@code maxDepth} are not expanded and count as
     * one warning.</p>
     *
     * @param roots    root nodes, may be empty
     * @param maxDepth deepest level whose nodes are collected
     * @param maxNodes maximum number of stack frames processed
     * @return distinct packages in first-visit order
     * @throws MalformedNodeException if a root is null
     */
    public List<PackageCoordinate> collectAllPackages(Collection<DependencyNode> roots, int maxDepth, int maxNodes) {
        resetState();
        List<PackageCoordinate> result = new ArrayList<>();
        if (roots == null || roots.isEmpty()) {
            metrics = counters.snapshot(0, TerminationReason.COMPLETED);
            return result;
        }

        Deque<Frame> stack = new ArrayDeque<>();
        int index = 0;
        for (DependencyNode root : roots) {
            if (root == null) {
                throw new MalformedNodeException("Root dependency node is null", "root-" + index);
            }
            stack.push(new Frame(root, 1, TraversalPath.root(index)));
            index++;
        }

        long startTime = clock.millis();
        int processedCount = 0;
        TerminationReason termination = TerminationReason.COMPLETED;

        while (!stack.isEmpty()) {
            if (processedCount >= maxNodes) {
                log.warn("Dependency traversal stopped at node limit {} with {} frames pending",
                        maxNodes, stack.size());
                counters.errorsCount++;
                termination = TerminationReason.NODE_LIMIT;
                break;
            }

            if (clock.millis() - startTime > config.getMaxProcessingTimeMs()) {
                log.warn("Dependency traversal timeout after {}ms", config.getMaxProcessingTimeMs());
                counters.errorsCount++;
                termination = TerminationReason.TIME_LIMIT;
                break;
            }

            if (processedCount % config.getMemoryCheckInterval() == 0 && isMemoryCritical()) {
                termination = TerminationReason.MEMORY_CRITICAL;
                break;
            }

            Frame frame = stack.pop();
            DependencyNode node = frame.node;
            String nodeKey = node.getKey();

            processedCount++;
            counters.totalNodes++;
            counters.maxDepth = Math.max(counters.maxDepth, frame.depth);

            if (visitedNodes.contains(nodeKey)) {
                if (frame.path.contains(nodeKey)) {
                    String circularPath = frame.path.describeCycle(nodeKey);
                    circularDependencies.add(circularPath);
                    counters.circularReferences++;

                    if (counters.circularReferences > config.getMaxCircularRefs()) {
                        log.warn("Too many circular dependencies detected ({}), stopping traversal",
                                counters.circularReferences);
                        counters.errorsCount++;
                        termination = TerminationReason.CIRCULAR_LIMIT;
                        break;
                    }

                    log.debug("Circular dependency detected: {}", circularPath);
                }
                // reached through another path, already expanded
                continue;
            }

            visitedNodes.add(nodeKey);
            result.add(node.getCoordinate());
            counters.uniquePackages++;

            if (frame.depth < maxDepth) {
                TraversalPath childPath = frame.path.append(nodeKey);
                for (DependencyNode child : node.getDependencies().values()) {
                    stack.push(new Frame(child, frame.depth + 1, childPath));
                }
            } else if (node.hasDependencies()) {
                log.debug("Depth limit {} reached for {}, skipping {} children",
                        maxDepth, nodeKey, node.getDependencies().size());
                counters.warningsCount++;
            }
        }

        metrics = counters.snapshot(clock.millis() - startTime, termination);
        log.info("Dependency traversal completed: {}", metrics);
        return result;
    }

    // ========== Node map construction ==========

    /**
     * Builds a node map from raw descriptors with the configured node limit,
     * starting at depth 1.
     *
     * @see #processTreeIteratively(Map, int, int)
     */
    public Map<String, DependencyNode> processTreeIteratively(Map<String, DependencyDescriptor> dependencies) {
        return processTreeIteratively(dependencies, config.getMaxNodes(), 1);
    }

    /**
     * Builds a node map from raw descriptors, starting at depth 1.
     *
     * @see #processTreeIteratively(Map, int, int)
     */
    public Map<String, DependencyNode> processTreeIteratively(Map<String, DependencyDescriptor> dependencies,
                                                              int maxNodes) {
        return processTreeIteratively(dependencies, maxNodes, 1);
    }

    /**
     * Builds fresh {@link DependencyNode}s from a raw nested description.
     *
     * <p>Breadth-first over an explicit queue. A package reached a second
     * time is neither rebuilt, re-attached to the second parent, nor
     * traversed again: the first discovery wins. Descriptors without a
     * version are skipped. Children of nodes at the configured
     * {@code maxDepth} are not enqueued.</p>
     *
     * @param dependencies top-level descriptors keyed by package name
     * @param maxNodes     maximum number of queue entries processed
     * @param startDepth   depth assigned to the top-level entries
     * @return nodes keyed by {@code name@version}, in discovery order
     * @throws MalformedNodeException if a descriptor is keyed by a blank name
     */
    public Map<String, DependencyNode> processTreeIteratively(Map<String, DependencyDescriptor> dependencies,
                                                              int maxNodes, int startDepth) {
        Objects.requireNonNull(dependencies, "dependencies cannot be null");
        resetState();

        Map<String, DependencyNode> nodeMap = new LinkedHashMap<>();
        Deque<QueueEntry> queue = new ArrayDeque<>();
        enqueueChildren(queue, dependencies, startDepth, null);

        long startTime = clock.millis();
        int processedCount = 0;
        TerminationReason termination = TerminationReason.COMPLETED;

        while (!queue.isEmpty()) {
            if (processedCount >= maxNodes) {
                log.warn("Tree processing stopped at node limit {} with {} entries pending",
                        maxNodes, queue.size());
                counters.errorsCount++;
                termination = TerminationReason.NODE_LIMIT;
                break;
            }

            if (clock.millis() - startTime > config.getMaxProcessingTimeMs()) {
                log.warn("Tree processing timeout after {}ms", config.getMaxProcessingTimeMs());
                counters.errorsCount++;
                termination = TerminationReason.TIME_LIMIT;
                break;
            }

            if (processedCount % config.getMemoryCheckInterval() == 0 && isMemoryCritical()) {
                termination = TerminationReason.MEMORY_CRITICAL;
                break;
            }

            QueueEntry entry = queue.pollFirst();
            String nodeKey = PackageCoordinate.keyOf(entry.name, entry.descriptor.getVersion());

            processedCount++;
            counters.totalNodes++;
            counters.maxDepth = Math.max(counters.maxDepth, entry.depth);

            if (nodeMap.containsKey(nodeKey)) {
                continue;
            }

            DependencyNode node = new DependencyNode(
                    entry.name,
                    entry.descriptor.getVersion(),
                    PackageStatus.CLEAN,
                    entry.depth == 1 ? DIRECT_DEPENDENCY : TRANSITIVE_DEPENDENCY,
                    entry.depth
            );
            nodeMap.put(nodeKey, node);
            visitedNodes.add(nodeKey);
            counters.uniquePackages++;

            if (entry.parentKey != null) {
                DependencyNode parent = nodeMap.get(entry.parentKey);
                if (parent != null) {
                    parent.addDependencyIfAbsent(node);
                }
            }

            Map<String, DependencyDescriptor> children = entry.descriptor.getDependencies();
            if (children.isEmpty()) {
                continue;
            }
            if (entry.depth < config.getMaxDepth()) {
                enqueueChildren(queue, children, entry.depth + 1, nodeKey);
            } else {
                log.debug("Depth limit {} reached for {}, skipping {} children",
                        config.getMaxDepth(), nodeKey, children.size());
                counters.warningsCount++;
            }
        }

        metrics = counters.snapshot(clock.millis() - startTime, termination);
        log.info("Processed {} nodes iteratively in {}ms ({} unique)",
                processedCount, metrics.getProcessingTimeMs(), nodeMap.size());
        return nodeMap;
    }

    private void enqueueChildren(Deque<QueueEntry> queue, Map<String, DependencyDescriptor> children,
                                 int depth, String parentKey) {
        for (Map.Entry<String, DependencyDescriptor> child : children.entrySet()) {
            String name = child.getKey();
            if (name == null || name.trim().isEmpty()) {
                throw new MalformedNodeException("Dependency descriptor has no name",
                        parentKey != null ? parentKey : "root");
            }
            DependencyDescriptor descriptor = child.getValue();
            if (descriptor == null || !descriptor.isResolved()) {
                log.debug("Skipping unresolved dependency {} (parent: {})", name, parentKey);
                continue;
            }
            queue.addLast(new QueueEntry(name, descriptor, depth, parentKey));
        }
    }

    // ========== Diagnostics and rollups ==========

    /**
     * Reports the cycles reachable from the roots. Independent of the
     * traversal state: metrics of the last traversal are left untouched.
     *
     * @see CycleDetector
     */
    public List<String> detectCycles(Collection<DependencyNode> roots) {
        return cycleDetector.detectCycles(roots);
    }

    /**
     * Computes the rollup below one dependency with a visited set of its own.
     * Independent of the traversal state.
     *
     * @see TransitiveDependencyAnalyzer
     */
    public TransitiveInfo calculateTransitiveInfo(DependencyNode node) {
        return transitiveAnalyzer.calculateTransitiveInfo(node);
    }

    /**
     * Returns the depth of the deepest package below {@code node} (node = 1).
     */
    public int calculateMaxDepth(DependencyNode node) {
        return transitiveAnalyzer.calculateMaxDepth(node);
    }

    // ========== State ==========

    /**
     * Returns the metrics of the last traversal.
     */
    public ProcessingMetrics getMetrics() {
        return metrics;
    }

    /**
     * Returns the distinct circular paths found by the last traversal, in
     * detection order.
     */
    public List<String> getCircularDependencies() {
        return Collections.unmodifiableList(new ArrayList<>(circularDependencies));
    }

    private void resetState() {
        visitedNodes.clear();
        circularDependencies.clear();
        counters = new Counters();
        metrics = ProcessingMetrics.empty();
    }

    /**
     * Samples heap usage and updates the counters.
     *
     * @return true if usage is above the critical threshold
     */
    private boolean isMemoryCritical() {
        long usedMB = memoryProbe.usedHeapMB();
        counters.memoryUsageMB = usedMB;

        if (config.isDebugMetrics()) {
            log.debug("Memory usage: {}MB", usedMB);
        }

        if (usedMB > config.getMemoryCriticalMB()) {
            log.error("Critical memory usage: {}MB (limit {}MB), stopping traversal",
                    usedMB, config.getMemoryCriticalMB());
            counters.errorsCount++;
            return true;
        }
        if (usedMB > config.getMemoryWarningMB()) {
            log.warn("High memory usage: {}MB - consider reducing scope", usedMB);
            counters.warningsCount++;
        }
        return false;
    }

    private static final class Frame {
        private final DependencyNode node;
        private final int depth;
        private final TraversalPath path;

        private Frame(DependencyNode node, int depth, TraversalPath path) {
            this.node = node;
            this.depth = depth;
            this.path = path;
        }
    }

    private static final class QueueEntry {
        private final String name;
        private final DependencyDescriptor descriptor;
        private final int depth;
        private final String parentKey;

        private QueueEntry(String name, DependencyDescriptor descriptor, int depth, String parentKey) {
            this.name = name;
            this.descriptor = descriptor;
            this.depth = depth;
            this.parentKey = parentKey;
        }
    }

    /**
     * Mutable counters of the traversal in progress.
     */
    private static final class Counters {
        private int totalNodes;
        private int uniquePackages;
        private int maxDepth;
        private int circularReferences;
        private long memoryUsageMB;
        private int warningsCount;
        private int errorsCount;

        private ProcessingMetrics snapshot(long processingTimeMs, TerminationReason reason) {
            return ProcessingMetrics.builder()
                    .totalNodes(totalNodes)
                    .uniquePackages(uniquePackages)
                    .maxDepth(maxDepth)
                    .circularReferences(circularReferences)
                    .processingTimeMs(processingTimeMs)
                    .memoryUsageMB(memoryUsageMB)
                    .warningsCount(warningsCount)
                    .errorsCount(errorsCount)
                    .terminationReason(reason)
                    .build();
        }
    }
}
