package org.example.depscan.traversal;

import org.example.depscan.config.TraversalConfiguration;
import org.example.depscan.exception.MalformedNodeException;
import org.example.depscan.model.DependencyDescriptor;
import org.example.depscan.model.DependencyNode;
import org.example.depscan.model.PackageCoordinate;
import org.example.depscan.model.ProcessingMetrics;
import org.example.depscan.model.TerminationReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for IterativeDependencyTraverser.
 */
class IterativeDependencyTraverserTest {

    private TraversalConfiguration config;
    private IterativeDependencyTraverser traverser;

    @BeforeEach
    void setUp() {
        config = TraversalConfiguration.builder()
                .maxDepth(10)
                .maxNodes(1000)
                .maxProcessingTimeMs(60_000)
                .maxCircularRefs(100)
                .build();
        traverser = new IterativeDependencyTraverser(config);
    }

    private static DependencyNode node(String name, String version, DependencyNode... children) {
        DependencyNode node = new DependencyNode(name, version);
        for (DependencyNode child : children) {
            node.addDependency(child);
        }
        return node;
    }

    private static DependencyNode chain(int length) {
        DependencyNode root = node("root", "1.0.0");
        DependencyNode current = root;
        for (int i = 1; i < length; i++) {
            DependencyNode child = node("package-" + i, "1.0.0");
            current.addDependency(child);
            current = child;
        }
        return root;
    }

    private static DependencyNode wideRoot(int width) {
        DependencyNode root = node("root", "1.0.0");
        for (int i = 0; i < width; i++) {
            root.addDependency(node("package-" + i, "1.0.0"));
        }
        return root;
    }

    @Nested
    @DisplayName("collectAllPackages")
    class CollectAllPackages {

        @Test
        @DisplayName("should handle empty dependency tree")
        void shouldHandleEmptyTree() {
            List<PackageCoordinate> result = traverser.collectAllPackages(List.of());

            assertThat(result).isEmpty();
            assertThat(traverser.getMetrics().getTotalNodes()).isZero();
            assertThat(traverser.getMetrics().getTerminationReason()).isEqualTo(TerminationReason.COMPLETED);
        }

        @Test
        @DisplayName("should collect packages from simple dependency tree")
        void shouldCollectPackagesFromSimpleTree() {
            DependencyNode root = node("package-a", "1.0.0", node("package-b", "2.0.0"));

            List<PackageCoordinate> result = traverser.collectAllPackages(List.of(root));

            assertThat(result).containsExactlyInAnyOrder(
                    PackageCoordinate.of("package-a", "1.0.0"),
                    PackageCoordinate.of("package-b", "2.0.0"));

            ProcessingMetrics metrics = traverser.getMetrics();
            assertThat(metrics.getTotalNodes()).isEqualTo(2);
            assertThat(metrics.getUniquePackages()).isEqualTo(2);
            assertThat(metrics.getMaxDepth()).isEqualTo(2);
            assertThat(metrics.getErrorsCount()).isZero();
            assertThat(metrics.isTruncated()).isFalse();
        }

        @Test
        @DisplayName("should treat different versions of a package as distinct")
        void shouldTreatVersionsAsDistinct() {
            DependencyNode root = node("app", "1.0.0",
                    node("lib", "1.0.0"),
                    node("other", "1.0.0", node("lib", "2.0.0")));

            List<PackageCoordinate> result = traverser.collectAllPackages(List.of(root));

            assertThat(result).hasSize(4)
                    .contains(PackageCoordinate.of("lib", "1.0.0"), PackageCoordinate.of("lib", "2.0.0"));
        }

        @Test
        @DisplayName("should deduplicate a diamond dependency without reporting a cycle")
        void shouldDeduplicateDiamond() {
            DependencyNode shared = node("package-d", "1.0.0");
            DependencyNode root = node("root", "1.0.0",
                    node("package-b", "1.0.0", shared),
                    node("package-c", "1.0.0", shared));

            List<PackageCoordinate> result = traverser.collectAllPackages(List.of(root));

            assertThat(result).hasSize(4);
            assertThat(result).filteredOn(p -> p.getName().equals("package-d")).hasSize(1);

            ProcessingMetrics metrics = traverser.getMetrics();
            assertThat(metrics.getUniquePackages()).isEqualTo(4);
            assertThat(metrics.getTotalNodes()).isEqualTo(5);
            assertThat(metrics.getCircularReferences()).isZero();
            assertThat(traverser.getCircularDependencies()).isEmpty();
        }

        @Test
        @DisplayName("should handle circular dependencies without infinite loop")
        void shouldHandleCircularDependencies() {
            DependencyNode nodeB = node("package-b", "1.0.0");
            DependencyNode nodeA = node("package-a", "1.0.0", nodeB);
            nodeB.addDependency(nodeA);

            List<PackageCoordinate> result = traverser.collectAllPackages(List.of(nodeA));

            assertThat(result).containsExactlyInAnyOrder(
                    PackageCoordinate.of("package-a", "1.0.0"),
                    PackageCoordinate.of("package-b", "1.0.0"));
            assertThat(traverser.getMetrics().getCircularReferences()).isGreaterThanOrEqualTo(1);
            assertThat(traverser.getCircularDependencies())
                    .containsExactly("package-a@1.0.0 → package-b@1.0.0 → package-a@1.0.0");
        }

        @Test
        @DisplayName("should detect a package depending on itself")
        void shouldDetectSelfLoop() {
            DependencyNode self = node("package-a", "1.0.0");
            self.addDependency(self);

            List<PackageCoordinate> result = traverser.collectAllPackages(List.of(self));

            assertThat(result).containsExactly(PackageCoordinate.of("package-a", "1.0.0"));
            assertThat(traverser.getMetrics().getCircularReferences()).isEqualTo(1);
            assertThat(traverser.getCircularDependencies())
                    .containsExactly("package-a@1.0.0 → package-a@1.0.0");
        }

        @Test
        @DisplayName("should respect depth limits")
        void shouldRespectDepthLimits() {
            DependencyNode root = chain(16);

            List<PackageCoordinate> result = traverser.collectAllPackages(List.of(root), 10, 1000);

            assertThat(result).hasSizeLessThan(16).hasSize(10);
            ProcessingMetrics metrics = traverser.getMetrics();
            assertThat(metrics.getMaxDepth()).isLessThanOrEqualTo(10);
            assertThat(metrics.getWarningsCount()).isEqualTo(1);
            assertThat(metrics.getErrorsCount()).isZero();
        }

        @Test
        @DisplayName("should use configured depth limit by default")
        void shouldUseConfiguredDepthLimit() {
            List<PackageCoordinate> result = traverser.collectAllPackages(List.of(chain(15)));

            assertThat(result).hasSize(10);
            assertThat(traverser.getMetrics().getMaxDepth()).isEqualTo(10);
        }

        @Test
        @DisplayName("should handle large number of dependencies efficiently")
        void shouldHandleWideFanOut() {
            DependencyNode root = wideRoot(500);

            long start = System.currentTimeMillis();
            List<PackageCoordinate> result = traverser.collectAllPackages(List.of(root));
            long elapsed = System.currentTimeMillis() - start;

            assertThat(result).hasSize(501);
            assertThat(elapsed).isLessThan(1000);
            assertThat(traverser.getMetrics().getTotalNodes()).isEqualTo(501);
            assertThat(traverser.getMetrics().getUniquePackages()).isEqualTo(501);
        }

        @Test
        @DisplayName("should walk chains deeper than the call stack would allow")
        void shouldWalkVeryDeepChains() {
            DependencyNode root = chain(20_000);

            List<PackageCoordinate> result = traverser.collectAllPackages(List.of(root), 50_000, 50_000);

            assertThat(result).hasSize(20_000);
            assertThat(traverser.getMetrics().getMaxDepth()).isEqualTo(20_000);
        }

        @Test
        @DisplayName("should yield the same packages on repeated runs")
        void shouldBeIdempotent() {
            DependencyNode shared = node("shared", "1.0.0");
            DependencyNode nodeB = node("package-b", "1.0.0", shared);
            DependencyNode nodeA = node("package-a", "1.0.0", nodeB, shared);
            nodeB.addDependency(nodeA);

            List<PackageCoordinate> first = traverser.collectAllPackages(List.of(nodeA));
            ProcessingMetrics firstMetrics = traverser.getMetrics();
            List<PackageCoordinate> second = traverser.collectAllPackages(List.of(nodeA));
            ProcessingMetrics secondMetrics = traverser.getMetrics();

            assertThat(new HashSet<>(second)).isEqualTo(new HashSet<>(first));
            assertThat(second).hasSameSizeAs(first);
            assertThat(secondMetrics.getUniquePackages()).isEqualTo(firstMetrics.getUniquePackages());
            assertThat(secondMetrics.getMaxDepth()).isEqualTo(firstMetrics.getMaxDepth());
        }

        @Test
        @DisplayName("should reset state between calls")
        void shouldResetStateBetweenCalls() {
            DependencyNode nodeB = node("package-b", "1.0.0");
            DependencyNode nodeA = node("package-a", "1.0.0", nodeB);
            nodeB.addDependency(nodeA);
            traverser.collectAllPackages(List.of(nodeA));

            List<PackageCoordinate> result = traverser.collectAllPackages(List.of(node("package-a", "1.0.0")));

            assertThat(result).hasSize(1);
            assertThat(traverser.getCircularDependencies()).isEmpty();
            assertThat(traverser.getMetrics().getCircularReferences()).isZero();
            assertThat(traverser.getMetrics().getTotalNodes()).isEqualTo(1);
        }

        @Test
        @DisplayName("should collect packages from several roots")
        void shouldCollectFromSeveralRoots() {
            DependencyNode shared = node("shared", "1.0.0");
            DependencyNode first = node("first", "1.0.0", shared);
            DependencyNode second = node("second", "1.0.0", shared);

            List<PackageCoordinate> result = traverser.collectAllPackages(List.of(first, second));

            assertThat(result).extracting(PackageCoordinate::getKey)
                    .containsExactlyInAnyOrder("first@1.0.0", "second@1.0.0", "shared@1.0.0");
            assertThat(traverser.getCircularDependencies()).isEmpty();
        }

        @Test
        @DisplayName("should fail fast on a null root")
        void shouldFailOnNullRoot() {
            List<DependencyNode> roots = Arrays.asList(node("package-a", "1.0.0"), null);

            assertThatThrownBy(() -> traverser.collectAllPackages(roots))
                    .isInstanceOf(MalformedNodeException.class)
                    .hasMessageContaining("root-1");
        }
    }

    @Nested
    @DisplayName("Limits")
    class Limits {

        @Test
        @DisplayName("should stop at the node limit and report an error")
        void shouldStopAtNodeLimit() {
            List<PackageCoordinate> result = traverser.collectAllPackages(List.of(wideRoot(500)), 10, 100);

            assertThat(result).hasSize(100);
            ProcessingMetrics metrics = traverser.getMetrics();
            assertThat(metrics.getTotalNodes()).isEqualTo(100);
            assertThat(metrics.getErrorsCount()).isEqualTo(1);
            assertThat(metrics.getTerminationReason()).isEqualTo(TerminationReason.NODE_LIMIT);
            assertThat(metrics.isTruncated()).isTrue();
        }

        @Test
        @DisplayName("should not report an error when the node limit matches the graph")
        void shouldNotReportErrorWhenGraphFitsExactly() {
            traverser.collectAllPackages(List.of(wideRoot(99)), 10, 100);

            assertThat(traverser.getMetrics().getErrorsCount()).isZero();
            assertThat(traverser.getMetrics().getTotalNodes()).isEqualTo(100);
        }

        @Test
        @DisplayName("should stop when the processing time is exceeded")
        void shouldStopOnTimeout() {
            Clock clock = new SteppingClock(30_001);
            IterativeDependencyTraverser timed = new IterativeDependencyTraverser(config, clock, () -> 10L);

            List<PackageCoordinate> result = timed.collectAllPackages(List.of(chain(5)));

            assertThat(result).hasSize(1);
            ProcessingMetrics metrics = timed.getMetrics();
            assertThat(metrics.getErrorsCount()).isEqualTo(1);
            assertThat(metrics.getTerminationReason()).isEqualTo(TerminationReason.TIME_LIMIT);
        }

        @Test
        @DisplayName("should stop when memory usage is critical")
        void shouldStopOnCriticalMemory() {
            IterativeDependencyTraverser starved =
                    new IterativeDependencyTraverser(config, Clock.systemUTC(), () -> 10_000L);

            List<PackageCoordinate> result = starved.collectAllPackages(List.of(chain(5)));

            assertThat(result).isEmpty();
            ProcessingMetrics metrics = starved.getMetrics();
            assertThat(metrics.getErrorsCount()).isEqualTo(1);
            assertThat(metrics.getMemoryUsageMB()).isEqualTo(10_000L);
            assertThat(metrics.getTerminationReason()).isEqualTo(TerminationReason.MEMORY_CRITICAL);
        }

        @Test
        @DisplayName("should sample memory at the configured interval")
        void shouldSampleMemoryAtInterval() {
            TraversalConfiguration everyNode = config.toBuilder().memoryCheckInterval(1).build();
            AtomicInteger samples = new AtomicInteger();
            IterativeDependencyTraverser sampled = new IterativeDependencyTraverser(everyNode, Clock.systemUTC(),
                    () -> samples.incrementAndGet() <= 2 ? 100L : 7_000L);

            List<PackageCoordinate> result = sampled.collectAllPackages(List.of(chain(5)));

            assertThat(result).hasSize(2);
            assertThat(samples.get()).isEqualTo(3);
            assertThat(sampled.getMetrics().getTerminationReason()).isEqualTo(TerminationReason.MEMORY_CRITICAL);
        }

        @Test
        @DisplayName("should count a memory warning without stopping")
        void shouldWarnOnHighMemory() {
            IterativeDependencyTraverser busy =
                    new IterativeDependencyTraverser(config, Clock.systemUTC(), () -> 3_000L);

            List<PackageCoordinate> result = busy.collectAllPackages(List.of(chain(5)));

            assertThat(result).hasSize(5);
            assertThat(busy.getMetrics().getWarningsCount()).isEqualTo(1);
            assertThat(busy.getMetrics().getErrorsCount()).isZero();
        }

        @Test
        @DisplayName("should track memory usage")
        void shouldTrackMemoryUsage() {
            traverser.collectAllPackages(List.of(node("test-package", "1.0.0")));

            assertThat(traverser.getMetrics().getMemoryUsageMB()).isGreaterThan(0);
        }

        @Test
        @DisplayName("should stop after too many circular references")
        void shouldStopAfterTooManyCycles() {
            IterativeDependencyTraverser strict = new IterativeDependencyTraverser(
                    config.toBuilder().maxCircularRefs(1).build());
            DependencyNode nodeA = node("package-a", "1.0.0");
            DependencyNode nodeB = node("package-b", "1.0.0", nodeA);
            DependencyNode nodeC = node("package-c", "1.0.0", nodeA);
            nodeA.addDependency(nodeB).addDependency(nodeC);

            List<PackageCoordinate> result = strict.collectAllPackages(List.of(nodeA));

            assertThat(result).hasSize(3);
            ProcessingMetrics metrics = strict.getMetrics();
            assertThat(metrics.getCircularReferences()).isEqualTo(2);
            assertThat(metrics.getErrorsCount()).isEqualTo(1);
            assertThat(metrics.getTerminationReason()).isEqualTo(TerminationReason.CIRCULAR_LIMIT);
        }
    }

    @Nested
    @DisplayName("processTreeIteratively")
    class ProcessTreeIteratively {

        @Test
        @DisplayName("should process npm-style dependency object iteratively")
        void shouldProcessNestedDescriptors() {
            Map<String, DependencyDescriptor> dependencies = new LinkedHashMap<>();
            dependencies.put("lodash", new DependencyDescriptor("4.17.21",
                    Map.of("lodash.debounce", DependencyDescriptor.of("4.0.8"))));
            dependencies.put("express", new DependencyDescriptor("4.18.2",
                    Map.of("accepts", DependencyDescriptor.of("1.3.8"))));

            Map<String, DependencyNode> result = traverser.processTreeIteratively(dependencies);

            assertThat(result).containsOnlyKeys(
                    "lodash@4.17.21", "express@4.18.2", "lodash.debounce@4.0.8", "accepts@1.3.8");

            DependencyNode lodash = result.get("lodash@4.17.21");
            assertThat(lodash.getDepth()).isEqualTo(1);
            assertThat(lodash.getDependencyType()).isEqualTo("dependencies");
            assertThat(lodash.getDependencies()).containsOnlyKeys("lodash.debounce");

            DependencyNode debounce = result.get("lodash.debounce@4.0.8");
            assertThat(debounce.getDepth()).isEqualTo(2);
            assertThat(debounce.getDependencyType()).isEqualTo("transitive");
            assertThat(lodash.getDependencies().get("lodash.debounce")).isSameAs(debounce);
        }

        @Test
        @DisplayName("should respect node limits")
        void shouldRespectNodeLimits() {
            Map<String, DependencyDescriptor> dependencies = new LinkedHashMap<>();
            for (int i = 0; i < 1500; i++) {
                dependencies.put("package-" + i, DependencyDescriptor.of("1.0.0"));
            }

            Map<String, DependencyNode> result = traverser.processTreeIteratively(dependencies, 1000);

            assertThat(result).hasSize(1000);
            assertThat(traverser.getMetrics().getErrorsCount()).isEqualTo(1);
            assertThat(traverser.getMetrics().getTerminationReason()).isEqualTo(TerminationReason.NODE_LIMIT);
        }

        @Test
        @DisplayName("should attach a shared child only to its first parent")
        void shouldAttachSharedChildToFirstParent() {
            Map<String, DependencyDescriptor> dependencies = new LinkedHashMap<>();
            dependencies.put("a", new DependencyDescriptor("1.0.0", Map.of("shared", DependencyDescriptor.of("1.0.0"))));
            dependencies.put("b", new DependencyDescriptor("1.0.0", Map.of("shared", DependencyDescriptor.of("1.0.0"))));

            Map<String, DependencyNode> result = traverser.processTreeIteratively(dependencies);

            assertThat(result).hasSize(3);
            assertThat(result.get("a@1.0.0").getDependencies()).containsKey("shared");
            assertThat(result.get("b@1.0.0").getDependencies()).isEmpty();
            assertThat(traverser.getMetrics().getTotalNodes()).isEqualTo(4);
            assertThat(traverser.getMetrics().getUniquePackages()).isEqualTo(3);
        }

        @Test
        @DisplayName("should skip descriptors without a version")
        void shouldSkipUnresolvedDescriptors() {
            Map<String, DependencyDescriptor> dependencies = new LinkedHashMap<>();
            dependencies.put("resolved", DependencyDescriptor.of("1.0.0"));
            dependencies.put("linked", new DependencyDescriptor(null));
            dependencies.put("missing", null);

            Map<String, DependencyNode> result = traverser.processTreeIteratively(dependencies);

            assertThat(result).containsOnlyKeys("resolved@1.0.0");
        }

        @Test
        @DisplayName("should not enqueue children beyond the configured depth")
        void shouldRespectConfiguredDepth() {
            IterativeDependencyTraverser shallow = new IterativeDependencyTraverser(
                    config.toBuilder().maxDepth(2).build());
            DependencyDescriptor c = DependencyDescriptor.of("1.0.0");
            DependencyDescriptor b = new DependencyDescriptor("1.0.0", Map.of("c", c));
            Map<String, DependencyDescriptor> dependencies = Map.of("a", new DependencyDescriptor("1.0.0", Map.of("b", b)));

            Map<String, DependencyNode> result = shallow.processTreeIteratively(dependencies);

            assertThat(result).containsOnlyKeys("a@1.0.0", "b@1.0.0");
            assertThat(shallow.getMetrics().getWarningsCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should start at the given depth")
        void shouldStartAtGivenDepth() {
            Map<String, DependencyNode> result = traverser.processTreeIteratively(
                    Map.of("nested", DependencyDescriptor.of("1.0.0")), 100, 3);

            DependencyNode nested = result.get("nested@1.0.0");
            assertThat(nested.getDepth()).isEqualTo(3);
            assertThat(nested.getDependencyType()).isEqualTo("transitive");
        }

        @Test
        @DisplayName("should fail fast on a blank package name")
        void shouldFailOnBlankName() {
            Map<String, DependencyDescriptor> dependencies = Map.of(
                    "parent", new DependencyDescriptor("1.0.0", Map.of(" ", DependencyDescriptor.of("1.0.0"))));

            assertThatThrownBy(() -> traverser.processTreeIteratively(dependencies))
                    .isInstanceOf(MalformedNodeException.class)
                    .hasMessageContaining("parent@1.0.0");
        }

        @Test
        @DisplayName("should produce nodes the full traversal can walk")
        void shouldProduceTraversableNodes() {
            Map<String, DependencyDescriptor> dependencies = new LinkedHashMap<>();
            dependencies.put("a", new DependencyDescriptor("1.0.0", Map.of("b", DependencyDescriptor.of("2.0.0"))));

            Map<String, DependencyNode> nodes = traverser.processTreeIteratively(dependencies);
            List<DependencyNode> roots = new ArrayList<>();
            roots.add(nodes.get("a@1.0.0"));

            assertThat(traverser.collectAllPackages(roots)).extracting(PackageCoordinate::getKey)
                    .containsExactlyInAnyOrder("a@1.0.0", "b@2.0.0");
        }
    }

    @Nested
    @DisplayName("Diagnostics")
    class Diagnostics {

        @Test
        @DisplayName("should detect cycles without touching traversal metrics")
        void shouldDetectCyclesIndependently() {
            traverser.collectAllPackages(List.of(node("x", "1.0.0")));
            ProcessingMetrics before = traverser.getMetrics();

            DependencyNode nodeB = node("package-b", "1.0.0");
            DependencyNode nodeA = node("package-a", "1.0.0", nodeB);
            nodeB.addDependency(nodeA);

            List<String> cycles = traverser.detectCycles(List.of(nodeA));

            assertThat(cycles).hasSize(1);
            assertThat(cycles.get(0)).contains("package-a").contains("package-b");
            assertThat(traverser.getMetrics()).isSameAs(before);
        }

        @Test
        @DisplayName("should compute rollups without touching traversal metrics")
        void shouldComputeRollupsIndependently() {
            traverser.collectAllPackages(List.of(node("x", "1.0.0")));
            ProcessingMetrics before = traverser.getMetrics();

            DependencyNode root = node("root", "1.0.0", node("mid", "1.0.0", node("leaf", "1.0.0")));

            assertThat(traverser.calculateTransitiveInfo(root).getCount()).isEqualTo(2);
            assertThat(traverser.calculateMaxDepth(root)).isEqualTo(3);
            assertThat(traverser.getMetrics()).isSameAs(before);
        }

        @Test
        @DisplayName("should provide complete metrics")
        void shouldProvideCompleteMetrics() {
            traverser.collectAllPackages(List.of(node("test-package", "1.0.0")));

            ProcessingMetrics metrics = traverser.getMetrics();

            assertThat(metrics.getProcessingTimeMs()).isBetween(0L, 1000L);
            assertThat(metrics.getTotalNodes()).isEqualTo(1);
            assertThat(metrics.getUniquePackages()).isEqualTo(1);
            assertThat(metrics.getMaxDepth()).isEqualTo(1);
            assertThat(metrics.getCircularReferences()).isZero();
            assertThat(metrics.getWarningsCount()).isZero();
            assertThat(metrics.getErrorsCount()).isZero();
        }
    }
}
