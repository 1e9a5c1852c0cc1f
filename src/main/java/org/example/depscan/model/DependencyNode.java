package org.example.depscan.model;

import org.example.depscan.exception.MalformedNodeException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A package instance in a resolved dependency graph.
 *
 * <p>Children are keyed by package name. The same node instance may be the
 * child of several parents, and a node may (indirectly) depend on itself,
 * so the structure is a graph and not a tree. Traversals never rely on
 * {@link #getDepth()}; it is advisory data set by whoever built the graph.</p>
 */
public class DependencyNode {

    private final String name;
    private final String version;
    private final Map<String, DependencyNode> dependencies;
    private final PackageStatus status;
    private final String dependencyType;
    private final int depth;

    /**
     * Creates a node with a clean status at depth 1.
     */
    public DependencyNode(String name, String version) {
        this(name, version, PackageStatus.CLEAN, null, 1);
    }

    /**
     * Creates a new DependencyNode.
     *
     * @param name           package name, must not be blank
     * @param version        resolved version, must not be blank (non-semver values such as "unknown" are fine)
     * @param status         vulnerability/outdated payload, null means {@link PackageStatus#CLEAN}
     * @param dependencyType how the package was declared (dependencies, devDependencies, transitive...), may be null
     * @param depth          advisory depth
     * @throws MalformedNodeException if name or version is blank
     */
    public DependencyNode(String name, String version, PackageStatus status, String dependencyType, int depth) {
        if (name == null || name.trim().isEmpty()) {
            throw new MalformedNodeException("Dependency node has no name", "?@" + version);
        }
        if (version == null || version.trim().isEmpty()) {
            throw new MalformedNodeException("Dependency node has no version", name + "@?");
        }
        this.name = name;
        this.version = version;
        this.status = status != null ? status : PackageStatus.CLEAN;
        this.dependencyType = dependencyType;
        this.depth = depth;
        this.dependencies = new LinkedHashMap<>();
    }

    /**
     * Creates a new DependencyNode using the builder pattern.
     */
    public static Builder builder() {
        return new Builder();
    }

    // Getters

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Returns the identity key ({@code name@version}).
     */
    public String getKey() {
        return PackageCoordinate.keyOf(name, version);
    }

    public PackageCoordinate getCoordinate() {
        return new PackageCoordinate(name, version);
    }

    public PackageStatus getStatus() {
        return status;
    }

    public boolean isVulnerable() {
        return status.isVulnerable();
    }

    public int getVulnerabilityCount() {
        return status.getVulnerabilityCount();
    }

    public boolean isOutdated() {
        return status.isOutdated();
    }

    public String getDependencyType() {
        return dependencyType;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Returns the direct dependencies of this node, keyed by package name.
     */
    public Map<String, DependencyNode> getDependencies() {
        return Collections.unmodifiableMap(dependencies);
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    // Graph construction

    /**
     * Adds (or replaces) a direct dependency under its package name.
     *
     * @return this node, for chaining
     */
    public DependencyNode addDependency(DependencyNode child) {
        Objects.requireNonNull(child, "child cannot be null");
        dependencies.put(child.getName(), child);
        return this;
    }

    /**
     * Adds a direct dependency only when no dependency with the same name is attached yet.
     *
     * @return true if the child was attached
     */
    public boolean addDependencyIfAbsent(DependencyNode child) {
        Objects.requireNonNull(child, "child cannot be null");
        return dependencies.putIfAbsent(child.getName(), child) == null;
    }

    @Override
    public String toString() {
        return "DependencyNode{" + getKey() +
                ", dependencies=" + dependencies.size() +
                ", depth=" + depth +
                (dependencyType != null ? ", type=" + dependencyType : "") +
                '}';
    }

    /**
     * Builder for DependencyNode.
     */
    public static class Builder {
        private String name;
        private String version;
        private PackageStatus status = PackageStatus.CLEAN;
        private String dependencyType;
        private int depth = 1;
        private final Map<String, DependencyNode> dependencies = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder status(PackageStatus status) {
            this.status = status;
            return this;
        }

        public Builder dependencyType(String dependencyType) {
            this.dependencyType = dependencyType;
            return this;
        }

        public Builder depth(int depth) {
            this.depth = depth;
            return this;
        }

        public Builder dependency(DependencyNode child) {
            Objects.requireNonNull(child, "child cannot be null");
            this.dependencies.put(child.getName(), child);
            return this;
        }

        public DependencyNode build() {
            DependencyNode node = new DependencyNode(name, version, status, dependencyType, depth);
            dependencies.values().forEach(node::addDependency);
            return node;
        }
    }
}
