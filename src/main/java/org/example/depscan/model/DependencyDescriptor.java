package org.example.depscan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw, lock-file shaped description of a dependency: a version and the
 * nested dependencies it declares, keyed by package name.
 *
 * <p>A descriptor without a version is an unresolved entry (a link or a
 * bundled placeholder) and is skipped when a node map is built from it.</p>
 */
public class DependencyDescriptor {

    private final String version;
    private final Map<String, DependencyDescriptor> dependencies;

    public DependencyDescriptor(String version) {
        this(version, Collections.emptyMap());
    }

    public DependencyDescriptor(String version, Map<String, DependencyDescriptor> dependencies) {
        this.version = version;
        this.dependencies = dependencies != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(dependencies))
                : Collections.emptyMap();
    }

    public static DependencyDescriptor of(String version) {
        return new DependencyDescriptor(version);
    }

    public String getVersion() {
        return version;
    }

    public boolean isResolved() {
        return version != null && !version.trim().isEmpty();
    }

    public Map<String, DependencyDescriptor> getDependencies() {
        return dependencies;
    }

    @Override
    public String toString() {
        return "DependencyDescriptor{version='" + version + "', dependencies=" + dependencies.keySet() + '}';
    }
}
