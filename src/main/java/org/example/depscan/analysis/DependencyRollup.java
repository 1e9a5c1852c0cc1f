package org.example.depscan.analysis;

import org.example.depscan.model.PackageCoordinate;
import org.example.depscan.model.TransitiveInfo;

import java.util.Objects;

/**
 * Transitive rollup of one direct dependency.
 */
public class DependencyRollup {

    private final PackageCoordinate dependency;
    private final TransitiveInfo transitiveInfo;

    public DependencyRollup(PackageCoordinate dependency, TransitiveInfo transitiveInfo) {
        this.dependency = Objects.requireNonNull(dependency, "dependency cannot be null");
        this.transitiveInfo = Objects.requireNonNull(transitiveInfo, "transitiveInfo cannot be null");
    }

    public PackageCoordinate getDependency() {
        return dependency;
    }

    public TransitiveInfo getTransitiveInfo() {
        return transitiveInfo;
    }

    @Override
    public String toString() {
        return dependency + " -> " + transitiveInfo;
    }
}
