package org.example.depscan.model;

import java.util.Objects;

/**
 * A resolved package instance, identified by name and version.
 *
 * <p>The key {@code name@version} is the only identity used for visited-set
 * membership, cycle detection and deduplication. Two versions of the same
 * package are different instances.</p>
 */
public class PackageCoordinate {

    private final String name;
    private final String version;

    public PackageCoordinate(String name, String version) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.version = Objects.requireNonNull(version, "version cannot be null");
    }

    public static PackageCoordinate of(String name, String version) {
        return new PackageCoordinate(name, version);
    }

    /**
     * Builds the identity key for a name/version pair.
     */
    public static String keyOf(String name, String version) {
        return name + "@" + version;
    }

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
        return keyOf(name, version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageCoordinate that = (PackageCoordinate) o;
        return name.equals(that.name) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version);
    }

    @Override
    public String toString() {
        return getKey();
    }
}
