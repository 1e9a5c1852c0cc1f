package org.example.depscan.model;

import java.util.Objects;

/**
 * Vulnerability and freshness flags attached to a dependency node.
 * Read by the rollups, never mutated by a traversal.
 */
public class PackageStatus {

    /**
     * Status of a package with no known vulnerabilities that is up to date.
     */
    public static final PackageStatus CLEAN = new PackageStatus(false, 0, false, null);

    private final boolean vulnerable;
    private final int vulnerabilityCount;
    private final boolean outdated;
    private final String latestVersion;

    /**
     * Creates a new PackageStatus.
     *
     * @param vulnerable         whether any known vulnerability affects the package
     * @param vulnerabilityCount number of known vulnerabilities (0 unless vulnerable)
     * @param outdated           whether a newer version is available
     * @param latestVersion      latest known version, may be null
     * @throws IllegalArgumentException if the count is negative or inconsistent with the flag
     */
    public PackageStatus(boolean vulnerable, int vulnerabilityCount, boolean outdated, String latestVersion) {
        if (vulnerabilityCount < 0) {
            throw new IllegalArgumentException("vulnerabilityCount cannot be negative: " + vulnerabilityCount);
        }
        if (!vulnerable && vulnerabilityCount > 0) {
            throw new IllegalArgumentException(
                    "vulnerabilityCount must be 0 for a non-vulnerable package, but was: " + vulnerabilityCount);
        }
        this.vulnerable = vulnerable;
        this.vulnerabilityCount = vulnerabilityCount;
        this.outdated = outdated;
        this.latestVersion = latestVersion;
    }

    public static PackageStatus vulnerable(int vulnerabilityCount) {
        return new PackageStatus(true, vulnerabilityCount, false, null);
    }

    public static PackageStatus outdated(String latestVersion) {
        return new PackageStatus(false, 0, true, latestVersion);
    }

    public boolean isVulnerable() {
        return vulnerable;
    }

    public int getVulnerabilityCount() {
        return vulnerabilityCount;
    }

    public boolean isOutdated() {
        return outdated;
    }

    public String getLatestVersion() {
        return latestVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageStatus that = (PackageStatus) o;
        return vulnerable == that.vulnerable &&
               vulnerabilityCount == that.vulnerabilityCount &&
               outdated == that.outdated &&
               Objects.equals(latestVersion, that.latestVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vulnerable, vulnerabilityCount, outdated, latestVersion);
    }

    @Override
    public String toString() {
        return "PackageStatus{" +
                "vulnerable=" + vulnerable +
                ", vulnerabilityCount=" + vulnerabilityCount +
                ", outdated=" + outdated +
                (latestVersion != null ? ", latestVersion='" + latestVersion + '\'' : "") +
                '}';
    }
}
