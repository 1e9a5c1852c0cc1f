package org.example.depscan.traversal;

/**
 * Samples the memory currently used by the process.
 */
@FunctionalInterface
public interface MemoryProbe {

    /**
     * Returns the used heap in megabytes.
     */
    long usedHeapMB();
}
