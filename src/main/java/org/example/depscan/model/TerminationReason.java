package org.example.depscan.model;

/**
 * Why a traversal stopped. Anything other than {@link #COMPLETED} means the
 * result is partial but valid.
 */
public enum TerminationReason {
    COMPLETED,
    TIME_LIMIT,
    NODE_LIMIT,
    MEMORY_CRITICAL,
    CIRCULAR_LIMIT;

    public boolean isTruncation() {
        return this != COMPLETED;
    }
}
