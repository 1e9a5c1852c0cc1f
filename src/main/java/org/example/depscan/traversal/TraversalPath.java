package org.example.depscan.traversal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable chain of node keys from a root to the frame being processed.
 *
 * <p>Frames pushed for the children of one node share the same parent
 * chain, so extending a path costs one object instead of a list copy.
 * The chain starts with a synthetic {@code root-N} marker that is never
 * reported as part of a cycle.</p>
 */
final class TraversalPath {

    private static final String CYCLE_SEPARATOR = " → ";

    private final String key;
    private final TraversalPath parent;
    private final boolean synthetic;

    private TraversalPath(String key, TraversalPath parent, boolean synthetic) {
        this.key = key;
        this.parent = parent;
        this.synthetic = synthetic;
    }

    static TraversalPath root(int index) {
        return new TraversalPath("root-" + index, null, true);
    }

    TraversalPath append(String nodeKey) {
        return new TraversalPath(nodeKey, this, false);
    }

    /**
     * Returns true if the key is an ancestor on this path.
     */
    boolean contains(String nodeKey) {
        for (TraversalPath p = this; p != null; p = p.parent) {
            if (!p.synthetic && p.key.equals(nodeKey)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the node keys from the root to this element, synthetic marker excluded.
     */
    List<String> keys() {
        List<String> keys = new ArrayList<>();
        for (TraversalPath p = this; p != null; p = p.parent) {
            if (!p.synthetic) {
                keys.add(p.key);
            }
        }
        Collections.reverse(keys);
        return keys;
    }

    /**
     * Formats the path followed by the key that closes a cycle.
     */
    String describeCycle(String closingKey) {
        List<String> keys = keys();
        keys.add(closingKey);
        return String.join(CYCLE_SEPARATOR, keys);
    }

    @Override
    public String toString() {
        return String.join(CYCLE_SEPARATOR, keys());
    }
}
