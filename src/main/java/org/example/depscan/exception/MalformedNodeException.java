package org.example.depscan.exception;

/**
 * Thrown when a dependency node breaks the structural contract of the graph:
 * a blank name or version, or a null root or child entry.
 *
 * <p>This is a programming error in whatever built the graph, so it is
 * unchecked and never swallowed by the traversal.</p>
 */
public class MalformedNodeException extends IllegalArgumentException {

    private final String nodeReference;

    public MalformedNodeException(String message, String nodeReference) {
        super(message + " (node: " + nodeReference + ")");
        this.nodeReference = nodeReference;
    }

    /**
     * Returns the key, name or parent reference identifying the offending node.
     */
    public String getNodeReference() {
        return nodeReference;
    }
}
