package org.example.depscan.exception;

/**
 * Exception thrown when the dependency graph cannot be resolved.
 */
public class ResolutionException extends DepscanException {

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
