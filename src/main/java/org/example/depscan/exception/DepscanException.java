package org.example.depscan.exception;

/**
 * Base exception for all depscan errors.
 */
public class DepscanException extends Exception {

    public DepscanException(String message) {
        super(message);
    }

    public DepscanException(String message, Throwable cause) {
        super(message, cause);
    }
}
