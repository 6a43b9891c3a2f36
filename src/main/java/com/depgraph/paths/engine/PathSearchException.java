package com.depgraph.paths.engine;

/**
 * Raised when a concurrent search task fails with a checked exception.
 * Unchecked failures are rethrown as they are.
 */
public class PathSearchException extends RuntimeException {

    public PathSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
