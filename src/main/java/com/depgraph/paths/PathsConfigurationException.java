package com.depgraph.paths;

/**
 * Invalid or missing command options. Always raised before any graph is
 * loaded.
 */
public class PathsConfigurationException extends RuntimeException {

    public PathsConfigurationException(String message) {
        super(message);
    }

    public PathsConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
