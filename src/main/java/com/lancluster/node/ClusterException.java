package com.lancluster.node;

/**
 * Base of the failures a caller of {@link Dispatcher#executeTask} has to handle.
 */
public class ClusterException extends Exception {
    private static final long serialVersionUID = 1L;

    public ClusterException(String message) {
        super(message);
    }

    public ClusterException(String message, Throwable cause) {
        super(message, cause);
    }
}
