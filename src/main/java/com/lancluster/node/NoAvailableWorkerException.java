package com.lancluster.node;

/**
 * No active worker is idle at dispatch time. Raised immediately, nothing waits.
 */
public class NoAvailableWorkerException extends ClusterException {
    private static final long serialVersionUID = 1L;

    public NoAvailableWorkerException() {
        super("No available workers");
    }
}
