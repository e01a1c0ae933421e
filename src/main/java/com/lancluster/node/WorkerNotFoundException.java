package com.lancluster.node;

/**
 * The explicitly requested worker is not registered or no longer active.
 */
public class WorkerNotFoundException extends ClusterException {
    private static final long serialVersionUID = 1L;

    private final String workerId;

    public WorkerNotFoundException(String workerId) {
        super("Target worker " + workerId + " not found");
        this.workerId = workerId;
    }

    public String getWorkerId() {
        return workerId;
    }
}
