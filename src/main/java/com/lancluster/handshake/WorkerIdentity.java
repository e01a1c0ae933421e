package com.lancluster.handshake;

import java.util.Objects;

/**
 * Who a worker claims to be, as presented in its auth message.
 */
public final class WorkerIdentity {

    private final String workerId;
    private final String hostname;

    public WorkerIdentity(String workerId, String hostname) {
        this.workerId = Objects.requireNonNull(workerId, "workerId cannot be null");
        this.hostname = hostname == null ? "unknown" : hostname;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getHostname() {
        return hostname;
    }

    @Override
    public String toString() {
        return workerId + " (" + hostname + ")";
    }
}
