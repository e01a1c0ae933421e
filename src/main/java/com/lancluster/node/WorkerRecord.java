package com.lancluster.node;

import com.lancluster.network.FramedChannel;

import java.util.Objects;

/**
 * Dispatcher-side state of one connected worker.
 *
 * Identity and channel are fixed at registration. The mutable fields
 * (last heartbeat, active flag, current task) are only read and written by
 * {@link WorkerRegistry} while it holds its lock, because the connection loop,
 * the failure detector and executeTask callers all touch them.
 */
public final class WorkerRecord {

    private final String workerId;
    private final String hostname;
    private final FramedChannel channel;

    // Guarded by the WorkerRegistry lock
    private long lastHeartbeat;
    private long lastHeartbeatEpochMs;
    private boolean active = true;
    private String currentTask;

    /**
     * @param lastHeartbeat {@link com.lancluster.util.MonotonicClock} reading taken at admission
     */
    public WorkerRecord(String workerId, String hostname, FramedChannel channel, long lastHeartbeat) {
        this.workerId = Objects.requireNonNull(workerId, "workerId cannot be null");
        this.hostname = hostname;
        this.channel = Objects.requireNonNull(channel, "channel cannot be null");
        this.lastHeartbeat = lastHeartbeat;
        this.lastHeartbeatEpochMs = System.currentTimeMillis();
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getHostname() {
        return hostname;
    }

    public FramedChannel getChannel() {
        return channel;
    }

    // ==================== Registry-only accessors ====================

    long getLastHeartbeat() {
        return lastHeartbeat;
    }

    /**
     * @param lastHeartbeat monotonic reading, compared against the eviction threshold
     * @param epochMs wall-clock time of the same heartbeat, for display only
     */
    void setLastHeartbeat(long lastHeartbeat, long epochMs) {
        this.lastHeartbeat = lastHeartbeat;
        this.lastHeartbeatEpochMs = epochMs;
    }

    boolean isActive() {
        return active;
    }

    void setActive(boolean active) {
        this.active = active;
    }

    String getCurrentTask() {
        return currentTask;
    }

    void setCurrentTask(String currentTask) {
        this.currentTask = currentTask;
    }

    WorkerInfo toInfo() {
        return new WorkerInfo(workerId, hostname, active, currentTask, lastHeartbeatEpochMs);
    }

    @Override
    public String toString() {
        return workerId + " (" + hostname + ")";
    }
}
