package com.lancluster.node;

/**
 * Point-in-time copy of a registered worker, as returned by
 * {@link Dispatcher#snapshotWorkers()}. Never changes after creation.
 */
public final class WorkerInfo {

    private final String workerId;
    private final String hostname;
    private final boolean active;
    private final String currentTask;
    private final long lastHeartbeat;

    /**
     * @param workerId unique worker id
     * @param hostname hostname reported by the worker
     * @param active false once the worker has been marked dead
     * @param currentTask id of the assigned task, or null when idle
     * @param lastHeartbeat epoch millis of the last heartbeat (or registration)
     */
    public WorkerInfo(String workerId, String hostname, boolean active, String currentTask, long lastHeartbeat) {
        this.workerId = workerId;
        this.hostname = hostname;
        this.active = active;
        this.currentTask = currentTask;
        this.lastHeartbeat = lastHeartbeat;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getHostname() {
        return hostname;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * @return id of the task assigned when the snapshot was taken, or null
     */
    public String getCurrentTask() {
        return currentTask;
    }

    public long getLastHeartbeat() {
        return lastHeartbeat;
    }

    /**
     * @return milliseconds since the last heartbeat, measured now
     */
    public long getSilenceMs() {
        return System.currentTimeMillis() - lastHeartbeat;
    }

    @Override
    public String toString() {
        return String.format("WorkerInfo{id=%s, host=%s, active=%s, task=%s, silence=%dms}",
                workerId, hostname, active, currentTask, getSilenceMs());
    }
}
