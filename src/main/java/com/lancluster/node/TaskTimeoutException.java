package com.lancluster.node;

/**
 * No result arrived before the task deadline. Only the local wait is abandoned,
 * the worker is not told to stop.
 */
public class TaskTimeoutException extends ClusterException {
    private static final long serialVersionUID = 1L;

    private final String taskId;
    private final long timeoutMs;

    public TaskTimeoutException(String taskId, long timeoutMs) {
        super("Task " + taskId + " timed out after " + timeoutMs + "ms");
        this.taskId = taskId;
        this.timeoutMs = timeoutMs;
    }

    public String getTaskId() {
        return taskId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
