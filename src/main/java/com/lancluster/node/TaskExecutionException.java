package com.lancluster.node;

/**
 * The worker ran the task and reported failure. Carries the worker's message.
 */
public class TaskExecutionException extends ClusterException {
    private static final long serialVersionUID = 1L;

    private final String taskId;
    private final String workerMessage;

    public TaskExecutionException(String taskId, String workerMessage) {
        super("Task " + taskId + " failed: " + workerMessage);
        this.taskId = taskId;
        this.workerMessage = workerMessage;
    }

    public TaskExecutionException(String taskId, String workerMessage, Throwable cause) {
        super("Task " + taskId + " failed: " + workerMessage, cause);
        this.taskId = taskId;
        this.workerMessage = workerMessage;
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * @return the error description exactly as the worker reported it
     */
    public String getWorkerMessage() {
        return workerMessage;
    }
}
