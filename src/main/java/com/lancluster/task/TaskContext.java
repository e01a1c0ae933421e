package com.lancluster.task;

/**
 * Execution context of a task running on a worker.
 * Created by the worker's TaskExecutor for every execute_task it receives.
 */
public final class TaskContext {

    private final String taskId;
    private final String handlerName;
    private final String workerId;
    private final String hostname;

    public TaskContext(String taskId, String handlerName, String workerId, String hostname) {
        this.taskId = taskId;
        this.handlerName = handlerName;
        this.workerId = workerId;
        this.hostname = hostname;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getHandlerName() {
        return handlerName;
    }

    /**
     * @return unique ID of the worker executing the task
     */
    public String getWorkerId() {
        return workerId;
    }

    public String getHostname() {
        return hostname;
    }

    @Override
    public String toString() {
        return String.format("TaskContext[task=%s, handler=%s, worker=%s@%s]",
            taskId, handlerName, workerId, hostname);
    }
}
