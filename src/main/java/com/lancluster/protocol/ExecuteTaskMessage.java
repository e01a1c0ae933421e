package com.lancluster.protocol;

import java.util.Objects;

public final class ExecuteTaskMessage extends Message {

    private final String taskId;
    private final WorkUnit work;

    public ExecuteTaskMessage(String taskId, WorkUnit work) {
        this.taskId = Objects.requireNonNull(taskId, "taskId cannot be null");
        this.work = Objects.requireNonNull(work, "work cannot be null");
    }

    @Override
    public MessageType getType() {
        return MessageType.EXECUTE_TASK;
    }

    public String getTaskId() {
        return taskId;
    }

    public WorkUnit getWork() {
        return work;
    }

    @Override
    public String toString() {
        return String.format("ExecuteTaskMessage{taskId=%s, handler=%s}", taskId, work.getHandler());
    }
}
