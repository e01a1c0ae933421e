package com.lancluster.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Objects;

/**
 * Outcome of a task. On failure {@code result} holds the error description as text.
 */
public final class TaskResultMessage extends Message {

    private final String taskId;
    private final JsonNode result;
    private final boolean success;

    public TaskResultMessage(String taskId, JsonNode result, boolean success) {
        this.taskId = Objects.requireNonNull(taskId, "taskId cannot be null");
        this.result = result == null ? NullNode.getInstance() : result;
        this.success = success;
    }

    public static TaskResultMessage success(String taskId, JsonNode result) {
        return new TaskResultMessage(taskId, result, true);
    }

    public static TaskResultMessage failure(String taskId, String errorDescription) {
        return new TaskResultMessage(taskId, TextNode.valueOf(errorDescription), false);
    }

    @Override
    public MessageType getType() {
        return MessageType.TASK_RESULT;
    }

    public String getTaskId() {
        return taskId;
    }

    public JsonNode getResult() {
        return result;
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public String toString() {
        return String.format("TaskResultMessage{taskId=%s, success=%s}", taskId, success);
    }
}
