package com.lancluster.task.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.lancluster.task.TaskContext;
import com.lancluster.task.TaskHandler;

/**
 * Returns its arguments unchanged.
 */
public class EchoHandler implements TaskHandler {

    public static final String NAME = "echo";

    @Override
    public JsonNode execute(JsonNode arguments, TaskContext context) {
        return arguments;
    }
}
