package com.lancluster.task.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.lancluster.task.TaskContext;
import com.lancluster.task.TaskHandler;

/**
 * Sleeps for the requested number of milliseconds and returns that number.
 * Arguments: a number, or {@code {"millis": n}}.
 */
public class SleepHandler implements TaskHandler {

    public static final String NAME = "sleep";

    @Override
    public JsonNode execute(JsonNode arguments, TaskContext context) throws InterruptedException {
        JsonNode millisNode = arguments.isObject() ? arguments.path("millis") : arguments;
        if (!millisNode.isIntegralNumber() || millisNode.asLong() < 0) {
            throw new IllegalArgumentException("sleep expects a non-negative millis value");
        }
        long millis = millisNode.asLong();
        Thread.sleep(millis);
        return LongNode.valueOf(millis);
    }
}
