package com.lancluster.task.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.lancluster.task.TaskContext;
import com.lancluster.task.TaskHandler;

/**
 * Always fails. The message is the text argument, or {@code {"message": "..."}}.
 */
public class FailHandler implements TaskHandler {

    public static final String NAME = "fail";

    @Override
    public JsonNode execute(JsonNode arguments, TaskContext context) {
        String message;
        if (arguments.isTextual()) {
            message = arguments.asText();
        } else if (arguments.hasNonNull("message")) {
            message = arguments.get("message").asText();
        } else {
            message = "Requested failure";
        }
        throw new IllegalStateException(message);
    }
}
