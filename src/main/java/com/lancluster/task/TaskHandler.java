package com.lancluster.task;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A named unit of work a worker knows how to run.
 *
 * Handlers are registered on the worker under a name; the dispatcher sends
 * that name plus JSON arguments, never code. A handler may be called from
 * several executor threads at once.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Runs the work.
     *
     * @param arguments JSON arguments sent by the caller, never null (may be a NullNode)
     * @param context identity of the task and the worker running it
     * @return the result sent back to the dispatcher; null is sent as JSON null
     * @throws Exception any failure, reported to the caller as a failed task_result
     */
    JsonNode execute(JsonNode arguments, TaskContext context) throws Exception;
}
