package com.lancluster.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.lancluster.protocol.WorkUnit;

import java.io.IOException;
import java.util.List;

/**
 * Handle used by callers to run work on the cluster.
 * Implemented by {@link Dispatcher}; the client layer depends only on this.
 */
public interface TaskDispatcher {

    /**
     * Sends a unit of work to a worker and blocks until its result arrives.
     *
     * @param taskId caller-chosen id, unique among in-flight tasks
     * @param work handler name and arguments
     * @param targetWorker worker to pin the task to, or null for the first idle one
     * @return the handler's result
     * @throws WorkerNotFoundException if {@code targetWorker} is not registered
     * @throws NoAvailableWorkerException if no worker is idle
     * @throws TaskTimeoutException if no result arrives within the task timeout
     * @throws TaskExecutionException if the worker reports a failure
     * @throws IOException if the task cannot be delivered or the dispatcher stops
     */
    JsonNode executeTask(String taskId, WorkUnit work, String targetWorker)
            throws ClusterException, IOException, InterruptedException;

    /**
     * @return a point-in-time view of connected workers
     */
    List<WorkerInfo> snapshotWorkers();
}
