package com.lancluster.node;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-resolution slot for the outcome of one dispatched task.
 *
 * Resolved at most once: the first of {matching task_result, timeout, dispatcher stop}
 * wins and later attempts are ignored.
 */
public final class PendingResult {

    // Caps the deadline so nanoTime arithmetic cannot overflow
    private static final long MAX_WAIT_NANOS = Long.MAX_VALUE / 4;

    private final String taskId;
    private final WorkerRecord worker;
    private final long timeoutMs;
    private final long deadlineNanos;
    private final CompletableFuture<JsonNode> future = new CompletableFuture<>();

    PendingResult(String taskId, WorkerRecord worker, long timeoutMs) {
        this.taskId = taskId;
        this.worker = worker;
        this.timeoutMs = timeoutMs;
        this.deadlineNanos = System.nanoTime() + Math.min(TimeUnit.MILLISECONDS.toNanos(timeoutMs), MAX_WAIT_NANOS);
    }

    public String getTaskId() {
        return taskId;
    }

    public String getWorkerId() {
        return worker.getWorkerId();
    }

    WorkerRecord getWorker() {
        return worker;
    }

    /**
     * @return how long the caller waits, counted from reservation
     */
    public long getTimeoutMs() {
        return timeoutMs;
    }

    /**
     * @return true if this call resolved the slot, false if it was already resolved
     */
    boolean complete(JsonNode result) {
        return future.complete(result);
    }

    /**
     * @return true if this call resolved the slot, false if it was already resolved
     */
    boolean fail(Throwable cause) {
        return future.completeExceptionally(cause);
    }

    public boolean isResolved() {
        return future.isDone();
    }

    /**
     * Waits until resolution or the deadline, whichever comes first.
     *
     * @throws TimeoutException if the deadline passes first
     * @throws ExecutionException if the slot was resolved with a failure
     */
    JsonNode await() throws InterruptedException, ExecutionException, TimeoutException {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            if (future.isDone()) {
                return future.get();
            }
            throw new TimeoutException();
        }
        return future.get(remaining, TimeUnit.NANOSECONDS);
    }

    /**
     * Waits for resolution with no deadline. Only for a slot that has already
     * left the pending table, whose resolver is bound to finish.
     *
     * @throws ExecutionException if the slot was resolved with a failure
     */
    JsonNode join() throws InterruptedException, ExecutionException {
        return future.get();
    }
}
