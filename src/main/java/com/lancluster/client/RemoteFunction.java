package com.lancluster.client;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lancluster.node.ClusterException;
import com.lancluster.node.TaskDispatcher;
import com.lancluster.protocol.WorkUnit;
import com.lancluster.util.Jsons;

import java.io.IOException;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * A worker handler seen as a typed function.
 *
 * Each {@link #call} generates a task id {@code <handler>_<8 hex>}, converts the
 * argument to JSON, dispatches it and converts the result back to {@code R}.
 * Instances are immutable; {@link #onWorker} returns a pinned copy.
 *
 * @param <A> argument type
 * @param <R> result type
 */
public final class RemoteFunction<A, R> {

    private final TaskDispatcher dispatcher;
    private final String handler;
    private final JavaType resultType;
    private final String targetWorker;
    private final ObjectMapper mapper = Jsons.mapper();

    RemoteFunction(TaskDispatcher dispatcher, String handler, JavaType resultType, String targetWorker) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher cannot be null");
        this.handler = Objects.requireNonNull(handler, "handler cannot be null");
        this.resultType = Objects.requireNonNull(resultType, "resultType cannot be null");
        this.targetWorker = targetWorker;
    }

    /**
     * @return a copy that always runs on the given worker
     */
    public RemoteFunction<A, R> onWorker(String workerId) {
        return new RemoteFunction<>(dispatcher, handler, resultType, workerId);
    }

    /**
     * Runs the handler remotely and waits for its result.
     *
     * @throws IllegalArgumentException if the worker's result cannot be converted to {@code R}
     */
    public R call(A argument) throws ClusterException, IOException, InterruptedException {
        JsonNode arguments = mapper.valueToTree(argument);
        JsonNode result = dispatcher.executeTask(newTaskId(handler), new WorkUnit(handler, arguments), targetWorker);
        return mapper.convertValue(result, resultType);
    }

    /**
     * Runs {@link #call} on the given executor. Checked failures surface as the
     * cause of the future's {@link CompletionException}.
     */
    public CompletableFuture<R> callAsync(A argument, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call(argument);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            } catch (ClusterException | IOException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    public String getHandler() {
        return handler;
    }

    /**
     * @return the pinned worker id, or null when any idle worker may run it
     */
    public String getTargetWorker() {
        return targetWorker;
    }

    /**
     * @return a task id of the form {@code <handler>_<8 hex chars>}
     */
    public static String newTaskId(String handler) {
        return handler + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    @Override
    public String toString() {
        return "RemoteFunction{" + handler + (targetWorker != null ? " @" + targetWorker : "") + "}";
    }
}
