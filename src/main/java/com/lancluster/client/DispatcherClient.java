package com.lancluster.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lancluster.node.TaskDispatcher;
import com.lancluster.node.WorkerInfo;
import com.lancluster.util.Jsons;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for calling worker handlers as typed functions.
 *
 * <pre>
 * DispatcherClient client = new DispatcherClient(dispatcher);
 * RemoteFunction&lt;int[], Long&gt; sum = client.function("sum", Long.class);
 * long total = sum.call(new int[] {1, 2, 3});
 * </pre>
 */
public class DispatcherClient {

    private final TaskDispatcher dispatcher;

    public DispatcherClient(TaskDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher cannot be null");
    }

    /**
     * @param handler name the workers registered the handler under
     * @param resultType class the result is converted to
     */
    public <A, R> RemoteFunction<A, R> function(String handler, Class<R> resultType) {
        return new RemoteFunction<>(dispatcher, handler,
                Jsons.mapper().getTypeFactory().constructType(resultType), null);
    }

    /**
     * Variant for generic result types, e.g. {@code new TypeReference<List<String>>() {}}.
     */
    public <A, R> RemoteFunction<A, R> function(String handler, TypeReference<R> resultType) {
        return new RemoteFunction<>(dispatcher, handler,
                Jsons.mapper().getTypeFactory().constructType(resultType), null);
    }

    public List<WorkerInfo> workers() {
        return dispatcher.snapshotWorkers();
    }
}
