package com.lancluster.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lancluster.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to handler table consulted by the worker for every execute_task.
 */
public class TaskRegistry {
    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();

    /**
     * A handler working on plain Java types instead of JSON trees.
     *
     * @param <A> argument type, converted from the JSON arguments
     * @param <R> result type, converted back to JSON
     */
    @FunctionalInterface
    public interface TypedHandler<A, R> {
        R apply(A argument, TaskContext context) throws Exception;
    }

    /**
     * Registers a handler, replacing any previous one with the same name.
     *
     * @return this registry, for chaining
     */
    public TaskRegistry register(String name, TaskHandler handler) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("handler name cannot be blank");
        }
        TaskHandler previous = handlers.put(name, handler);
        if (previous != null) {
            log.warn("Handler '{}' replaced", name);
        } else {
            log.debug("Handler '{}' registered", name);
        }
        return this;
    }

    /**
     * Registers a handler whose arguments and result are converted with Jackson.
     *
     * @param argumentType class the JSON arguments are converted to
     */
    public <A, R> TaskRegistry register(String name, Class<A> argumentType, TypedHandler<A, R> handler) {
        Objects.requireNonNull(argumentType, "argumentType cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
        ObjectMapper mapper = Jsons.mapper();
        return register(name, (arguments, context) -> {
            A argument = arguments.isNull() ? null : mapper.convertValue(arguments, argumentType);
            R result = handler.apply(argument, context);
            return mapper.valueToTree(result);
        });
    }

    public Optional<TaskHandler> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(name));
    }

    public boolean unregister(String name) {
        return handlers.remove(name) != null;
    }

    /**
     * @return registered handler names, sorted
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(handlers.keySet());
        Collections.sort(names);
        return names;
    }

    public int size() {
        return handlers.size();
    }
}
