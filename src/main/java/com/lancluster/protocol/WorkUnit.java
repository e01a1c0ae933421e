package com.lancluster.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

/**
 * What a worker is asked to run: the name of a handler registered on the worker
 * ahead of time, plus a structurally encoded argument tree.
 *
 * Nothing executable travels on the wire, only the name and the data.
 */
public final class WorkUnit {

    private final String handler;
    private final JsonNode arguments;

    public WorkUnit(String handler, JsonNode arguments) {
        this.handler = Objects.requireNonNull(handler, "handler cannot be null");
        this.arguments = arguments == null ? NullNode.getInstance() : arguments;
    }

    public String getHandler() {
        return handler;
    }

    public JsonNode getArguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkUnit)) {
            return false;
        }
        WorkUnit other = (WorkUnit) o;
        return handler.equals(other.handler) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(handler, arguments);
    }

    @Override
    public String toString() {
        return "WorkUnit{handler=" + handler + "}";
    }
}
