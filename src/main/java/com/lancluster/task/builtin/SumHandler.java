package com.lancluster.task.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.lancluster.task.TaskContext;
import com.lancluster.task.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sums numbers.
 *
 * Accepts either a JSON array of numbers, e.g. {@code [1, 2, 3.5]}, or an
 * inclusive integer range {@code {"start": 1, "end": 100}} (= 5050).
 * The result is an integer when every input is integral, a double otherwise.
 */
public class SumHandler implements TaskHandler {
    private static final Logger log = LoggerFactory.getLogger(SumHandler.class);

    public static final String NAME = "sum";

    @Override
    public JsonNode execute(JsonNode arguments, TaskContext context) {
        if (arguments.isArray()) {
            return sumArray(arguments);
        }
        if (arguments.isObject() && arguments.has("start") && arguments.has("end")) {
            return sumRange(arguments.get("start"), arguments.get("end"), context);
        }
        throw new IllegalArgumentException("sum expects an array of numbers or {start, end}");
    }

    private static JsonNode sumArray(JsonNode values) {
        long longSum = 0;
        double doubleSum = 0;
        boolean integral = true;
        for (int i = 0; i < values.size(); i++) {
            JsonNode value = values.get(i);
            if (!value.isNumber()) {
                throw new IllegalArgumentException("Element " + i + " is not a number: " + value);
            }
            if (integral && value.isIntegralNumber() && value.canConvertToLong()) {
                longSum = Math.addExact(longSum, value.asLong());
            } else {
                integral = false;
            }
            doubleSum += value.asDouble();
        }
        return integral ? LongNode.valueOf(longSum) : DoubleNode.valueOf(doubleSum);
    }

    private static JsonNode sumRange(JsonNode startNode, JsonNode endNode, TaskContext context) {
        if (!startNode.canConvertToLong() || !endNode.canConvertToLong()
                || !startNode.isIntegralNumber() || !endNode.isIntegralNumber()) {
            throw new IllegalArgumentException("start and end must be integers");
        }
        long start = startNode.asLong();
        long end = endNode.asLong();
        long sum = 0;
        for (long i = start; i <= end; i++) {
            sum = Math.addExact(sum, i);
        }
        log.debug("[{}] summing [{}-{}] = {}", context.getTaskId(), start, end, sum);
        return LongNode.valueOf(sum);
    }
}
