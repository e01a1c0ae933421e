package com.lancluster.task.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.lancluster.task.TaskContext;
import com.lancluster.task.TaskRegistry;
import com.lancluster.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class BuiltinHandlersTest {

    private static final TaskContext CONTEXT = new TaskContext("t1", "h", "w1", "box");

    private static JsonNode json(String text) throws Exception {
        return Jsons.mapper().readTree(text);
    }

    @Test
    void registerAllAddsEveryBuiltin() {
        TaskRegistry registry = BuiltinHandlers.registerAll(new TaskRegistry());

        Assertions.assertEquals(List.of("echo", "fail", "sleep", "sum"), registry.names());
    }

    @Test
    void echoReturnsArguments() throws Exception {
        JsonNode args = json("{\"a\": [1, 2]}");

        Assertions.assertEquals(args, new EchoHandler().execute(args, CONTEXT));
    }

    @Test
    void sumOfIntegersStaysIntegral() throws Exception {
        Assertions.assertEquals(LongNode.valueOf(6), new SumHandler().execute(json("[1, 2, 3]"), CONTEXT));
        Assertions.assertEquals(LongNode.valueOf(0), new SumHandler().execute(json("[]"), CONTEXT));
    }

    @Test
    void sumWithFractionIsDouble() throws Exception {
        Assertions.assertEquals(DoubleNode.valueOf(4.5), new SumHandler().execute(json("[1, 3.5]"), CONTEXT));
    }

    @Test
    void sumOfRangeIsInclusive() throws Exception {
        Assertions.assertEquals(LongNode.valueOf(5050),
                new SumHandler().execute(json("{\"start\": 1, \"end\": 100}"), CONTEXT));
        Assertions.assertEquals(LongNode.valueOf(0),
                new SumHandler().execute(json("{\"start\": 5, \"end\": 4}"), CONTEXT));
    }

    @Test
    void sumRejectsBadInput() throws Exception {
        SumHandler handler = new SumHandler();

        Assertions.assertThrows(IllegalArgumentException.class, () -> handler.execute(json("[1, \"x\"]"), CONTEXT));
        Assertions.assertThrows(IllegalArgumentException.class, () -> handler.execute(json("{\"start\": 1}"), CONTEXT));
        Assertions.assertThrows(IllegalArgumentException.class, () -> handler.execute(TextNode.valueOf("1"), CONTEXT));
        Assertions.assertThrows(ArithmeticException.class,
                () -> handler.execute(json("[9223372036854775807, 1]"), CONTEXT));
    }

    @Test
    void sleepReturnsMillis() throws Exception {
        SleepHandler handler = new SleepHandler();

        Assertions.assertEquals(LongNode.valueOf(10), handler.execute(LongNode.valueOf(10), CONTEXT));
        Assertions.assertEquals(LongNode.valueOf(5), handler.execute(json("{\"millis\": 5}"), CONTEXT));
        Assertions.assertThrows(IllegalArgumentException.class, () -> handler.execute(LongNode.valueOf(-1), CONTEXT));
    }

    @Test
    void failUsesGivenMessage() throws Exception {
        FailHandler handler = new FailHandler();

        IllegalStateException text = Assertions.assertThrows(IllegalStateException.class,
                () -> handler.execute(TextNode.valueOf("boom"), CONTEXT));
        IllegalStateException object = Assertions.assertThrows(IllegalStateException.class,
                () -> handler.execute(json("{\"message\": \"bang\"}"), CONTEXT));
        IllegalStateException fallback = Assertions.assertThrows(IllegalStateException.class,
                () -> handler.execute(json("{}"), CONTEXT));

        Assertions.assertEquals("boom", text.getMessage());
        Assertions.assertEquals("bang", object.getMessage());
        Assertions.assertEquals("Requested failure", fallback.getMessage());
    }
}
