package com.lancluster.task.builtin;

import com.lancluster.task.TaskRegistry;

/**
 * Registers the demo handlers (echo, sum, sleep, fail) every worker started
 * from the command line offers.
 */
public final class BuiltinHandlers {

    private BuiltinHandlers() {
    }

    public static TaskRegistry registerAll(TaskRegistry registry) {
        return registry
            .register(EchoHandler.NAME, new EchoHandler())
            .register(SumHandler.NAME, new SumHandler())
            .register(SleepHandler.NAME, new SleepHandler())
            .register(FailHandler.NAME, new FailHandler());
    }
}
