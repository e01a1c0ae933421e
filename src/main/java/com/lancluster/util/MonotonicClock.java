package com.lancluster.util;

import java.util.concurrent.TimeUnit;

/**
 * Millisecond readings from {@link System#nanoTime()}.
 *
 * Only differences between two readings mean anything; wall-clock changes do not
 * move this clock. Use it for deadlines and heartbeat silence, never for display.
 */
public final class MonotonicClock {

    private MonotonicClock() {
    }

    public static long nowMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }
}
