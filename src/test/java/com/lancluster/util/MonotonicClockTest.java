package com.lancluster.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class MonotonicClockTest {

    @Test
    void readingsNeverGoBackwards() {
        long previous = MonotonicClock.nowMillis();
        for (int i = 0; i < 10_000; i++) {
            long now = MonotonicClock.nowMillis();
            Assertions.assertTrue(now >= previous);
            previous = now;
        }
    }

    @Test
    void sleepAdvancesTheClock() throws Exception {
        long before = MonotonicClock.nowMillis();
        Thread.sleep(50);

        Assertions.assertTrue(MonotonicClock.nowMillis() - before >= 49);
    }
}
