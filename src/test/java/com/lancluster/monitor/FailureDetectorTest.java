package com.lancluster.monitor;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class FailureDetectorTest {

    /** Table that hands out a fixed list of victims once and records the threshold it was asked with. */
    private static final class ScriptedTable implements HeartbeatTable {
        private final List<String> victims;
        private final List<Long> thresholds = new CopyOnWriteArrayList<>();
        private boolean sweptOnce;

        ScriptedTable(String... victims) {
            this.victims = List.of(victims);
        }

        @Override
        public synchronized List<String> evictSilentWorkers(long now, long maxSilenceMs) {
            thresholds.add(maxSilenceMs);
            if (sweptOnce) {
                return Collections.emptyList();
            }
            sweptOnce = true;
            return victims;
        }
    }

    @Test
    void timeoutIsTwiceTheInterval() {
        FailureDetector detector = new FailureDetector(new ScriptedTable(), 150, null);

        Assertions.assertEquals(300, detector.getTimeoutMs());
    }

    @Test
    void callbackFiresOncePerEvictedWorker() {
        ScriptedTable table = new ScriptedTable("a", "b");
        List<String> failed = new CopyOnWriteArrayList<>();
        FailureDetector detector = new FailureDetector(table, 1000, failed::add);
        detector.start();
        detector.checkForDeadWorkers();
        detector.checkForDeadWorkers();
        detector.stop();

        Assertions.assertEquals(List.of("a", "b"), failed);
        Assertions.assertTrue(table.thresholds.stream().allMatch(t -> t == 2000));
    }

    @Test
    void stoppedDetectorDoesNotSweep() {
        ScriptedTable table = new ScriptedTable("a");
        FailureDetector detector = new FailureDetector(table, 1000, null);

        detector.checkForDeadWorkers();

        Assertions.assertTrue(table.thresholds.isEmpty());
    }

    @Test
    void failingCallbackDoesNotStopTheSweep() {
        List<String> seen = new ArrayList<>();
        FailureDetector detector = new FailureDetector(new ScriptedTable("a", "b"), 1000, id -> {
            seen.add(id);
            throw new IllegalStateException("callback broke");
        });
        detector.start();
        detector.checkForDeadWorkers();
        detector.stop();

        Assertions.assertEquals(List.of("a", "b"), seen);
    }

    @Test
    void failingTableIsContained() {
        FailureDetector detector = new FailureDetector((now, max) -> {
            throw new IllegalStateException("table broke");
        }, 100, null);
        detector.start();

        Assertions.assertDoesNotThrow(detector::checkForDeadWorkers);
        Assertions.assertTrue(detector.isRunning());
        detector.stop();
        Assertions.assertFalse(detector.isRunning());
    }

    @Test
    void scheduledSweepRunsAfterStart() throws Exception {
        ScriptedTable table = new ScriptedTable("gone");
        List<String> failed = new CopyOnWriteArrayList<>();
        FailureDetector detector = new FailureDetector(table, 50, failed::add);
        detector.start();
        try {
            long deadline = System.currentTimeMillis() + 2000;
            while (failed.isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        } finally {
            detector.stop();
        }

        Assertions.assertEquals(List.of("gone"), failed);
    }

    @Test
    void nonPositiveIntervalIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new FailureDetector(new ScriptedTable(), 0, null));
    }
}
