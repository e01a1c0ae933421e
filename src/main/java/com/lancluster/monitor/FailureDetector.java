package com.lancluster.monitor;

import com.lancluster.util.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Dispatcher-side component that evicts workers whose heartbeats stopped.
 *
 * Ticks once per heartbeat interval. A worker silent for more than twice the
 * interval is removed on the next tick, never earlier.
 */
public class FailureDetector {
    private static final Logger log = LoggerFactory.getLogger(FailureDetector.class);

    /** Heartbeat intervals of silence tolerated before eviction. */
    public static final int MISSED_INTERVALS = 2;

    private final HeartbeatTable table;
    private final long intervalMs;
    private final long timeoutMs;
    private final WorkerFailureCallback failureCallback;
    private final ScheduledExecutorService monitor;

    private volatile boolean running = false;

    /**
     * Callback interface invoked when a worker is declared dead.
     */
    public interface WorkerFailureCallback {
        /**
         * Called after the worker has already been removed from the table.
         *
         * @param workerId ID of the dead worker
         */
        void onWorkerFailed(String workerId);
    }

    /**
     * @param table heartbeat source swept on every tick
     * @param intervalMs heartbeat interval; also the tick period
     * @param failureCallback notified once per evicted worker, may be null
     */
    public FailureDetector(HeartbeatTable table, long intervalMs, WorkerFailureCallback failureCallback) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive");
        }
        this.table = table;
        this.intervalMs = intervalMs;
        this.timeoutMs = intervalMs * MISSED_INTERVALS;
        this.failureCallback = failureCallback;

        this.monitor = Executors.newScheduledThreadPool(1, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("FailureDetector-Monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts the periodic sweep. The first tick happens one interval from now.
     */
    public void start() {
        if (running) {
            log.warn("FailureDetector already running");
            return;
        }

        running = true;

        monitor.scheduleAtFixedRate(
            this::checkForDeadWorkers,
            intervalMs,
            intervalMs,
            TimeUnit.MILLISECONDS
        );

        log.info("FailureDetector started (timeout: {}ms, check interval: {}ms)", timeoutMs, intervalMs);
    }

    /**
     * Stops the sweep and shuts down the executor.
     */
    public void stop() {
        running = false;

        monitor.shutdown();
        try {
            if (!monitor.awaitTermination(2, TimeUnit.SECONDS)) {
                monitor.shutdownNow();
            }
        } catch (InterruptedException e) {
            monitor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("FailureDetector stopped");
    }

    void checkForDeadWorkers() {
        if (!running) {
            return;
        }

        List<String> dead;
        try {
            dead = table.evictSilentWorkers(MonotonicClock.nowMillis(), timeoutMs);
        } catch (RuntimeException e) {
            // An exception here would cancel the scheduled task for good
            log.error("Heartbeat sweep failed: {}", e.getMessage(), e);
            return;
        }

        for (String workerId : dead) {
            log.warn("Worker {} declared DEAD (no heartbeat for more than {}ms)", workerId, timeoutMs);
            if (failureCallback != null) {
                try {
                    failureCallback.onWorkerFailed(workerId);
                } catch (Exception e) {
                    log.error("Worker failure callback failed for {}: {}", workerId, e.getMessage(), e);
                }
            }
        }
    }

    public boolean isRunning() {
        return running;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
