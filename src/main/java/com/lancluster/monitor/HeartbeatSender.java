package com.lancluster.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Worker-side periodic heartbeat.
 *
 * Sends the first heartbeat immediately, then one per interval, for as long as
 * the link reports itself connected. A failed send stops the sender and fires
 * the failure callback once.
 */
public class HeartbeatSender {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatSender.class);

    private final ScheduledExecutorService scheduler;
    private final HeartbeatLink link;
    private final long intervalMs;
    private final FailureCallback callback;
    private final String senderName;

    private volatile Thread heartbeatThread;
    private ScheduledFuture<?> heartbeatTask;
    private volatile boolean stopped = false;
    private long heartbeatCount = 0;

    /**
     * The connection heartbeats are sent over.
     */
    public interface HeartbeatLink {
        /**
         * @return false once the connection is gone; the sender then stops quietly
         */
        boolean isConnected();

        void sendHeartbeat() throws IOException;
    }

    /**
     * Callback interface invoked when a heartbeat cannot be sent.
     */
    public interface FailureCallback {
        void onHeartbeatFailed(IOException cause);
    }

    /**
     * @param link connection to send over
     * @param intervalMs delay between heartbeats
     * @param callback notified on send failure, may be null
     * @param senderName used for the thread name, e.g. the worker id
     */
    public HeartbeatSender(HeartbeatLink link, long intervalMs, FailureCallback callback, String senderName) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive");
        }
        this.link = link;
        this.intervalMs = intervalMs;
        this.callback = callback;
        this.senderName = senderName;
        this.scheduler = Executors.newScheduledThreadPool(1, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("Worker-" + senderName + "-Heartbeat");
            thread.setDaemon(true);
            heartbeatThread = thread;
            return thread;
        });
    }

    public synchronized void start() {
        if (heartbeatTask != null && !heartbeatTask.isDone()) {
            log.warn("[{}] Heartbeat sender already running", senderName);
            return;
        }
        heartbeatTask = scheduler.scheduleAtFixedRate(
            this::sendHeartbeat,
            0,
            intervalMs,
            TimeUnit.MILLISECONDS
        );
        log.info("[{}] Heartbeat sender started (interval: {}ms)", senderName, intervalMs);
    }

    /**
     * Stops sending and waits for an in-flight send. Safe to call more than once,
     * from any thread; on the heartbeat thread itself it does not wait.
     */
    public void stop() {
        halt();
        if (Thread.currentThread() == heartbeatThread) {
            return;
        }
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("[{}] Heartbeat sender stopped", senderName);
    }

    private synchronized void halt() {
        stopped = true;
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
        }
        scheduler.shutdown();
    }

    private void sendHeartbeat() {
        if (stopped) {
            return;
        }
        if (!link.isConnected()) {
            log.debug("[{}] Link closed, heartbeat sender exiting", senderName);
            halt();
            return;
        }
        try {
            link.sendHeartbeat();
            heartbeatCount++;
            log.debug("[{}] Heartbeat #{} sent", senderName, heartbeatCount);
        } catch (IOException e) {
            log.warn("[{}] Heartbeat failed: {}", senderName, e.getMessage());
            halt();
            if (callback != null) {
                try {
                    callback.onHeartbeatFailed(e);
                } catch (Exception callbackError) {
                    log.error("[{}] Heartbeat failure callback failed: {}",
                            senderName, callbackError.getMessage(), callbackError);
                }
            }
        }
    }

    public boolean isRunning() {
        return !stopped;
    }
}
