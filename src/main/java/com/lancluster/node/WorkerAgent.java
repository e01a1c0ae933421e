package com.lancluster.node;

import com.lancluster.handshake.AdmissionHandshake;
import com.lancluster.monitor.HeartbeatSender;
import com.lancluster.network.ConnectionClosedException;
import com.lancluster.network.FramedChannel;
import com.lancluster.network.UnknownMessageTypeException;
import com.lancluster.protocol.DisconnectMessage;
import com.lancluster.protocol.ExecuteTaskMessage;
import com.lancluster.protocol.HeartbeatMessage;
import com.lancluster.protocol.Message;
import com.lancluster.protocol.MessageType;
import com.lancluster.task.TaskHandler;
import com.lancluster.task.TaskRegistry;
import com.lancluster.util.HostNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Worker side of a LAN cluster.
 *
 * Connects to a dispatcher, authenticates with the one-time password, then runs
 * three threads for the life of the connection:
 *   - Reader: receives execute_task and hands it to the {@link TaskExecutor}
 *   - Writer: the only thread writing to the channel, drains the outbound queue
 *     (heartbeats, task results, the final disconnect)
 *   - Heartbeat: enqueues a heartbeat every interval
 *
 * An agent connects once. When the connection ends, for whatever reason, all
 * three threads stop and {@link #awaitDisconnect} returns; reconnecting means
 * creating a new agent.
 */
public class WorkerAgent {
    private static final Logger log = LoggerFactory.getLogger(WorkerAgent.class);

    private static final long POLL_INTERVAL_MS = 200;
    private static final long JOIN_TIMEOUT_MS = 2000;

    private final String dispatcherHost;
    private final int dispatcherPort;
    private final String otp;
    private final SecretKey bootstrapKey;
    private final ClusterConfig config;
    private final String workerId;
    private final String hostname;
    private final TaskRegistry handlers;

    private final BlockingQueue<Message> outbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean tornDown = new AtomicBoolean(false);
    private final CountDownLatch disconnected = new CountDownLatch(1);

    private volatile boolean connected = false;
    private volatile FramedChannel channel;
    private Thread readerThread;
    private Thread writerThread;
    private volatile HeartbeatSender heartbeatSender;
    private TaskExecutor taskExecutor;

    /**
     * Creates a worker with a generated id ({@code <hostname>-<8 hex>}).
     */
    public WorkerAgent(String dispatcherHost, int dispatcherPort, String otp,
                       SecretKey bootstrapKey, ClusterConfig config) {
        this(dispatcherHost, dispatcherPort, otp, bootstrapKey, config, null);
    }

    /**
     * @param dispatcherHost dispatcher address
     * @param dispatcherPort dispatcher port
     * @param otp one-time password printed by the dispatcher
     * @param bootstrapKey pre-shared key protecting the handshake
     * @param config timeouts and heartbeat interval
     * @param workerId unique worker id, or null to generate one
     */
    public WorkerAgent(String dispatcherHost, int dispatcherPort, String otp,
                       SecretKey bootstrapKey, ClusterConfig config, String workerId) {
        this.dispatcherHost = Objects.requireNonNull(dispatcherHost, "dispatcherHost cannot be null");
        this.dispatcherPort = dispatcherPort;
        this.otp = Objects.requireNonNull(otp, "otp cannot be null");
        this.bootstrapKey = Objects.requireNonNull(bootstrapKey, "bootstrapKey cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.workerId = workerId != null ? workerId : HostNames.generateWorkerId();
        this.hostname = HostNames.localHostname();
        this.handlers = new TaskRegistry();
    }

    /**
     * Makes a handler available to the dispatcher. Call before {@link #connect()}.
     *
     * @return this agent, for chaining
     */
    public WorkerAgent registerHandler(String name, TaskHandler handler) {
        handlers.register(name, handler);
        return this;
    }

    /**
     * @return the handler table, for bulk registration before connecting
     */
    public TaskRegistry getHandlers() {
        return handlers;
    }

    // ==================== Lifecycle ====================

    /**
     * Connects, authenticates and starts the worker threads. Returns once the
     * worker is registered with the dispatcher.
     *
     * @throws com.lancluster.handshake.AuthenticationException if the dispatcher rejects this worker
     * @throws IOException if the dispatcher cannot be reached
     * @throws IllegalStateException if called more than once
     */
    public void connect() throws IOException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("WorkerAgent already started");
        }

        int timeoutMs = (int) config.getConnectionTimeoutMs();
        log.info("Connecting to dispatcher at {}:{} as {}", dispatcherHost, dispatcherPort, workerId);
        FramedChannel ch;
        try {
            ch = FramedChannel.connect(dispatcherHost, dispatcherPort, bootstrapKey, timeoutMs);
        } catch (IOException e) {
            disconnected.countDown();
            throw e;
        }
        try {
            AdmissionHandshake.join(ch, otp, workerId, hostname, timeoutMs);
        } catch (IOException e) {
            ch.close();
            disconnected.countDown();
            throw e;
        }

        channel = ch;
        connected = true;

        int poolSize = Runtime.getRuntime().availableProcessors();
        taskExecutor = new TaskExecutor(handlers, workerId, hostname, poolSize, this::enqueue);

        writerThread = new Thread(this::writerLoop, "Worker-" + workerId + "-Writer");
        writerThread.setDaemon(true);
        readerThread = new Thread(this::readerLoop, "Worker-" + workerId + "-Reader");
        readerThread.setDaemon(true);
        writerThread.start();
        readerThread.start();

        heartbeatSender = new HeartbeatSender(new QueueHeartbeatLink(), config.getHeartbeatIntervalMs(),
                cause -> teardown("heartbeat failed: " + cause.getMessage()), workerId);
        heartbeatSender.start();

        log.info("[OK] Connected to dispatcher {}:{} as {} ({} handlers)",
                dispatcherHost, dispatcherPort, workerId, handlers.size());
    }

    /**
     * Sends a best-effort disconnect and closes the connection. Safe to call
     * more than once, and before or after the dispatcher hung up.
     */
    public void stop() {
        if (!started.get()) {
            return;
        }
        if (connected) {
            outbound.offer(new DisconnectMessage(workerId));
            join(writerThread);
        }
        teardown("stopped by user");
        if (heartbeatSender != null) {
            heartbeatSender.stop();
        }
        join(readerThread);
        join(writerThread);
    }

    /**
     * Blocks until the connection has ended.
     *
     * @return true if disconnected, false if the timeout elapsed first
     */
    public boolean awaitDisconnect(long timeout, TimeUnit unit) throws InterruptedException {
        return disconnected.await(timeout, unit);
    }

    /**
     * Blocks until the connection has ended.
     */
    public void awaitDisconnect() throws InterruptedException {
        disconnected.await();
    }

    public boolean isConnected() {
        return connected;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getHostname() {
        return hostname;
    }

    // ==================== Threads ====================

    private void readerLoop() {
        try {
            while (connected) {
                Message message;
                try {
                    message = channel.receive();
                } catch (UnknownMessageTypeException e) {
                    log.warn("Ignoring message of unknown type '{}' from dispatcher", e.getTypeName());
                    continue;
                }

                switch (message.getType()) {
                    case EXECUTE_TASK:
                        taskExecutor.submit((ExecuteTaskMessage) message);
                        break;
                    case HEARTBEAT_RESPONSE:
                        log.debug("Heartbeat acknowledged");
                        break;
                    case DISCONNECT:
                        log.info("Dispatcher closed the session");
                        return;
                    default:
                        log.warn("Unexpected {} from dispatcher", message.getType().getWireName());
                        break;
                }
            }
        } catch (ConnectionClosedException e) {
            if (connected) {
                log.info("Connection to dispatcher closed: {}", e.getMessage());
            }
        } catch (IOException e) {
            if (connected) {
                log.error("Error reading from dispatcher: {}", e.getMessage());
            }
        } finally {
            teardown("reader exited");
        }
    }

    private void writerLoop() {
        try {
            while (true) {
                Message message = outbound.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (message == null) {
                    if (!connected) {
                        break;
                    }
                    continue;
                }
                channel.send(message);
                if (message.getType() == MessageType.DISCONNECT) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (connected) {
                log.error("Failed to send to dispatcher: {}", e.getMessage());
            }
        } finally {
            teardown("writer exited");
        }
    }

    private void enqueue(Message message) {
        if (!connected) {
            log.debug("Not connected, dropping outbound {}", message.getType().getWireName());
            return;
        }
        outbound.offer(message);
    }

    /**
     * Ends the connection exactly once, from whichever thread notices first.
     */
    private void teardown(String reason) {
        if (!tornDown.compareAndSet(false, true)) {
            return;
        }
        connected = false;
        log.info("Disconnected from dispatcher ({})", reason);

        FramedChannel ch = channel;
        if (ch != null) {
            ch.close();
        }
        if (heartbeatSender != null) {
            heartbeatSender.stop();
        }
        if (taskExecutor != null) {
            taskExecutor.shutdownNow();
        }
        outbound.clear();
        disconnected.countDown();
    }

    private static void join(Thread thread) {
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(JOIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private final class QueueHeartbeatLink implements HeartbeatSender.HeartbeatLink {

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public void sendHeartbeat() throws IOException {
            if (!connected) {
                throw new ConnectionClosedException("Not connected");
            }
            outbound.offer(new HeartbeatMessage(workerId));
        }
    }
}
