package com.lancluster.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.lancluster.handshake.AdmissionHandshake;
import com.lancluster.handshake.AdmissionPolicy;
import com.lancluster.handshake.AuthenticationException;
import com.lancluster.handshake.WorkerIdentity;
import com.lancluster.monitor.FailureDetector;
import com.lancluster.network.ConnectionClosedException;
import com.lancluster.network.FramedChannel;
import com.lancluster.network.UnknownMessageTypeException;
import com.lancluster.protocol.DisconnectMessage;
import com.lancluster.protocol.ExecuteTaskMessage;
import com.lancluster.protocol.HeartbeatResponseMessage;
import com.lancluster.protocol.Message;
import com.lancluster.protocol.TaskResultMessage;
import com.lancluster.protocol.WorkUnit;
import com.lancluster.security.CipherCodec;
import com.lancluster.security.KeyFiles;
import com.lancluster.util.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central node of a LAN cluster.
 *
 * Accepts worker connections, admits them with a one-time password, tracks their
 * heartbeats and hands them tasks. Each connection gets its own reader thread;
 * results are matched to waiting callers by task id.
 *
 * Lifecycle: {@link #start()} binds and begins accepting, {@link #stop()} says
 * goodbye to every worker, fails waiting callers and releases all threads.
 */
public class Dispatcher implements TaskDispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final ClusterConfig config;
    private final SecretKey bootstrapKey;
    private final SecretKey sessionKey;
    private final WorkerRegistry registry = new WorkerRegistry();
    private final FailureDetector failureDetector;
    private final AdmissionPolicy admissionPolicy = new OtpAdmissionPolicy();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger connectionCounter = new AtomicInteger();

    // Every accepted connection until its handler exits, registered or not
    private final Set<FramedChannel> openChannels = ConcurrentHashMap.newKeySet();

    private volatile String sessionSecret;
    private ServerSocket serverSocket;
    private Thread acceptorThread;
    private ExecutorService connectionPool;

    /**
     * Creates a dispatcher with a freshly generated session key.
     *
     * @param config cluster settings
     * @param bootstrapKey pre-shared key protecting the handshake
     */
    public Dispatcher(ClusterConfig config, SecretKey bootstrapKey) {
        this(config, bootstrapKey, CipherCodec.generateKey());
    }

    /**
     * @param config cluster settings
     * @param bootstrapKey pre-shared key protecting the handshake
     * @param sessionKey key handed to every admitted worker
     */
    public Dispatcher(ClusterConfig config, SecretKey bootstrapKey, SecretKey sessionKey) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.bootstrapKey = Objects.requireNonNull(bootstrapKey, "bootstrapKey cannot be null");
        this.sessionKey = Objects.requireNonNull(sessionKey, "sessionKey cannot be null");
        this.sessionSecret = CipherCodec.generateOtp(config.getOtpLength());
        this.failureDetector = new FailureDetector(registry, config.getHeartbeatIntervalMs(),
                workerId -> log.warn("Worker {} marked as inactive, connection closed", workerId));
    }

    // ==================== Lifecycle ====================

    /**
     * Binds the listening socket and starts accepting workers. Returns immediately.
     *
     * @throws IOException if the address cannot be bound
     * @throws IllegalStateException if already started
     */
    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Dispatcher already running");
        }

        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(config.getHostAddress(), config.getPort()));
        } catch (IOException e) {
            running.set(false);
            closeQuietly(serverSocket);
            throw e;
        }

        connectionPool = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("Dispatcher-Conn-" + connectionCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        acceptorThread = new Thread(this::acceptLoop, "Dispatcher-Acceptor");
        acceptorThread.setDaemon(true);
        acceptorThread.start();

        failureDetector.start();

        log.info("[OK] Dispatcher started on {}:{}", config.getHostAddress(), getLocalPort());
        log.info("[OK] One-time password: {}", sessionSecret);
        log.info("[OK] Bootstrap key fingerprint: {}", KeyFiles.fingerprint(bootstrapKey));
    }

    /**
     * @return the bound port (useful when configured with port 0), or -1 if not started
     */
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : -1;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops accepting, sends a disconnect to every worker, fails every waiting
     * caller and joins the dispatcher's threads. Safe to call more than once.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping dispatcher...");

        closeQuietly(serverSocket);
        failureDetector.stop();

        for (WorkerRecord worker : registry.drainWorkers()) {
            try {
                worker.getChannel().send(new DisconnectMessage(null));
            } catch (IOException e) {
                log.debug("Could not send disconnect to {}: {}", worker.getWorkerId(), e.getMessage());
            }
            worker.getChannel().close();
        }

        for (PendingResult slot : registry.drainPending()) {
            slot.fail(new ConnectionClosedException("Dispatcher stopped"));
        }

        // Evicted workers and handshakes in progress are not in the registry
        for (FramedChannel channel : openChannels) {
            channel.close();
        }

        if (acceptorThread != null) {
            try {
                acceptorThread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        connectionPool.shutdown();
        try {
            if (!connectionPool.awaitTermination(5, TimeUnit.SECONDS)) {
                connectionPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            connectionPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("Dispatcher stopped");
    }

    // ==================== Session secret ====================

    /**
     * @return the OTP a worker must present to join right now
     */
    public String currentSessionSecret() {
        return sessionSecret;
    }

    /**
     * Replaces the OTP. Workers already admitted stay connected.
     *
     * @return the new OTP
     */
    public String regenerateSessionSecret() {
        sessionSecret = CipherCodec.generateOtp(config.getOtpLength());
        log.info("New one-time password: {}", sessionSecret);
        return sessionSecret;
    }

    // ==================== Task dispatch ====================

    /**
     * Runs work on the first idle worker.
     *
     * @see #executeTask(String, WorkUnit, String)
     */
    public JsonNode executeTask(String taskId, WorkUnit work)
            throws ClusterException, IOException, InterruptedException {
        return executeTask(taskId, work, null);
    }

    /**
     * {@inheritDoc}
     *
     * On timeout the worker's slot is released here if it still holds this task,
     * so the worker can be picked again. The worker is not told to cancel; a
     * result that arrives later is discarded and leaves any newer assignment alone.
     * A result that claims the task at the very moment the wait expires is still
     * returned rather than reported as a timeout.
     * A targeted worker is used even if it is busy, in which case its current
     * task becomes this one.
     *
     * @throws IllegalStateException if the dispatcher is not running or the task id is already pending
     */
    @Override
    public JsonNode executeTask(String taskId, WorkUnit work, String targetWorker)
            throws ClusterException, IOException, InterruptedException {
        Objects.requireNonNull(taskId, "taskId cannot be null");
        Objects.requireNonNull(work, "work cannot be null");
        if (!running.get()) {
            throw new IllegalStateException("Dispatcher is not running");
        }

        long timeoutMs = config.getTaskTimeoutMs();
        PendingResult slot = registry.reserve(taskId, targetWorker, timeoutMs);
        WorkerRecord worker = slot.getWorker();

        try {
            worker.getChannel().send(new ExecuteTaskMessage(taskId, work));
        } catch (IOException e) {
            registry.abandon(slot);
            throw e;
        }
        log.info("Task {} sent to worker {}", taskId, worker.getWorkerId());

        try {
            return slot.await();
        } catch (TimeoutException e) {
            if (!registry.abandon(slot)) {
                // A result (or stop) claimed the slot right at the deadline; it wins
                return joinClaimed(slot);
            }
            // The worker may still be running it, but its slot is free again
            log.warn("Task {} timed out after {}ms on worker {}", taskId, timeoutMs, worker.getWorkerId());
            throw new TaskTimeoutException(taskId, timeoutMs);
        } catch (InterruptedException e) {
            registry.abandon(slot);
            throw e;
        } catch (ExecutionException e) {
            throw unwrap(taskId, e);
        }
    }

    private static JsonNode joinClaimed(PendingResult slot)
            throws ClusterException, IOException, InterruptedException {
        try {
            return slot.join();
        } catch (ExecutionException e) {
            throw unwrap(slot.getTaskId(), e);
        }
    }

    /**
     * @return the cluster failure to throw
     * @throws IOException if the task failed on the transport
     */
    private static ClusterException unwrap(String taskId, ExecutionException e) throws IOException {
        Throwable cause = e.getCause();
        if (cause instanceof ClusterException) {
            return (ClusterException) cause;
        }
        if (cause instanceof IOException) {
            throw (IOException) cause;
        }
        return new ClusterException("Task " + taskId + " failed: " + cause, cause);
    }

    @Override
    public List<WorkerInfo> snapshotWorkers() {
        return registry.snapshot();
    }

    public ClusterConfig getConfig() {
        return config;
    }

    int pendingTaskCount() {
        return registry.pendingCount();
    }

    // ==================== Connection handling ====================

    private void acceptLoop() {
        while (running.get()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketException e) {
                if (running.get()) {
                    log.error("Listening socket failed: {}", e.getMessage(), e);
                }
                break;
            } catch (IOException e) {
                log.warn("Accept failed: {}", e.getMessage());
                continue;
            }

            try {
                connectionPool.execute(() -> handleConnection(socket));
            } catch (RuntimeException e) {
                // Pool already shut down by stop()
                log.debug("Dropping connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
                closeQuietly(socket);
            }
        }
        log.debug("Acceptor loop exited");
    }

    private void handleConnection(Socket socket) {
        FramedChannel channel;
        try {
            channel = new FramedChannel(socket, bootstrapKey);
        } catch (IOException e) {
            log.warn("Could not set up connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
            closeQuietly(socket);
            return;
        }

        openChannels.add(channel);
        try {
            if (!running.get()) {
                // stop() may already have swept openChannels
                return;
            }
            serveConnection(channel);
        } finally {
            openChannels.remove(channel);
            channel.close();
        }
    }

    private void serveConnection(FramedChannel channel) {
        log.info("Worker attempting to connect from {}", channel.getRemoteAddress());
        WorkerIdentity identity;
        try {
            identity = AdmissionHandshake.admit(channel, admissionPolicy, sessionKey,
                    (int) config.getConnectionTimeoutMs());
        } catch (AuthenticationException e) {
            log.warn("Authentication error from {}: {}", channel.getRemoteAddress(), e.getMessage());
            return;
        } catch (IOException e) {
            log.error("Error during handshake with {}: {}", channel.getRemoteAddress(), e.getMessage());
            return;
        }

        WorkerRecord record = new WorkerRecord(identity.getWorkerId(), identity.getHostname(),
                channel, MonotonicClock.nowMillis());
        if (!registry.register(record)) {
            // Lost a race with another connection presenting the same id
            return;
        }
        log.info("Worker connected: {}", record);

        try {
            messageLoop(record);
        } finally {
            if (registry.remove(record)) {
                log.info("Worker disconnected: {}", record.getWorkerId());
            }
        }
    }

    private void messageLoop(WorkerRecord record) {
        FramedChannel channel = record.getChannel();
        while (running.get()) {
            Message message;
            try {
                message = channel.receive();
            } catch (UnknownMessageTypeException e) {
                log.warn("Ignoring message of unknown type '{}' from {}", e.getTypeName(), record.getWorkerId());
                continue;
            } catch (ConnectionClosedException e) {
                log.debug("Connection to {} closed: {}", record.getWorkerId(), e.getMessage());
                return;
            } catch (IOException e) {
                log.error("Error handling messages from {}: {}", record.getWorkerId(), e.getMessage());
                return;
            }

            if (!registry.isRegistered(record)) {
                log.warn("Dropping {} from evicted worker {}, it must re-authenticate",
                        message.getType().getWireName(), record.getWorkerId());
                return;
            }

            try {
                switch (message.getType()) {
                    case HEARTBEAT:
                        if (registry.touchHeartbeat(record, MonotonicClock.nowMillis())) {
                            channel.send(HeartbeatResponseMessage.INSTANCE);
                        }
                        break;
                    case TASK_RESULT:
                        onTaskResult(record, (TaskResultMessage) message);
                        break;
                    case DISCONNECT:
                        log.info("Worker {} said goodbye", record.getWorkerId());
                        return;
                    default:
                        log.warn("Unexpected {} from worker {}", message.getType().getWireName(),
                                record.getWorkerId());
                        break;
                }
            } catch (IOException e) {
                log.error("Cannot reply to worker {}: {}", record.getWorkerId(), e.getMessage());
                return;
            }
        }
    }

    private void onTaskResult(WorkerRecord worker, TaskResultMessage result) {
        String taskId = result.getTaskId();
        boolean resolved;
        if (result.isSuccess()) {
            log.info("Task {} completed successfully on {}", taskId, worker.getWorkerId());
            resolved = registry.completeTask(worker, taskId, result.getResult());
        } else {
            String description = describe(result.getResult());
            log.error("Task {} failed on {}: {}", taskId, worker.getWorkerId(), description);
            resolved = registry.failTask(worker, taskId, new TaskExecutionException(taskId, description));
        }
        if (!resolved) {
            log.debug("No caller waiting for task {}, result discarded", taskId);
        }
    }

    private static String describe(JsonNode result) {
        if (result == null || result.isNull()) {
            return "no details";
        }
        return result.isTextual() ? result.asText() : result.toString();
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Close failed: {}", e.getMessage());
        }
    }

    // ==================== Admission ====================

    private final class OtpAdmissionPolicy implements AdmissionPolicy {

        @Override
        public String currentSessionSecret() {
            return sessionSecret;
        }

        @Override
        public String checkAdmission(WorkerIdentity identity) {
            return registry.checkAdmission(identity.getWorkerId(), config.getMaxWorkers());
        }
    }
}
