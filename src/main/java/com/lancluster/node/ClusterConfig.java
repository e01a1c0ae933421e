package com.lancluster.node;

import java.util.Map;
import java.util.Objects;

/**
 * Centralized configuration shared by the dispatcher and its workers.
 * Holds every numeric knob of the protocol: ports, timeouts, heartbeat period, caps.
 *
 * Uses Builder pattern for clean, validated construction.
 * Immutable after creation - thread-safe.
 *
 * Example usage:
 * ClusterConfig config = new ClusterConfig.Builder()
 *     .port(9999)
 *     .heartbeatIntervalMs(2_000)
 *     .taskTimeoutMs(60_000)
 *     .build();
 *
 * Dispatcher dispatcher = new Dispatcher(config, bootstrapKey);
 */
public final class ClusterConfig {

    public static final String DEFAULT_HOST_ADDRESS = "0.0.0.0";
    public static final int DEFAULT_PORT = 8888;
    public static final int DEFAULT_OTP_LENGTH = 8;
    public static final int DEFAULT_CHUNK_SIZE = 8192;
    public static final long DEFAULT_MAX_FILE_SIZE = 100L * 1024 * 1024;
    public static final long DEFAULT_CONNECTION_TIMEOUT_MS = 30_000;
    public static final long DEFAULT_TASK_TIMEOUT_MS = 300_000;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 10_000;
    public static final int DEFAULT_MAX_WORKERS = 10;

    private static final String ENV_PREFIX = "LANCLUSTER_";

    private final String hostAddress;
    private final int port;
    private final int otpLength;
    private final int chunkSize;
    private final long maxFileSize;
    private final long connectionTimeoutMs;
    private final long taskTimeoutMs;
    private final long heartbeatIntervalMs;
    private final int maxWorkers;

    /**
     * Private constructor - use Builder to create instances.
     */
    private ClusterConfig(Builder builder) {
        this.hostAddress = builder.hostAddress;
        this.port = builder.port;
        this.otpLength = builder.otpLength;
        this.chunkSize = builder.chunkSize;
        this.maxFileSize = builder.maxFileSize;
        this.connectionTimeoutMs = builder.connectionTimeoutMs;
        this.taskTimeoutMs = builder.taskTimeoutMs;
        this.heartbeatIntervalMs = builder.heartbeatIntervalMs;
        this.maxWorkers = builder.maxWorkers;
    }

    /**
     * @return configuration with every default
     */
    public static ClusterConfig defaults() {
        return new Builder().build();
    }

    /**
     * Reads overrides from the process environment.
     */
    public static ClusterConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads overrides from the given variables; missing ones keep their default.
     * Timeouts and the heartbeat interval are given in seconds (decimals allowed).
     *
     * Recognized variables: LANCLUSTER_HOST_ADDRESS, LANCLUSTER_HOST_PORT, LANCLUSTER_OTP_LENGTH,
     * LANCLUSTER_CHUNK_SIZE, LANCLUSTER_MAX_FILE_SIZE, LANCLUSTER_CONNECTION_TIMEOUT,
     * LANCLUSTER_TASK_TIMEOUT, LANCLUSTER_HEARTBEAT_INTERVAL, LANCLUSTER_MAX_WORKERS
     *
     * @throws IllegalArgumentException naming the variable if a value cannot be parsed
     */
    public static ClusterConfig fromEnvironment(Map<String, String> env) {
        Builder builder = new Builder();

        String address = env.get(ENV_PREFIX + "HOST_ADDRESS");
        if (address != null && !address.isBlank()) {
            builder.hostAddress(address.trim());
        }
        Integer port = intVar(env, "HOST_PORT");
        if (port != null) {
            builder.port(port);
        }
        Integer otpLength = intVar(env, "OTP_LENGTH");
        if (otpLength != null) {
            builder.otpLength(otpLength);
        }
        Integer chunkSize = intVar(env, "CHUNK_SIZE");
        if (chunkSize != null) {
            builder.chunkSize(chunkSize);
        }
        Long maxFileSize = longVar(env, "MAX_FILE_SIZE");
        if (maxFileSize != null) {
            builder.maxFileSize(maxFileSize);
        }
        Long connectionTimeout = secondsVar(env, "CONNECTION_TIMEOUT");
        if (connectionTimeout != null) {
            builder.connectionTimeoutMs(connectionTimeout);
        }
        Long taskTimeout = secondsVar(env, "TASK_TIMEOUT");
        if (taskTimeout != null) {
            builder.taskTimeoutMs(taskTimeout);
        }
        Long heartbeat = secondsVar(env, "HEARTBEAT_INTERVAL");
        if (heartbeat != null) {
            builder.heartbeatIntervalMs(heartbeat);
        }
        Integer maxWorkers = intVar(env, "MAX_WORKERS");
        if (maxWorkers != null) {
            builder.maxWorkers(maxWorkers);
        }
        return builder.build();
    }

    private static Integer intVar(Map<String, String> env, String name) {
        String raw = env.get(ENV_PREFIX + name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(ENV_PREFIX + name + " is not an integer: " + raw, e);
        }
    }

    private static Long longVar(Map<String, String> env, String name) {
        String raw = env.get(ENV_PREFIX + name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(ENV_PREFIX + name + " is not an integer: " + raw, e);
        }
    }

    private static Long secondsVar(Map<String, String> env, String name) {
        String raw = env.get(ENV_PREFIX + name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Math.round(Double.parseDouble(raw.trim()) * 1000.0);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(ENV_PREFIX + name + " is not a number of seconds: " + raw, e);
        }
    }

    // ==================== Getters ====================

    /**
     * @return a builder pre-filled with this configuration, for overriding single values
     */
    public Builder toBuilder() {
        return new Builder()
            .hostAddress(hostAddress)
            .port(port)
            .otpLength(otpLength)
            .chunkSize(chunkSize)
            .maxFileSize(maxFileSize)
            .connectionTimeoutMs(connectionTimeoutMs)
            .taskTimeoutMs(taskTimeoutMs)
            .heartbeatIntervalMs(heartbeatIntervalMs)
            .maxWorkers(maxWorkers);
    }

    public String getHostAddress() {
        return hostAddress;
    }

    /**
     * @return listen port of the dispatcher (0 = pick an ephemeral port)
     */
    public int getPort() {
        return port;
    }

    public int getOtpLength() {
        return otpLength;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public long getMaxFileSize() {
        return maxFileSize;
    }

    public long getConnectionTimeoutMs() {
        return connectionTimeoutMs;
    }

    public long getTaskTimeoutMs() {
        return taskTimeoutMs;
    }

    /**
     * Period of worker heartbeats and of the dispatcher's eviction check.
     * A worker is evicted once it has been silent for more than twice this value.
     */
    public long getHeartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    @Override
    public String toString() {
        return "ClusterConfig{" +
                "hostAddress=" + hostAddress +
                ", port=" + port +
                ", otpLength=" + otpLength +
                ", chunkSize=" + chunkSize +
                ", maxFileSize=" + maxFileSize +
                ", connectionTimeoutMs=" + connectionTimeoutMs +
                ", taskTimeoutMs=" + taskTimeoutMs +
                ", heartbeatIntervalMs=" + heartbeatIntervalMs +
                ", maxWorkers=" + maxWorkers +
                '}';
    }

    /**
     * Builder for creating ClusterConfig instances.
     * Provides fluent API with validation and sensible defaults.
     */
    public static class Builder {
        private String hostAddress = DEFAULT_HOST_ADDRESS;
        private int port = DEFAULT_PORT;
        private int otpLength = DEFAULT_OTP_LENGTH;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private long maxFileSize = DEFAULT_MAX_FILE_SIZE;
        private long connectionTimeoutMs = DEFAULT_CONNECTION_TIMEOUT_MS;
        private long taskTimeoutMs = DEFAULT_TASK_TIMEOUT_MS;
        private long heartbeatIntervalMs = DEFAULT_HEARTBEAT_INTERVAL_MS;
        private int maxWorkers = DEFAULT_MAX_WORKERS;

        /**
         * Address the dispatcher binds to.
         * Default: 0.0.0.0
         */
        public Builder hostAddress(String hostAddress) {
            this.hostAddress = Objects.requireNonNull(hostAddress, "hostAddress cannot be null");
            return this;
        }

        /**
         * Dispatcher listen port, 0 for an ephemeral port.
         * Default: 8888
         */
        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        /**
         * Default: 8 characters
         */
        public Builder otpLength(int otpLength) {
            this.otpLength = requirePositive(otpLength, "otpLength");
            return this;
        }

        /**
         * Default: 8192 bytes
         */
        public Builder chunkSize(int chunkSize) {
            this.chunkSize = requirePositive(chunkSize, "chunkSize");
            return this;
        }

        /**
         * Default: 100 MiB
         */
        public Builder maxFileSize(long maxFileSize) {
            this.maxFileSize = requirePositive(maxFileSize, "maxFileSize");
            return this;
        }

        /**
         * Bounds TCP connect and the handshake.
         * Default: 30 seconds
         */
        public Builder connectionTimeoutMs(long connectionTimeoutMs) {
            this.connectionTimeoutMs = requirePositive(connectionTimeoutMs, "connectionTimeoutMs");
            return this;
        }

        /**
         * How long executeTask waits for a result.
         * Default: 300 seconds
         */
        public Builder taskTimeoutMs(long taskTimeoutMs) {
            this.taskTimeoutMs = requirePositive(taskTimeoutMs, "taskTimeoutMs");
            return this;
        }

        /**
         * Default: 10 seconds
         */
        public Builder heartbeatIntervalMs(long heartbeatIntervalMs) {
            this.heartbeatIntervalMs = requirePositive(heartbeatIntervalMs, "heartbeatIntervalMs");
            return this;
        }

        /**
         * Maximum number of simultaneously registered workers.
         * Default: 10
         */
        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = requirePositive(maxWorkers, "maxWorkers");
            return this;
        }

        /**
         * Builds the ClusterConfig instance.
         * All fields have sensible defaults if not explicitly set.
         *
         * @return Immutable ClusterConfig instance
         */
        public ClusterConfig build() {
            // Validation already done in setters
            return new ClusterConfig(this);
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
            return value;
        }

        private static long requirePositive(long value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
            return value;
        }
    }
}
