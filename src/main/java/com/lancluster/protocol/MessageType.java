package com.lancluster.protocol;

import java.util.HashMap;
import java.util.Map;

/**
 * Discriminator of every message exchanged on a channel.
 * The wire name is the value of the {@code type} field.
 */
public enum MessageType {
    /** Worker presents its OTP and identity */
    AUTH("auth"),

    /** Dispatcher accepts (with the session key) or rejects a worker */
    AUTH_RESPONSE("auth_response"),

    /** Worker liveness signal */
    HEARTBEAT("heartbeat"),

    /** Dispatcher acknowledgement of a heartbeat */
    HEARTBEAT_RESPONSE("heartbeat_response"),

    /** Dispatcher asks a worker to run a named handler */
    EXECUTE_TASK("execute_task"),

    /** Worker reports the outcome of a task */
    TASK_RESULT("task_result"),

    /** Either side announces it is leaving */
    DISCONNECT("disconnect"),

    /** Header of a bulk file transfer, followed by raw chunk frames */
    FILE_TRANSFER_START("file_transfer_start"),

    /** Trailer of a bulk file transfer */
    FILE_TRANSFER_END("file_transfer_end");

    private static final Map<String, MessageType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (MessageType type : values()) {
            BY_WIRE_NAME.put(type.wireName, type);
        }
    }

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * @return the matching type, or null if the name is not part of the protocol
     */
    public static MessageType fromWireName(String wireName) {
        return wireName == null ? null : BY_WIRE_NAME.get(wireName);
    }
}
