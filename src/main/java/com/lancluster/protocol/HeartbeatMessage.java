package com.lancluster.protocol;

import java.util.Objects;

public final class HeartbeatMessage extends Message {

    private final String workerId;

    public HeartbeatMessage(String workerId) {
        this.workerId = Objects.requireNonNull(workerId, "workerId cannot be null");
    }

    @Override
    public MessageType getType() {
        return MessageType.HEARTBEAT;
    }

    public String getWorkerId() {
        return workerId;
    }
}
