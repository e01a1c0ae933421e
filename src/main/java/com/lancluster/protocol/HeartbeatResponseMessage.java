package com.lancluster.protocol;

public final class HeartbeatResponseMessage extends Message {

    public static final HeartbeatResponseMessage INSTANCE = new HeartbeatResponseMessage();

    private HeartbeatResponseMessage() {
    }

    @Override
    public MessageType getType() {
        return MessageType.HEARTBEAT_RESPONSE;
    }
}
