package com.lancluster.protocol;

/**
 * Graceful goodbye. The worker id is present when a worker sends it and absent
 * when the dispatcher shuts down.
 */
public final class DisconnectMessage extends Message {

    private final String workerId;

    public DisconnectMessage(String workerId) {
        this.workerId = workerId;
    }

    @Override
    public MessageType getType() {
        return MessageType.DISCONNECT;
    }

    /**
     * @return the leaving worker's id, or null
     */
    public String getWorkerId() {
        return workerId;
    }
}
