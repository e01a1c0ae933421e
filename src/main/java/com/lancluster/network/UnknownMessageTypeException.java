package com.lancluster.network;

/**
 * The frame carried a {@code type} that is not part of the protocol.
 * The whole frame has been consumed, so the stream is still in sync and
 * message loops log this and keep reading.
 */
public class UnknownMessageTypeException extends MalformedMessageException {
    private static final long serialVersionUID = 1L;

    private final String typeName;

    public UnknownMessageTypeException(String typeName) {
        super("Unknown message type: " + typeName);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
