package com.lancluster.network;

import java.io.EOFException;

/**
 * The peer went away (or the channel was closed locally) before a whole frame
 * could be read or written. Terminal for the channel; nothing reconnects.
 */
public class ConnectionClosedException extends EOFException {
    private static final long serialVersionUID = 1L;

    public ConnectionClosedException(String message) {
        super(message);
    }

    public ConnectionClosedException(String message, Throwable cause) {
        super(message);
        initCause(cause);
    }
}
