package com.lancluster.network;

import java.io.IOException;

/**
 * A frame decrypted fine but its content is not a valid protocol message
 * (bad JSON, missing or ill-typed field, oversized frame).
 */
public class MalformedMessageException extends IOException {
    private static final long serialVersionUID = 1L;

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
