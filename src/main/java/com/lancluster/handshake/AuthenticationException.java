package com.lancluster.handshake;

import java.io.IOException;

/**
 * A handshake did not complete: wrong OTP, malformed first message, or the
 * dispatcher refused to admit the worker. The connection is closed and the
 * worker is never registered.
 */
public class AuthenticationException extends IOException {
    private static final long serialVersionUID = 1L;

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
