package com.lancluster.security;

import java.io.IOException;

/**
 * Thrown when a ciphertext cannot be opened with the given key:
 * it was sealed under another key, it was altered in transit, or it is too short
 * to even carry an IV and an authentication tag.
 *
 * Extends IOException because on a channel a bad frame is terminal for the connection,
 * exactly like a transport failure.
 */
public class DecryptionException extends IOException {
    private static final long serialVersionUID = 1L;

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
