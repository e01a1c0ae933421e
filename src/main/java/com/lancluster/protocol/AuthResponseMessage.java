package com.lancluster.protocol;

/**
 * Dispatcher's answer to {@link AuthMessage}.
 * On success it carries the session key the worker must switch its channel to.
 */
public final class AuthResponseMessage extends Message {

    private final boolean success;
    private final String message;
    private final byte[] encryptionKey;

    private AuthResponseMessage(boolean success, String message, byte[] encryptionKey) {
        this.success = success;
        this.message = message == null ? "" : message;
        this.encryptionKey = encryptionKey == null ? null : encryptionKey.clone();
    }

    public static AuthResponseMessage accepted(String message, byte[] encryptionKey) {
        if (encryptionKey == null) {
            throw new IllegalArgumentException("An accepted handshake must carry the session key");
        }
        return new AuthResponseMessage(true, message, encryptionKey);
    }

    public static AuthResponseMessage rejected(String message) {
        return new AuthResponseMessage(false, message, null);
    }

    /**
     * Used by the decoder, which has to accept whatever combination the peer sent.
     */
    public static AuthResponseMessage of(boolean success, String message, byte[] encryptionKey) {
        return new AuthResponseMessage(success, message, encryptionKey);
    }

    @Override
    public MessageType getType() {
        return MessageType.AUTH_RESPONSE;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return a copy of the session key, or null on rejection
     */
    public byte[] getEncryptionKey() {
        return encryptionKey == null ? null : encryptionKey.clone();
    }

    public boolean hasEncryptionKey() {
        return encryptionKey != null;
    }

    @Override
    public String toString() {
        return String.format("AuthResponseMessage{success=%s, message=%s, key=%s}",
                success, message, encryptionKey == null ? "absent" : "present");
    }
}
