package com.lancluster.protocol;

import java.util.Objects;

/**
 * First frame a worker sends after connecting.
 */
public final class AuthMessage extends Message {

    private final String otp;
    private final String workerId;
    private final String hostname;

    public AuthMessage(String otp, String workerId, String hostname) {
        this.otp = Objects.requireNonNull(otp, "otp cannot be null");
        this.workerId = Objects.requireNonNull(workerId, "workerId cannot be null");
        this.hostname = hostname == null ? "unknown" : hostname;
    }

    @Override
    public MessageType getType() {
        return MessageType.AUTH;
    }

    public String getOtp() {
        return otp;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getHostname() {
        return hostname;
    }

    @Override
    public String toString() {
        // OTP deliberately left out
        return String.format("AuthMessage{workerId=%s, hostname=%s}", workerId, hostname);
    }
}
