package com.lancluster.handshake;

import com.lancluster.network.FramedChannel;
import com.lancluster.network.MalformedMessageException;
import com.lancluster.protocol.AuthMessage;
import com.lancluster.protocol.AuthResponseMessage;
import com.lancluster.protocol.Message;
import com.lancluster.protocol.MessageType;
import com.lancluster.security.CipherCodec;
import com.lancluster.security.DecryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.net.SocketTimeoutException;

/**
 * One-time-password handshake that admits a worker and hands it the session key.
 *
 * Protocol (both frames encrypted with the shared bootstrap key):
 *   worker     -> dispatcher : auth{otp, worker_id, hostname}
 *   dispatcher -> worker     : auth_response{success, message, encryption_key?}
 *
 * The OTP is compared by exact string equality. On success both ends rotate
 * their channel to the session key before any further frame.
 */
public final class AdmissionHandshake {
    private static final Logger log = LoggerFactory.getLogger(AdmissionHandshake.class);

    private AdmissionHandshake() {
    }

    // ==================== Dispatcher side ====================

    /**
     * Runs the dispatcher side of the handshake on a freshly accepted channel.
     * On any failure the caller must close the channel and must not register the worker.
     *
     * @param channel accepted channel still using the bootstrap key
     * @param policy OTP source and admission checks
     * @param sessionKey key handed to the worker on success
     * @param timeoutMs maximum wait for the auth frame (0 = forever)
     * @return the admitted worker's identity; the channel now uses the session key
     * @throws AuthenticationException if the worker is rejected
     * @throws IOException on transport errors
     */
    public static WorkerIdentity admit(FramedChannel channel, AdmissionPolicy policy,
                                       SecretKey sessionKey, int timeoutMs) throws IOException {
        Message first;
        channel.setReadTimeout(timeoutMs);
        try {
            first = channel.receive();
        } catch (SocketTimeoutException e) {
            throw new AuthenticationException("No auth message within " + timeoutMs + "ms", e);
        } catch (DecryptionException e) {
            // Reply would be unreadable under a different bootstrap key, just drop it
            throw new AuthenticationException("Auth frame does not decrypt with the bootstrap key", e);
        } catch (MalformedMessageException e) {
            reject(channel, "Authentication failed: " + e.getMessage());
            throw new AuthenticationException("Malformed auth message: " + e.getMessage(), e);
        } finally {
            if (!channel.isClosed()) {
                channel.setReadTimeout(0);
            }
        }

        if (first.getType() != MessageType.AUTH) {
            reject(channel, "Expected authentication message, got " + first.getType().getWireName());
            throw new AuthenticationException("Expected auth, got " + first.getType().getWireName());
        }

        AuthMessage auth = (AuthMessage) first;
        WorkerIdentity identity = new WorkerIdentity(auth.getWorkerId(), auth.getHostname());
        log.info("Worker {} attempting authentication from {}", identity, channel.getRemoteAddress());

        if (!auth.getOtp().equals(policy.currentSessionSecret())) {
            log.warn("Invalid OTP from worker {}", identity.getWorkerId());
            reject(channel, "Invalid OTP");
            throw new AuthenticationException("Invalid OTP from worker " + identity.getWorkerId());
        }

        String refusal = policy.checkAdmission(identity);
        if (refusal != null) {
            log.warn("Worker {} refused: {}", identity.getWorkerId(), refusal);
            reject(channel, refusal);
            throw new AuthenticationException("Worker " + identity.getWorkerId() + " refused: " + refusal);
        }

        channel.send(AuthResponseMessage.accepted("Authentication successful", sessionKey.getEncoded()));
        channel.rotateKey(sessionKey);
        return identity;
    }

    private static void reject(FramedChannel channel, String reason) {
        try {
            channel.send(AuthResponseMessage.rejected(reason));
        } catch (IOException e) {
            log.debug("Could not deliver rejection to {}: {}", channel.getRemoteAddress(), e.getMessage());
        }
    }

    // ==================== Worker side ====================

    /**
     * Runs the worker side of the handshake.
     *
     * @param channel connected channel using the bootstrap key
     * @param timeoutMs maximum wait for the auth response (0 = forever)
     * @return the session key; the channel has already been switched to it
     * @throws AuthenticationException if the dispatcher rejects the worker or answers nonsense
     * @throws IOException on transport errors
     */
    public static SecretKey join(FramedChannel channel, String otp, String workerId, String hostname,
                                 int timeoutMs) throws IOException {
        channel.send(new AuthMessage(otp, workerId, hostname));

        Message reply;
        channel.setReadTimeout(timeoutMs);
        try {
            reply = channel.receive();
        } catch (SocketTimeoutException e) {
            throw new AuthenticationException("No auth response within " + timeoutMs + "ms", e);
        } catch (DecryptionException e) {
            throw new AuthenticationException("Auth response does not decrypt, bootstrap keys differ", e);
        } catch (MalformedMessageException e) {
            throw new AuthenticationException("Malformed auth response: " + e.getMessage(), e);
        } finally {
            if (!channel.isClosed()) {
                channel.setReadTimeout(0);
            }
        }

        if (reply.getType() != MessageType.AUTH_RESPONSE) {
            throw new AuthenticationException("Expected auth_response, got " + reply.getType().getWireName());
        }
        AuthResponseMessage response = (AuthResponseMessage) reply;
        if (!response.isSuccess()) {
            throw new AuthenticationException("Authentication failed: " + response.getMessage());
        }
        if (!response.hasEncryptionKey()) {
            throw new AuthenticationException("Dispatcher accepted but sent no session key");
        }

        SecretKey sessionKey;
        try {
            sessionKey = CipherCodec.keyFromBytes(response.getEncryptionKey());
        } catch (IllegalArgumentException e) {
            throw new AuthenticationException("Invalid session key: " + e.getMessage(), e);
        }
        channel.rotateKey(sessionKey);
        log.info("Authenticated as {}, switched to session key", workerId);
        return sessionKey;
    }
}
