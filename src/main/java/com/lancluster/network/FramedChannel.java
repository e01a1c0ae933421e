package com.lancluster.network;

import com.lancluster.protocol.Message;
import com.lancluster.security.CipherCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Encrypted, length-prefixed message channel over a TCP socket.
 *
 * Wire format of one frame: a 4 byte big-endian length N, then N bytes of
 * ciphertext produced by {@link CipherCodec}. The plaintext is either an encoded
 * {@link Message} or, for bulk transfers, a raw chunk.
 *
 * Thread-safety:
 *   - send*() may be called from any number of threads; each frame is written
 *     under a single write lock so frames never interleave
 *   - receive*() must be called by one reader thread at a time
 *   - close() may be called from anywhere and unblocks a pending read
 *     with {@link ConnectionClosedException}
 */
public class FramedChannel implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(FramedChannel.class);

    /** Upper bound on a single frame, larger length prefixes are treated as corruption */
    public static final int MAX_FRAME_BYTES = 64 * 1024 * 1024;

    private final Socket socket;
    private final DataInputStream in;
    private final DataOutputStream out;
    private final Object writeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Rotated once after the handshake, read by both the reader and writer threads
    private volatile SecretKey key;

    /**
     * Wraps an already connected socket.
     *
     * @param socket connected socket, owned by this channel from now on
     * @param key key used for the first frames (the bootstrap key)
     * @throws IOException if the socket streams cannot be obtained
     */
    public FramedChannel(Socket socket, SecretKey key) throws IOException {
        this.socket = Objects.requireNonNull(socket, "socket cannot be null");
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.socket.setTcpNoDelay(true);
        this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
        this.out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
    }

    /**
     * Opens a TCP connection and wraps it.
     *
     * @param connectTimeoutMs maximum time to establish the TCP connection
     */
    public static FramedChannel connect(String host, int port, SecretKey key, int connectTimeoutMs)
            throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            return new FramedChannel(socket, key);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    // ==================== Sending ====================

    /**
     * Encodes, encrypts and writes one message as a single frame.
     */
    public void send(Message message) throws IOException {
        writeFrame(MessageCodec.encode(message));
    }

    /**
     * Encrypts and writes a raw payload as a single frame (file chunks).
     */
    public void sendRaw(byte[] plaintext) throws IOException {
        writeFrame(plaintext);
    }

    private void writeFrame(byte[] plaintext) throws IOException {
        byte[] ciphertext = CipherCodec.encrypt(key, plaintext);
        synchronized (writeLock) {
            if (closed.get()) {
                throw new ConnectionClosedException("Channel is closed");
            }
            try {
                out.writeInt(ciphertext.length);
                out.write(ciphertext);
                out.flush();
            } catch (IOException e) {
                throw new ConnectionClosedException("Failed to write frame to " + getRemoteAddress(), e);
            }
        }
    }

    // ==================== Receiving ====================

    /**
     * Blocks until a whole frame is available and decodes it as a message.
     *
     * @throws ConnectionClosedException if the peer closed (or the channel was closed) mid-frame
     * @throws com.lancluster.security.DecryptionException if the frame does not open under the current key
     * @throws UnknownMessageTypeException if the type is not part of the protocol (frame consumed)
     * @throws MalformedMessageException if the content is not a valid message
     * @throws SocketTimeoutException if a read timeout is set and expires
     */
    public Message receive() throws IOException {
        return MessageCodec.decode(receiveRaw());
    }

    /**
     * Blocks until a whole frame is available and returns its decrypted payload.
     */
    public byte[] receiveRaw() throws IOException {
        byte[] ciphertext = readFrame();
        return CipherCodec.decrypt(key, ciphertext);
    }

    private byte[] readFrame() throws IOException {
        try {
            int length = in.readInt();
            if (length < 0 || length > MAX_FRAME_BYTES) {
                // Cannot resync after a bogus prefix, the stream is unusable
                close();
                throw new MalformedMessageException("Frame length out of range: " + Integer.toUnsignedString(length));
            }
            byte[] ciphertext = new byte[length];
            in.readFully(ciphertext);
            return ciphertext;
        } catch (SocketTimeoutException e) {
            throw e;
        } catch (EOFException e) {
            throw new ConnectionClosedException("Peer closed the connection", e);
        } catch (MalformedMessageException e) {
            throw e;
        } catch (IOException e) {
            throw new ConnectionClosedException("Connection lost: " + e.getMessage(), e);
        }
    }

    // ==================== Key / settings ====================

    /**
     * Switches the channel to a new key. Frames sent or received after this call use it.
     */
    public void rotateKey(SecretKey newKey) {
        this.key = Objects.requireNonNull(newKey, "newKey cannot be null");
        log.debug("Channel key rotated for {}", getRemoteAddress());
    }

    /**
     * Bounds how long a receive may block (0 = forever).
     */
    public void setReadTimeout(int timeoutMs) throws IOException {
        socket.setSoTimeout(timeoutMs);
    }

    public SocketAddress getRemoteAddress() {
        return socket.getRemoteSocketAddress();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes the socket. Safe to call multiple times and from any thread.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket to {}: {}", getRemoteAddress(), e.getMessage());
        }
    }
}
