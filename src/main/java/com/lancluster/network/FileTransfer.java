package com.lancluster.network;

import com.lancluster.protocol.FileTransferEndMessage;
import com.lancluster.protocol.FileTransferStartMessage;
import com.lancluster.protocol.Message;
import com.lancluster.protocol.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Bulk file copy over a {@link FramedChannel}.
 *
 * Sequence on the wire:
 *   1. {@code file_transfer_start{filename, size}} message
 *   2. raw encrypted chunk frames (not messages) of at most chunkSize bytes each
 *   3. {@code file_transfer_end} message
 *
 * The caller must own the channel's read side while receiving, no other loop
 * may be reading the same channel.
 */
public class FileTransfer {
    private static final Logger log = LoggerFactory.getLogger(FileTransfer.class);

    public static final int DEFAULT_CHUNK_SIZE = 8192;

    /**
     * Receives progress updates during a transfer.
     */
    public interface ProgressListener {
        /**
         * @param transferred bytes of plaintext sent or received so far
         * @param total size announced in the start message
         */
        void onProgress(long transferred, long total);
    }

    private final FramedChannel channel;
    private final int chunkSize;
    private final long maxFileSize;

    /**
     * @param channel connected channel
     * @param chunkSize bytes of plaintext per chunk frame
     * @param maxFileSize largest file accepted on receive
     */
    public FileTransfer(FramedChannel channel, int chunkSize, long maxFileSize) {
        this.channel = Objects.requireNonNull(channel, "channel cannot be null");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (maxFileSize <= 0) {
            throw new IllegalArgumentException("maxFileSize must be positive");
        }
        this.chunkSize = chunkSize;
        this.maxFileSize = maxFileSize;
    }

    /**
     * Sends a file. The remote side sees only its base name.
     *
     * @param listener optional progress callback (null = none)
     * @throws NoSuchFileException if the file does not exist
     */
    public void sendFile(Path file, ProgressListener listener) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        long size = Files.size(file);
        channel.send(new FileTransferStartMessage(file.getFileName().toString(), size));

        long sent = 0;
        byte[] buffer = new byte[chunkSize];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.readNBytes(buffer, 0, chunkSize)) > 0) {
                byte[] chunk = read == chunkSize ? buffer.clone() : Arrays.copyOf(buffer, read);
                channel.sendRaw(chunk);
                sent += read;
                if (listener != null) {
                    listener.onProgress(sent, size);
                }
            }
        }

        channel.send(FileTransferEndMessage.INSTANCE);
        log.info("Sent file {} ({})", file.getFileName(), formatSize(size));
    }

    /**
     * Receives one file and writes it to the given path, creating parent directories.
     *
     * @param listener optional progress callback (null = none)
     * @return the announced file name
     * @throws MalformedMessageException if the sequence is not start/chunks/end
     *         or the file is larger than the configured maximum
     */
    public String receiveFile(Path target, ProgressListener listener) throws IOException {
        Message first = channel.receive();
        if (first.getType() != MessageType.FILE_TRANSFER_START) {
            throw new MalformedMessageException("Expected file_transfer_start, got " + first.getType().getWireName());
        }
        FileTransferStartMessage start = (FileTransferStartMessage) first;
        long size = start.getSize();
        if (size > maxFileSize) {
            throw new MalformedMessageException("File " + start.getFilename() + " is " + formatSize(size)
                    + ", limit is " + formatSize(maxFileSize));
        }

        if (target.toAbsolutePath().getParent() != null) {
            Files.createDirectories(target.toAbsolutePath().getParent());
        }

        long received = 0;
        try (OutputStream out = Files.newOutputStream(target)) {
            while (received < size) {
                byte[] chunk = channel.receiveRaw();
                if (received + chunk.length > size) {
                    throw new MalformedMessageException("Peer sent more bytes than announced for " + start.getFilename());
                }
                out.write(chunk);
                received += chunk.length;
                if (listener != null) {
                    listener.onProgress(received, size);
                }
            }
        }

        Message last = channel.receive();
        if (last.getType() != MessageType.FILE_TRANSFER_END) {
            throw new MalformedMessageException("Expected file_transfer_end, got " + last.getType().getWireName());
        }
        log.info("Received file {} ({}) into {}", start.getFilename(), formatSize(size), target);
        return start.getFilename();
    }

    /**
     * Renders a byte count in human readable form, e.g. {@code 0B}, {@code 512.0B}, {@code 1.5KB}.
     */
    public static String formatSize(long sizeBytes) {
        if (sizeBytes == 0) {
            return "0B";
        }
        String[] units = {"B", "KB", "MB", "GB", "TB"};
        double size = sizeBytes;
        int i = 0;
        while (size >= 1024 && i < units.length - 1) {
            size /= 1024.0;
            i++;
        }
        return String.format(Locale.ROOT, "%.1f%s", size, units[i]);
    }
}
