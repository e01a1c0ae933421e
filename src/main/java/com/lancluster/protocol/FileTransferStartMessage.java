package com.lancluster.protocol;

import java.util.Objects;

public final class FileTransferStartMessage extends Message {

    private final String filename;
    private final long size;

    public FileTransferStartMessage(String filename, long size) {
        this.filename = Objects.requireNonNull(filename, "filename cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative");
        }
        this.size = size;
    }

    @Override
    public MessageType getType() {
        return MessageType.FILE_TRANSFER_START;
    }

    public String getFilename() {
        return filename;
    }

    public long getSize() {
        return size;
    }

    @Override
    public String toString() {
        return String.format("FileTransferStartMessage{filename=%s, size=%d}", filename, size);
    }
}
