package com.lancluster.protocol;

public final class FileTransferEndMessage extends Message {

    public static final FileTransferEndMessage INSTANCE = new FileTransferEndMessage();

    private FileTransferEndMessage() {
    }

    @Override
    public MessageType getType() {
        return MessageType.FILE_TRANSFER_END;
    }
}
