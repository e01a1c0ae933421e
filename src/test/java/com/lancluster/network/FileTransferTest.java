package com.lancluster.network;

import com.lancluster.protocol.FileTransferStartMessage;
import com.lancluster.security.CipherCodec;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

final class FileTransferTest {

    @TempDir
    Path dir;

    @Test
    void fileArrivesIntactAcrossSeveralChunks() throws Exception {
        byte[] content = new byte[10_000];
        new Random(42).nextBytes(content);
        Path source = dir.resolve("data.bin");
        Files.write(source, content);
        Path target = dir.resolve("out").resolve("copy.bin");

        FramedChannel[] pair = LoopbackSockets.channels(CipherCodec.generateKey());
        try {
            FileTransfer sender = new FileTransfer(pair[0], 4096, 1 << 20);
            FileTransfer receiver = new FileTransfer(pair[1], 4096, 1 << 20);
            List<Long> progress = new ArrayList<>();

            CompletableFuture<String> received = CompletableFuture.supplyAsync(() -> {
                try {
                    return receiver.receiveFile(target, (done, total) -> progress.add(done));
                } catch (Exception e) {
                    throw new RuntimeException(e);
                }
            });
            sender.sendFile(source, null);

            Assertions.assertEquals("data.bin", received.get(5, TimeUnit.SECONDS));
            Assertions.assertArrayEquals(content, Files.readAllBytes(target));
            Assertions.assertEquals(List.of(4096L, 8192L, 10_000L), progress);
        } finally {
            pair[0].close();
            pair[1].close();
        }
    }

    @Test
    void emptyFileIsTransferred() throws Exception {
        Path source = dir.resolve("empty.txt");
        Files.createFile(source);
        Path target = dir.resolve("empty-copy.txt");

        FramedChannel[] pair = LoopbackSockets.channels(CipherCodec.generateKey());
        try {
            new FileTransfer(pair[0], 8, 100).sendFile(source, null);
            Assertions.assertEquals("empty.txt", new FileTransfer(pair[1], 8, 100).receiveFile(target, null));
            Assertions.assertEquals(0, Files.size(target));
        } finally {
            pair[0].close();
            pair[1].close();
        }
    }

    @Test
    void oversizedFileIsRefused() throws Exception {
        FramedChannel[] pair = LoopbackSockets.channels(CipherCodec.generateKey());
        try {
            pair[0].send(new FileTransferStartMessage("huge.iso", 5_000));

            FileTransfer receiver = new FileTransfer(pair[1], 1024, 1_000);
            Assertions.assertThrows(MalformedMessageException.class,
                    () -> receiver.receiveFile(dir.resolve("huge.iso"), null));
        } finally {
            pair[0].close();
            pair[1].close();
        }
    }

    @Test
    void missingSourceFileFailsBeforeSending() throws Exception {
        FramedChannel[] pair = LoopbackSockets.channels(CipherCodec.generateKey());
        try {
            FileTransfer sender = new FileTransfer(pair[0], 1024, 1_000);
            Assertions.assertThrows(NoSuchFileException.class,
                    () -> sender.sendFile(dir.resolve("nope.txt"), null));
        } finally {
            pair[0].close();
            pair[1].close();
        }
    }

    @Test
    void formatSizeMatchesHumanReadableUnits() {
        Assertions.assertEquals("0B", FileTransfer.formatSize(0));
        Assertions.assertEquals("512.0B", FileTransfer.formatSize(512));
        Assertions.assertEquals("1.5KB", FileTransfer.formatSize(1536));
        Assertions.assertEquals("100.0MB", FileTransfer.formatSize(100L * 1024 * 1024));
    }
}
