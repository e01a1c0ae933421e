package com.lancluster.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class KeyFilesTest {

    @TempDir
    Path dir;

    @Test
    void savedKeyLoadsBack() throws Exception {
        SecretKey key = CipherCodec.generateKey();
        Path file = dir.resolve("nested").resolve("cluster.key");

        KeyFiles.save(key, file);

        Assertions.assertTrue(Files.readString(file).contains("\"encryption_key\""));
        Assertions.assertArrayEquals(key.getEncoded(), KeyFiles.load(file).getEncoded());
    }

    @Test
    void loadOrCreateGeneratesOnceThenReuses() throws Exception {
        Path file = dir.resolve("cluster.key");

        SecretKey created = KeyFiles.loadOrCreate(file);
        SecretKey reloaded = KeyFiles.loadOrCreate(file);

        Assertions.assertTrue(Files.exists(file));
        Assertions.assertArrayEquals(created.getEncoded(), reloaded.getEncoded());
    }

    @Test
    void missingFieldIsRejected() throws Exception {
        Path file = dir.resolve("bad.key");
        Files.writeString(file, "{\"other\": \"x\"}");

        IOException e = Assertions.assertThrows(IOException.class, () -> KeyFiles.load(file));
        Assertions.assertTrue(e.getMessage().contains("encryption_key"));
    }

    @Test
    void shortKeyIsRejected() throws Exception {
        Path file = dir.resolve("short.key");
        Files.writeString(file, "{\"encryption_key\": \"00112233\"}");

        Assertions.assertThrows(IOException.class, () -> KeyFiles.load(file));
    }

    @Test
    void fingerprintIsSixteenHexChars() {
        SecretKey key = CipherCodec.keyFromBytes(new byte[32]);
        Assertions.assertEquals("0000000000000000", KeyFiles.fingerprint(key));
    }
}
