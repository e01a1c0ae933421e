package com.lancluster.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lancluster.util.Jsons;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HexFormat;

/**
 * Reads and writes the bootstrap key file shared between a dispatcher and its workers.
 *
 * Format: {@code {"encryption_key": "<64 hex chars>"}}
 */
public final class KeyFiles {

    private static final String FIELD = "encryption_key";

    private KeyFiles() {
    }

    public static void save(SecretKey key, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put(FIELD, HexFormat.of().formatHex(key.getEncoded()));
        Files.writeString(file, Jsons.pretty().writeValueAsString(root), StandardCharsets.UTF_8);
    }

    /**
     * @throws IOException if the file cannot be read or does not hold a valid key
     */
    public static SecretKey load(Path file) throws IOException {
        JsonNode root = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
        String hex = root == null ? "" : root.path(FIELD).asText("");
        if (hex.isBlank()) {
            throw new IOException("Key file " + file + " has no " + FIELD + " field");
        }
        try {
            return CipherCodec.keyFromBytes(HexFormat.of().parseHex(hex.trim()));
        } catch (IllegalArgumentException e) {
            throw new IOException("Key file " + file + " holds an invalid key: " + e.getMessage(), e);
        }
    }

    /**
     * Loads the key if the file exists, otherwise generates a new key and saves it.
     */
    public static SecretKey loadOrCreate(Path file) throws IOException {
        if (Files.exists(file)) {
            return load(file);
        }
        SecretKey key = CipherCodec.generateKey();
        save(key, file);
        return key;
    }

    /**
     * @return the first 16 hex characters of the key, safe to print
     */
    public static String fingerprint(SecretKey key) {
        return HexFormat.of().formatHex(key.getEncoded()).substring(0, 16);
    }
}
