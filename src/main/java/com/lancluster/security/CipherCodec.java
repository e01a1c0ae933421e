package com.lancluster.security;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Symmetric encryption used on every channel between the dispatcher and its workers.
 *
 * Ciphertext layout: 12 random IV bytes followed by the AES-256-GCM output
 * (payload + 16 byte tag). A fresh IV per call makes two encryptions of the same
 * plaintext differ, and the GCM tag makes any tampering fail on decrypt.
 *
 * Also hosts the one-time-password generator used for worker admission.
 */
public final class CipherCodec {

    public static final int KEY_BYTES = 32;
    public static final int SALT_BYTES = 16;
    public static final int PBKDF2_ITERATIONS = 100_000;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    private static final String OTP_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private static final SecureRandom RANDOM = new SecureRandom();

    private CipherCodec() {
    }

    // ==================== Keys ====================

    /**
     * @return a fresh random 256-bit AES key
     */
    public static SecretKey generateKey() {
        byte[] raw = new byte[KEY_BYTES];
        RANDOM.nextBytes(raw);
        return new SecretKeySpec(raw, "AES");
    }

    /**
     * Wraps raw key bytes (e.g. read from a key file or received in a handshake).
     *
     * @throws IllegalArgumentException if the key is not 32 bytes long
     */
    public static SecretKey keyFromBytes(byte[] raw) {
        if (raw == null || raw.length != KEY_BYTES) {
            throw new IllegalArgumentException("Encryption key must be " + KEY_BYTES + " bytes, got "
                    + (raw == null ? "null" : raw.length));
        }
        return new SecretKeySpec(raw, "AES");
    }

    /**
     * Derives a key from a password with a random 16 byte salt.
     */
    public static DerivedKey deriveKey(char[] password) {
        byte[] salt = new byte[SALT_BYTES];
        RANDOM.nextBytes(salt);
        return deriveKey(password, salt);
    }

    /**
     * Derives a key with PBKDF2-HMAC-SHA256, 100,000 iterations, 32 byte output.
     * The same password and salt always give the same key.
     */
    public static DerivedKey deriveKey(char[] password, byte[] salt) {
        PBEKeySpec spec = new PBEKeySpec(password, salt, PBKDF2_ITERATIONS, KEY_BYTES * 8);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            byte[] raw = factory.generateSecret(spec).getEncoded();
            return new DerivedKey(new SecretKeySpec(raw, "AES"), salt);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2WithHmacSHA256 is not available", e);
        } finally {
            spec.clearPassword();
        }
    }

    // ==================== Encrypt / Decrypt ====================

    /**
     * Encrypts and authenticates a payload.
     *
     * @return IV followed by ciphertext and tag
     */
    public static byte[] encrypt(SecretKey key, byte[] plaintext) {
        byte[] iv = new byte[GCM_IV_BYTES];
        RANDOM.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext);

            byte[] out = new byte[GCM_IV_BYTES + sealed.length];
            System.arraycopy(iv, 0, out, 0, GCM_IV_BYTES);
            System.arraycopy(sealed, 0, out, GCM_IV_BYTES, sealed.length);
            return out;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt payload", e);
        }
    }

    /**
     * Opens a ciphertext produced by {@link #encrypt(SecretKey, byte[])}.
     *
     * @throws DecryptionException if the key is wrong or the data was altered
     */
    public static byte[] decrypt(SecretKey key, byte[] ciphertext) throws DecryptionException {
        if (ciphertext == null || ciphertext.length < GCM_IV_BYTES + GCM_TAG_BITS / 8) {
            throw new DecryptionException("Ciphertext too short");
        }
        byte[] iv = Arrays.copyOfRange(ciphertext, 0, GCM_IV_BYTES);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            return cipher.doFinal(ciphertext, GCM_IV_BYTES, ciphertext.length - GCM_IV_BYTES);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Ciphertext does not authenticate under this key", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Failed to decrypt payload", e);
        }
    }

    // ==================== One-time passwords ====================

    /**
     * Generates a one-time password of uppercase letters and digits,
     * each character drawn uniformly from a cryptographically strong source.
     */
    public static String generateOtp(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("OTP length must be positive");
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(OTP_ALPHABET.charAt(RANDOM.nextInt(OTP_ALPHABET.length())));
        }
        return sb.toString();
    }
}
