package com.lancluster.security;

import javax.crypto.SecretKey;

/**
 * A password-derived key together with the salt used to derive it.
 * The salt is needed to derive the same key again on another machine.
 */
public final class DerivedKey {

    private final SecretKey key;
    private final byte[] salt;

    DerivedKey(SecretKey key, byte[] salt) {
        this.key = key;
        this.salt = salt.clone();
    }

    public SecretKey getKey() {
        return key;
    }

    /**
     * @return a copy of the salt
     */
    public byte[] getSalt() {
        return salt.clone();
    }
}
