package com.yoursp.ledger.modules.vault;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Base64;

/**
 * Builds the 256-bit AES key the vault encrypts with.
 */
public final class VaultKeys {

    static final int KEY_LENGTH_BYTES = 32;
    static final int MIN_SALT_BYTES = 16;
    static final int PBKDF2_ITERATIONS = 210_000;
    private static final String PBKDF2_ALGORITHM = "PBKDF2WithHmacSHA256";

    private VaultKeys() {
        // utility class
    }

    /**
     * Wrap raw key material supplied as Base64.
     *
     * @param encoded Base64 of exactly 32 bytes
     */
    public static SecretKey fromBase64(String encoded) {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Vault key is not valid Base64", e);
        }
        if (raw.length != KEY_LENGTH_BYTES) {
            throw new IllegalArgumentException(
                    "Vault key must decode to " + KEY_LENGTH_BYTES + " bytes, got " + raw.length);
        }
        return new SecretKeySpec(raw, "AES");
    }

    /**
     * Derive a key from a passphrase with PBKDF2-HMAC-SHA256. The same passphrase
     * and salt always produce the same key, so ciphertext survives restarts.
     */
    public static SecretKey fromPassphrase(char[] passphrase, byte[] salt) {
        if (passphrase == null || passphrase.length == 0) {
            throw new IllegalArgumentException("Vault passphrase is empty");
        }
        if (salt == null || salt.length < MIN_SALT_BYTES) {
            throw new IllegalArgumentException("Vault salt must be at least " + MIN_SALT_BYTES + " bytes");
        }
        PBEKeySpec spec = new PBEKeySpec(passphrase, salt, PBKDF2_ITERATIONS, KEY_LENGTH_BYTES * 8);
        try {
            byte[] derived = SecretKeyFactory.getInstance(PBKDF2_ALGORITHM).generateSecret(spec).getEncoded();
            SecretKey key = new SecretKeySpec(derived, "AES");
            Arrays.fill(derived, (byte) 0);
            return key;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Vault key derivation failed", e);
        } finally {
            spec.clearPassword();
        }
    }

    /** Fresh random key. Anything encrypted with it is lost when the process exits. */
    public static SecretKey generate() {
        try {
            KeyGenerator generator = KeyGenerator.getInstance("AES");
            generator.init(KEY_LENGTH_BYTES * 8);
            return generator.generateKey();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES key generation failed", e);
        }
    }
}
