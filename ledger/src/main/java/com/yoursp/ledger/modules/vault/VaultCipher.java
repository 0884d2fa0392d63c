package com.yoursp.ledger.modules.vault;

import com.yoursp.ledger.exception.DecryptionException;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM cipher bound to a single injected key.
 * <ul>
 * <li>12-byte random IV prepended to ciphertext</li>
 * <li>128-bit GCM authentication tag</li>
 * <li>The caller's context string is fed in as associated data, so a value
 * encrypted for one user/field cannot be decrypted as another</li>
 * <li>Output: Base64(IV || ciphertext || tag)</li>
 * </ul>
 * Instances are immutable and safe for concurrent use.
 */
public final class VaultCipher {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int KEY_LENGTH_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SecretKey key;

    public VaultCipher(SecretKey key) {
        if (key == null || !"AES".equalsIgnoreCase(key.getAlgorithm())) {
            throw new IllegalArgumentException("Vault key must be an AES key");
        }
        byte[] encoded = key.getEncoded();
        if (encoded == null || encoded.length != KEY_LENGTH_BYTES) {
            throw new IllegalArgumentException("Vault key must be 256 bits");
        }
        this.key = key;
    }

    /**
     * Encrypt a UTF-8 string.
     *
     * @param plaintext the string to encrypt
     * @param context   associated data, e.g. {@code "u1:password"}
     * @return Base64-encoded string containing IV + ciphertext + GCM tag
     */
    public String encrypt(String plaintext, String context) {
        return encryptBytes(plaintext.getBytes(StandardCharsets.UTF_8), context);
    }

    /**
     * Decrypt a value produced by {@link #encrypt(String, String)} with the same
     * context.
     *
     * @throws DecryptionException if the value is malformed, was produced under a
     *                             different key or context, or was tampered with
     */
    public String decrypt(String ciphertext, String context) {
        return new String(decryptBytes(ciphertext, context), StandardCharsets.UTF_8);
    }

    public String encryptBytes(byte[] plaintext, String context) {
        try {
            byte[] iv = new byte[IV_LENGTH];
            SECURE_RANDOM.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            cipher.updateAAD(context.getBytes(StandardCharsets.UTF_8));

            byte[] ciphertext = cipher.doFinal(plaintext);

            byte[] combined = new byte[IV_LENGTH + ciphertext.length];
            System.arraycopy(iv, 0, combined, 0, IV_LENGTH);
            System.arraycopy(ciphertext, 0, combined, IV_LENGTH, ciphertext.length);

            return Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-256-GCM encryption failed", e);
        }
    }

    public byte[] decryptBytes(String ciphertext, String context) {
        if (ciphertext == null || ciphertext.isEmpty()) {
            throw new DecryptionException("Ciphertext is empty");
        }

        byte[] combined;
        try {
            combined = Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Ciphertext is not valid Base64", e);
        }
        if (combined.length <= IV_LENGTH) {
            throw new DecryptionException("Ciphertext is truncated");
        }

        try {
            byte[] iv = Arrays.copyOfRange(combined, 0, IV_LENGTH);
            byte[] encrypted = Arrays.copyOfRange(combined, IV_LENGTH, combined.length);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            cipher.updateAAD(context.getBytes(StandardCharsets.UTF_8));

            return cipher.doFinal(encrypted);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("AES-256-GCM decryption failed", e);
        }
    }
}
