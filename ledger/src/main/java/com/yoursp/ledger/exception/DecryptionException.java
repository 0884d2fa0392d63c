package com.yoursp.ledger.exception;

/**
 * Thrown when stored ciphertext cannot be authenticated. Indicates a key
 * mismatch or tampering, never recovered from silently.
 */
public class DecryptionException extends RuntimeException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
