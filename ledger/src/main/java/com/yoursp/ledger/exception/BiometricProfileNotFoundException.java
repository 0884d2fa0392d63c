package com.yoursp.ledger.exception;

/**
 * Thrown when a user has no enrolled biometric profile.
 */
public class BiometricProfileNotFoundException extends RuntimeException {

    public BiometricProfileNotFoundException(String message) {
        super(message);
    }
}
