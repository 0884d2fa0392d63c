package com.yoursp.ledger.exception;

/**
 * Thrown when no credential record exists for a user id.
 */
public class CredentialNotFoundException extends RuntimeException {

    public CredentialNotFoundException(String message) {
        super(message);
    }
}
