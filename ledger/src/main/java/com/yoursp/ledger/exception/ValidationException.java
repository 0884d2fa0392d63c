package com.yoursp.ledger.exception;

/**
 * Thrown when a required input is missing or blank. Always the caller's fault.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
