package com.yoursp.ledger.exception;

/**
 * Thrown when a password reset is attempted with an expired, mismatched or
 * unknown reset token.
 */
public class InvalidResetTokenException extends RuntimeException {

    public InvalidResetTokenException(String message) {
        super(message);
    }
}
