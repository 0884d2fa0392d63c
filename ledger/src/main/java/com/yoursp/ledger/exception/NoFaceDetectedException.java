package com.yoursp.ledger.exception;

/**
 * Thrown when an image yields no face encoding.
 */
public class NoFaceDetectedException extends RuntimeException {

    public NoFaceDetectedException(String message) {
        super(message);
    }
}
