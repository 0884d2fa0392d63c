package com.yoursp.ledger.exception;

/**
 * Thrown when the face-encoding collaborator fails or returns an unusable
 * result. Distinct from {@link NoFaceDetectedException}.
 */
public class FeatureExtractionException extends RuntimeException {

    public FeatureExtractionException(String message) {
        super(message);
    }

    public FeatureExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
