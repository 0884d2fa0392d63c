package com.yoursp.ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler that produces clean, safe error responses.
 * Stack traces and secret values are NEVER exposed in response bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String CORRELATION_ID_KEY = "correlationId";

    /**
     * Handles bean-validation failures (e.g. @Valid on @RequestBody).
     * Returns 400 with a list of field-level errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
            MethodArgumentNotValidException ex) {

        List<Map<String, String>> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(fe -> {
                    Map<String, String> error = new HashMap<>();
                    error.put("field", fe.getField());
                    error.put("message", fe.getDefaultMessage());
                    return error;
                })
                .toList();

        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "Validation Failed",
                "Missing required fields");
        body.put("fieldErrors", fieldErrors);

        log.warn("Validation failed: {} field error(s)", fieldErrors.size());

        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({ ValidationException.class, MissingServletRequestPartException.class })
    public ResponseEntity<Map<String, Object>> handleBadInput(Exception ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage());
    }

    // Parser messages can echo body fragments, so the reply stays fixed
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body");
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request body is missing or malformed");
    }

    @ExceptionHandler({ CredentialNotFoundException.class, BiometricProfileNotFoundException.class })
    public ResponseEntity<Map<String, Object>> handleNotFound(RuntimeException ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidResetTokenException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidToken(InvalidResetTokenException ex) {
        return respond(HttpStatus.BAD_REQUEST, "TOKEN_INVALID", ex.getMessage());
    }

    /**
     * Decryption failures mean key mismatch or tampering. Logged at ERROR, but the
     * response stays generic.
     */
    @ExceptionHandler(DecryptionException.class)
    public ResponseEntity<Map<String, Object>> handleDecryption(DecryptionException ex) {
        log.error("Decryption failed [correlationId={}]: {}", MDC.get(CORRELATION_ID_KEY), ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "DECRYPTION_FAILED",
                "Stored credential could not be decrypted.");
    }

    @ExceptionHandler(NoFaceDetectedException.class)
    public ResponseEntity<Map<String, Object>> handleNoFace(NoFaceDetectedException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "NO_FACE_DETECTED", ex.getMessage());
    }

    @ExceptionHandler(FeatureExtractionException.class)
    public ResponseEntity<Map<String, Object>> handleExtraction(FeatureExtractionException ex) {
        log.error("Face encoding failed [correlationId={}]: {}", MDC.get(CORRELATION_ID_KEY), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "EXTRACTION_FAILED", ex.getMessage());
    }

    /**
     * Storage failures are surfaced as-is; the store is local so a retry rarely
     * helps.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(DataAccessException ex) {
        log.error("Storage failure [correlationId={}]: {}", MDC.get(CORRELATION_ID_KEY), ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_ERROR",
                "Credential store is unavailable.");
    }

    /**
     * Catch-all handler for unhandled exceptions.
     * Returns 500 with correlation ID - never exposes stack traces.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {

        String correlationId = MDC.get(CORRELATION_ID_KEY);
        log.error("Unhandled exception [correlationId={}]: {}", correlationId, ex.getMessage(), ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please reference correlationId for support.");
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(body(status, error, message));
    }

    private Map<String, Object> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        body.put("correlationId", MDC.get(CORRELATION_ID_KEY));
        return body;
    }
}
