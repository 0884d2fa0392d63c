package com.yoursp.ledger.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.ledger.model.entity.AuditLog;
import com.yoursp.ledger.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Service for recording audit trail entries.
 * Called from every vault, reset and biometric operation that changes or
 * discloses state. Metadata must carry identifiers and outcome kinds only,
 * never passwords, tokens or encodings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    public static final String STORE = "CREDENTIAL_STORED";
    public static final String RETRIEVE = "CREDENTIAL_RETRIEVED";
    public static final String DELETE = "CREDENTIAL_DELETED";
    public static final String PASSWORD_CHANGED = "PASSWORD_CHANGED";
    public static final String LOGIN_SUCCEEDED = "LOGIN_SUCCEEDED";
    public static final String LOGIN_FAILED = "LOGIN_FAILED";
    public static final String RESET_ISSUED = "RESET_TOKEN_ISSUED";
    public static final String RESET_COMPLETED = "RESET_COMPLETED";
    public static final String RESET_REJECTED = "RESET_REJECTED";
    public static final String RESET_REVOKED = "RESET_TOKEN_REVOKED";
    public static final String BIOMETRIC_ENROLLED = "BIOMETRIC_ENROLLED";
    public static final String BIOMETRIC_AUTHENTICATED = "BIOMETRIC_AUTHENTICATED";
    public static final String BIOMETRIC_REMOVED = "BIOMETRIC_REMOVED";

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    /**
     * Record an audit log entry.
     *
     * @param userId   the user the action concerns (nullable for anonymous
     *                 biometric attempts)
     * @param action   one of the action constants on this class
     * @param metadata arbitrary key-value metadata (serialized as JSON)
     */
    public void log(String userId, String action, Map<String, Object> metadata) {
        try {
            AuditLog entry = AuditLog.builder()
                    .userId(userId)
                    .action(action)
                    .metadata(metadata != null ? objectMapper.writeValueAsString(metadata) : null)
                    .build();

            auditLogRepository.save(entry);
            log.debug("Audit logged: action={}, user={}", action, userId);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit metadata for action={}: {}", action, e.getMessage());
            // Still save without metadata rather than losing the audit entry
            AuditLog entry = AuditLog.builder()
                    .userId(userId)
                    .action(action)
                    .build();
            auditLogRepository.save(entry);
        }
    }

    public void log(String userId, String action) {
        log(userId, action, null);
    }
}
