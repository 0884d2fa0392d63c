package com.yoursp.ledger.modules.vault;

import com.yoursp.ledger.exception.CredentialNotFoundException;
import com.yoursp.ledger.exception.ValidationException;
import com.yoursp.ledger.model.entity.UserCredential;
import com.yoursp.ledger.modules.vault.dto.RetrievedCredential;
import com.yoursp.ledger.repository.BiometricProfileRepository;
import com.yoursp.ledger.repository.ResetTokenRepository;
import com.yoursp.ledger.repository.UserCredentialRepository;
import com.yoursp.ledger.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Encrypted credential storage.
 * <ul>
 * <li>Username and password are encrypted independently with AES-256-GCM,
 * each bound to its user id and field name</li>
 * <li>One record per user id; {@link #store} replaces ciphertext and hint and
 * drops any active reset token</li>
 * <li>A lost insert race for a new user id is retried once as an update</li>
 * <li>Only user ids are ever logged</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialVaultService {

    static final String USERNAME_FIELD = "username";
    static final String PASSWORD_FIELD = "password";

    private final UserCredentialRepository credentialRepository;
    private final ResetTokenRepository resetTokenRepository;
    private final BiometricProfileRepository biometricProfileRepository;
    private final VaultCipher vaultCipher;
    private final AuditService auditService;
    private final TransactionTemplate transactionTemplate;

    /**
     * Insert or replace a user's credentials.
     *
     * @param hint optional, stored in plaintext; {@code null} is stored as ""
     * @throws ValidationException if userId is blank or too long, or username or
     *                             password is empty
     */
    public void store(String userId, String username, String password, String hint) {
        requireUserId(userId);
        requireValue(username, "username");
        requireValue(password, "password");

        try {
            transactionTemplate.executeWithoutResult(status -> upsert(userId, username, password, hint));
        } catch (DataIntegrityViolationException e) {
            // Another request inserted the same new user id first; the row exists now
            log.info("Concurrent first store for user {}, retrying as update", userId);
            transactionTemplate.executeWithoutResult(status -> upsert(userId, username, password, hint));
        }
    }

    private void upsert(String userId, String username, String password, String hint) {
        UserCredential credential = credentialRepository.findById(userId)
                .orElseGet(() -> UserCredential.builder().userId(userId).build());

        credential.setEncryptedUsername(vaultCipher.encrypt(username, context(userId, USERNAME_FIELD)));
        credential.setEncryptedPassword(vaultCipher.encrypt(password, context(userId, PASSWORD_FIELD)));
        credential.setHint(hint != null ? hint : "");
        credential.setBiometricEnabled(biometricProfileRepository.existsById(userId));
        credentialRepository.saveAndFlush(credential);

        // A new secret invalidates any reset in flight
        resetTokenRepository.deleteById(userId);

        auditService.log(userId, AuditService.STORE);
        log.info("Stored credentials for user: {}", userId);
    }

    /**
     * Look up and decrypt a user's credentials.
     *
     * @throws CredentialNotFoundException if nothing is stored for userId
     * @throws com.yoursp.ledger.exception.DecryptionException if either field
     *         fails authentication
     */
    @Transactional
    public RetrievedCredential retrieve(String userId) {
        UserCredential credential = findCredential(userId);

        String username = vaultCipher.decrypt(credential.getEncryptedUsername(), context(userId, USERNAME_FIELD));
        String password = vaultCipher.decrypt(credential.getEncryptedPassword(), context(userId, PASSWORD_FIELD));

        auditService.log(userId, AuditService.RETRIEVE);
        log.info("Retrieved credentials for user: {}", userId);

        return new RetrievedCredential(username, password,
                credential.getHint() != null ? credential.getHint() : "",
                credential.isBiometricEnabled());
    }

    /**
     * Password login: decrypts the stored password and compares it with the
     * candidate in constant time.
     *
     * @throws CredentialNotFoundException if nothing is stored for userId
     * @throws ValidationException         if the candidate is empty
     */
    @Transactional
    public boolean verifyPassword(String userId, String password) {
        requireValue(password, "password");
        UserCredential credential = findCredential(userId);

        String stored = vaultCipher.decrypt(credential.getEncryptedPassword(), context(userId, PASSWORD_FIELD));
        boolean matches = MessageDigest.isEqual(
                stored.getBytes(StandardCharsets.UTF_8), password.getBytes(StandardCharsets.UTF_8));

        if (matches) {
            auditService.log(userId, AuditService.LOGIN_SUCCEEDED);
            log.info("Password login succeeded for user: {}", userId);
        } else {
            auditService.log(userId, AuditService.LOGIN_FAILED);
            log.warn("Password login failed for user: {}", userId);
        }
        return matches;
    }

    @Transactional(readOnly = true)
    public boolean exists(String userId) {
        return userId != null && !userId.isBlank() && credentialRepository.existsById(userId);
    }

    /**
     * Replace only the password, keeping username and hint. Clears the active
     * reset token.
     */
    @Transactional
    public void changePassword(String userId, String newPassword) {
        requireValue(newPassword, "password");
        UserCredential credential = findCredential(userId);

        credential.setEncryptedPassword(vaultCipher.encrypt(newPassword, context(userId, PASSWORD_FIELD)));
        credentialRepository.save(credential);
        resetTokenRepository.deleteById(userId);

        auditService.log(userId, AuditService.PASSWORD_CHANGED);
        log.info("Password changed for user: {}", userId);
    }

    /**
     * Remove the credential together with the user's reset token and biometric
     * profile.
     */
    @Transactional
    public void delete(String userId) {
        if (!exists(userId)) {
            throw new CredentialNotFoundException("No credentials stored for user: " + userId);
        }
        credentialRepository.deleteById(userId);
        resetTokenRepository.deleteById(userId);
        biometricProfileRepository.deleteById(userId);

        auditService.log(userId, AuditService.DELETE);
        log.info("Deleted credentials for user: {}", userId);
    }

    private UserCredential findCredential(String userId) {
        requireUserId(userId);
        return credentialRepository.findById(userId)
                .orElseThrow(() -> {
                    log.warn("No user found for {}", userId);
                    return new CredentialNotFoundException("No credentials stored for user: " + userId);
                });
    }

    static String context(String userId, String field) {
        return userId + ":" + field;
    }

    static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("user_id is required");
        }
        if (userId.length() > UserCredential.MAX_USER_ID_LENGTH) {
            throw new ValidationException("user_id must be at most " + UserCredential.MAX_USER_ID_LENGTH + " characters");
        }
    }

    // Whitespace is a legitimate secret; only null and "" are missing
    private static void requireValue(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new ValidationException(field + " is required");
        }
    }
}
