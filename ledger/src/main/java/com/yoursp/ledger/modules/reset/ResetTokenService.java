package com.yoursp.ledger.modules.reset;

import com.yoursp.ledger.config.LedgerProperties;
import com.yoursp.ledger.exception.CredentialNotFoundException;
import com.yoursp.ledger.model.entity.ResetToken;
import com.yoursp.ledger.modules.reset.dto.IssuedResetToken;
import com.yoursp.ledger.repository.ResetTokenRepository;
import com.yoursp.ledger.repository.UserCredentialRepository;
import com.yoursp.ledger.service.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;

/**
 * Issues and verifies password-reset tokens.
 * <ul>
 * <li>One active token per user; issuing replaces the previous one</li>
 * <li>Tokens live for {@code ledger.reset.token-ttl} (24h by default)</li>
 * <li>Only the SHA-256 digest is persisted and digests are compared in
 * constant time</li>
 * <li>{@link #verify} does not consume the token; {@link #consume} does, and
 * only one caller can consume a given token</li>
 * </ul>
 */
@Slf4j
@Service
public class ResetTokenService {

    private static final int DIGEST_LENGTH = 32;
    private static final Base64.Encoder TOKEN_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder TOKEN_DECODER = Base64.getUrlDecoder();

    private final ResetTokenRepository resetTokenRepository;
    private final UserCredentialRepository credentialRepository;
    private final AuditService auditService;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();
    private final Duration tokenTtl;
    private final int tokenBytes;

    public ResetTokenService(ResetTokenRepository resetTokenRepository,
            UserCredentialRepository credentialRepository,
            AuditService auditService,
            Clock clock,
            LedgerProperties properties) {
        this.resetTokenRepository = resetTokenRepository;
        this.credentialRepository = credentialRepository;
        this.auditService = auditService;
        this.clock = clock;
        this.tokenTtl = properties.getReset().getTokenTtl();
        // Never below 256 bits of entropy
        this.tokenBytes = Math.max(32, properties.getReset().getTokenBytes());
    }

    /**
     * Generate a reset token for an existing user.
     *
     * @return the raw token and its absolute expiry
     * @throws CredentialNotFoundException if the user has no stored credentials
     */
    @Transactional
    public IssuedResetToken issue(String userId) {
        if (userId == null || userId.isBlank() || !credentialRepository.existsById(userId)) {
            log.warn("No user found for {}", userId);
            throw new CredentialNotFoundException("No credentials stored for user: " + userId);
        }

        byte[] raw = new byte[tokenBytes];
        secureRandom.nextBytes(raw);
        String token = TOKEN_ENCODER.encodeToString(raw);
        Instant expiresAt = clock.instant().plus(tokenTtl);

        resetTokenRepository.save(ResetToken.builder()
                .userId(userId)
                .tokenHash(digest(token))
                .expiresAt(expiresAt)
                .build());

        auditService.log(userId, AuditService.RESET_ISSUED, Map.of("expiresAt", expiresAt.toString()));
        log.info("Reset token issued for user: {} (expires {})", userId, expiresAt);

        return new IssuedResetToken(token, expiresAt);
    }

    /**
     * @return {@code true} iff the candidate matches the user's active token and
     *         the token has not expired. Unknown users, missing tokens and
     *         malformed stored state all yield {@code false}.
     */
    @Transactional(readOnly = true)
    public boolean verify(String userId, String token) {
        if (userId == null || token == null || token.isEmpty()) {
            return false;
        }

        ResetToken stored = resetTokenRepository.findById(userId).orElse(null);
        if (stored == null || stored.getTokenHash() == null || stored.getExpiresAt() == null) {
            return false;
        }

        byte[] storedDigest;
        try {
            storedDigest = TOKEN_DECODER.decode(stored.getTokenHash());
        } catch (IllegalArgumentException e) {
            log.warn("Malformed reset token state for user: {}", userId);
            return false;
        }
        if (storedDigest.length != DIGEST_LENGTH) {
            log.warn("Malformed reset token state for user: {}", userId);
            return false;
        }

        boolean matches = MessageDigest.isEqual(sha256(token), storedDigest);
        boolean live = clock.instant().isBefore(stored.getExpiresAt());

        if (matches && !live) {
            log.info("Expired reset token presented for user: {}", userId);
        }
        return matches && live;
    }

    /**
     * Verify and delete the token in one step.
     *
     * @return {@code true} for exactly one caller per issued token; {@code false}
     *         when the token is wrong, expired, or already consumed
     */
    @Transactional
    public boolean consume(String userId, String token) {
        if (!verify(userId, token)) {
            return false;
        }
        boolean consumed = resetTokenRepository.deleteLive(userId, digest(token), clock.instant()) == 1;
        if (!consumed) {
            log.warn("Reset token for user {} was consumed concurrently", userId);
        }
        return consumed;
    }

    /** Drop the user's active token, if any. */
    @Transactional
    public void revoke(String userId) {
        resetTokenRepository.deleteById(userId);
        auditService.log(userId, AuditService.RESET_REVOKED);
        log.info("Reset token revoked for user: {}", userId);
    }

    private static String digest(String token) {
        return TOKEN_ENCODER.encodeToString(sha256(token));
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
