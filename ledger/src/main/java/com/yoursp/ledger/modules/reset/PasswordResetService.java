package com.yoursp.ledger.modules.reset;

import com.yoursp.ledger.exception.InvalidResetTokenException;
import com.yoursp.ledger.modules.vault.CredentialVaultService;
import com.yoursp.ledger.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Completes a password reset: consumes the token, then stores the new password.
 * The token is deleted before the password changes, so each token resets at most
 * once even when two requests race.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetService {

    private final ResetTokenService resetTokenService;
    private final CredentialVaultService vaultService;
    private final AuditService auditService;

    @Transactional(noRollbackFor = InvalidResetTokenException.class)
    public void resetPassword(String userId, String token, String newPassword) {
        if (!resetTokenService.consume(userId, token)) {
            auditService.log(userId, AuditService.RESET_REJECTED);
            log.warn("Password reset rejected for user: {}", userId);
            throw new InvalidResetTokenException("Invalid or expired reset token");
        }

        vaultService.changePassword(userId, newPassword);

        auditService.log(userId, AuditService.RESET_COMPLETED);
        log.info("Password reset completed for user: {}", userId);
    }
}
