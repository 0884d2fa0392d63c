package com.yoursp.ledger.modules.reset;

import com.yoursp.ledger.exception.InvalidResetTokenException;
import com.yoursp.ledger.modules.vault.CredentialVaultService;
import com.yoursp.ledger.service.AuditService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PasswordResetServiceTest {

    @Mock
    private ResetTokenService resetTokenService;
    @Mock
    private CredentialVaultService vaultService;
    @Mock
    private AuditService auditService;

    @InjectMocks
    private PasswordResetService passwordResetService;

    @Test
    @DisplayName("valid token → consumed, password changed, reset audited")
    void validTokenChangesPassword() {
        when(resetTokenService.consume("u1", "tok")).thenReturn(true);

        passwordResetService.resetPassword("u1", "tok", "N3w!");

        verify(vaultService).changePassword("u1", "N3w!");
        verify(auditService).log("u1", AuditService.RESET_COMPLETED);
    }

    @Test
    @DisplayName("invalid or expired token → InvalidResetTokenException, password untouched")
    void invalidTokenRejected() {
        when(resetTokenService.consume("u1", "bad")).thenReturn(false);

        assertThrows(InvalidResetTokenException.class,
                () -> passwordResetService.resetPassword("u1", "bad", "N3w!"));

        verify(vaultService, never()).changePassword(anyString(), anyString());
        verify(auditService).log("u1", AuditService.RESET_REJECTED);
    }

    @Test
    @DisplayName("same token twice → second reset rejected, password changed once")
    void tokenResetsOnlyOnce() {
        when(resetTokenService.consume("u1", "tok")).thenReturn(true, false);

        passwordResetService.resetPassword("u1", "tok", "First#1");
        assertThrows(InvalidResetTokenException.class,
                () -> passwordResetService.resetPassword("u1", "tok", "Second#2"));

        verify(vaultService).changePassword("u1", "First#1");
        verify(vaultService, never()).changePassword("u1", "Second#2");
    }
}
