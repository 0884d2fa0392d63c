package com.yoursp.ledger.modules.reset;

import com.yoursp.ledger.config.SecurityConfig;
import com.yoursp.ledger.exception.CredentialNotFoundException;
import com.yoursp.ledger.exception.InvalidResetTokenException;
import com.yoursp.ledger.modules.reset.dto.IssuedResetToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ResetTokenController.class, properties = "rate-limit.enabled=false")
@Import(SecurityConfig.class)
class ResetTokenControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ResetTokenService resetTokenService;
    @MockBean
    private PasswordResetService passwordResetService;
    @MockBean
    private StringRedisTemplate redisTemplate;

    @Test
    @DisplayName("issue → token and ISO-8601 expires_at")
    void issueShape() throws Exception {
        when(resetTokenService.issue("u1"))
                .thenReturn(new IssuedResetToken("tok-123", Instant.parse("2026-03-02T10:00:00Z")));

        mockMvc.perform(post("/api/credentials/u1/reset-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").value("tok-123"))
                .andExpect(jsonPath("$.expires_at").value("2026-03-02T10:00:00Z"))
                .andExpect(jsonPath("$.expiresAt").doesNotExist());
    }

    @Test
    @DisplayName("issue for unknown user → 404")
    void issueUnknownUser() throws Exception {
        when(resetTokenService.issue("ghost")).thenThrow(new CredentialNotFoundException("none"));

        mockMvc.perform(post("/api/credentials/ghost/reset-token"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("verify → {valid: bool}")
    void verifyShape() throws Exception {
        when(resetTokenService.verify("u1", "tok-123")).thenReturn(true);

        mockMvc.perform(post("/api/credentials/u1/reset-token/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"token\":\"tok-123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true));
    }

    @Test
    @DisplayName("verify without token → 400")
    void verifyMissingToken() throws Exception {
        mockMvc.perform(post("/api/credentials/u1/reset-token/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors[0].field").value("token"));

        verifyNoInteractions(resetTokenService);
    }

    @Test
    @DisplayName("password reset binds new_password")
    void resetPasswordBindsBody() throws Exception {
        mockMvc.perform(post("/api/credentials/u1/password")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"token\":\"tok-123\",\"new_password\":\"N3w!\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Password reset successfully"));

        verify(passwordResetService).resetPassword("u1", "tok-123", "N3w!");
    }

    @Test
    @DisplayName("password reset with a spent or wrong token → 400 TOKEN_INVALID")
    void resetPasswordInvalidToken() throws Exception {
        doThrow(new InvalidResetTokenException("Invalid or expired reset token"))
                .when(passwordResetService).resetPassword("u1", "old", "N3w!");

        mockMvc.perform(post("/api/credentials/u1/password")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"token\":\"old\",\"new_password\":\"N3w!\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("TOKEN_INVALID"));
    }

    @Test
    @DisplayName("password reset without new_password → 400")
    void resetPasswordMissingField() throws Exception {
        mockMvc.perform(post("/api/credentials/u1/password")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"token\":\"tok-123\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(passwordResetService);
    }

    @Test
    @DisplayName("revoke → 204")
    void revokeAnswersNoContent() throws Exception {
        mockMvc.perform(delete("/api/credentials/u1/reset-token"))
                .andExpect(status().isNoContent());

        verify(resetTokenService).revoke("u1");
    }
}
