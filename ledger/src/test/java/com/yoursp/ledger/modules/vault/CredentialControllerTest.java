package com.yoursp.ledger.modules.vault;

import com.yoursp.ledger.config.SecurityConfig;
import com.yoursp.ledger.exception.CredentialNotFoundException;
import com.yoursp.ledger.exception.DecryptionException;
import com.yoursp.ledger.modules.vault.dto.RetrievedCredential;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = CredentialController.class, properties = "rate-limit.enabled=false")
@Import(SecurityConfig.class)
class CredentialControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CredentialVaultService vaultService;
    @MockBean
    private StringRedisTemplate redisTemplate;

    // ================================================================
    // POST /api/credentials
    // ================================================================

    @Test
    @DisplayName("snake_case body binds, hint is optional")
    void storeBindsBody() throws Exception {
        mockMvc.perform(post("/api/credentials")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"u1\",\"username\":\"alice\",\"password\":\"P@ss1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Credentials stored successfully"))
                .andExpect(header().exists("X-Correlation-Id"));

        verify(vaultService).store("u1", "alice", "P@ss1", null);
    }

    @Test
    @DisplayName("whitespace password is accepted as a value")
    void storeAcceptsWhitespacePassword() throws Exception {
        mockMvc.perform(post("/api/credentials")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"u1\",\"username\":\"alice\",\"password\":\"   \",\"hint\":\"pet\"}"))
                .andExpect(status().isOk());

        verify(vaultService).store("u1", "alice", "   ", "pet");
    }

    @Test
    @DisplayName("missing password → 400 with the field named, service not called")
    void storeMissingField() throws Exception {
        mockMvc.perform(post("/api/credentials")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"u1\",\"username\":\"alice\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors[0].field").value("password"));

        verifyNoInteractions(vaultService);
    }

    @Test
    @DisplayName("malformed JSON → 400")
    void storeMalformedBody() throws Exception {
        mockMvc.perform(post("/api/credentials")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    // ================================================================
    // GET /api/credentials/{userId}
    // ================================================================

    @Test
    @DisplayName("retrieve → username, password, hint and biometric_enabled")
    void retrieveShape() throws Exception {
        when(vaultService.retrieve("u1")).thenReturn(new RetrievedCredential("alice", "P@ss1", "", false));

        mockMvc.perform(get("/api/credentials/u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.password").value("P@ss1"))
                .andExpect(jsonPath("$.hint").value(""))
                .andExpect(jsonPath("$.biometric_enabled").value(false))
                .andExpect(jsonPath("$.biometricEnabled").doesNotExist());
    }

    @Test
    @DisplayName("unknown user → 404 NOT_FOUND")
    void retrieveUnknown() throws Exception {
        when(vaultService.retrieve("ghost")).thenThrow(new CredentialNotFoundException("No credentials stored for user: ghost"));

        mockMvc.perform(get("/api/credentials/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("undecryptable record → 500 DECRYPTION_FAILED with a generic message")
    void retrieveDecryptionFailure() throws Exception {
        when(vaultService.retrieve("u1")).thenThrow(new DecryptionException("AES-256-GCM decryption failed"));

        mockMvc.perform(get("/api/credentials/u1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("DECRYPTION_FAILED"))
                .andExpect(jsonPath("$.message", not(containsString("AES"))));
    }

    // ================================================================
    // POST /api/credentials/{userId}/login
    // ================================================================

    @Test
    @DisplayName("correct password → 200 authenticated")
    void loginSuccess() throws Exception {
        when(vaultService.verifyPassword("u1", "P@ss1")).thenReturn(true);

        mockMvc.perform(post("/api/credentials/u1/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"password\":\"P@ss1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(true));
    }

    @Test
    @DisplayName("wrong password → 401 INVALID_CREDENTIALS")
    void loginFailure() throws Exception {
        when(vaultService.verifyPassword(eq("u1"), anyString())).thenReturn(false);

        mockMvc.perform(post("/api/credentials/u1/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"password\":\"nope\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.authenticated").value(false))
                .andExpect(jsonPath("$.error").value("INVALID_CREDENTIALS"));
    }

    @Test
    @DisplayName("login without password → 400")
    void loginMissingPassword() throws Exception {
        mockMvc.perform(post("/api/credentials/u1/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(vaultService);
    }

    // ================================================================
    // DELETE /api/credentials/{userId}
    // ================================================================

    @Test
    @DisplayName("delete → 204")
    void deleteAnswersNoContent() throws Exception {
        mockMvc.perform(delete("/api/credentials/u1"))
                .andExpect(status().isNoContent());

        verify(vaultService).delete("u1");
    }

    @Test
    @DisplayName("paths outside /api are denied")
    void otherPathsDenied() throws Exception {
        mockMvc.perform(get("/internal/anything"))
                .andExpect(status().isForbidden());
    }
}
