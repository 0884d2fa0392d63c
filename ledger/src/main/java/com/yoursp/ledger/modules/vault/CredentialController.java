package com.yoursp.ledger.modules.vault;

import com.yoursp.ledger.modules.vault.dto.LoginRequest;
import com.yoursp.ledger.modules.vault.dto.RetrievedCredential;
import com.yoursp.ledger.modules.vault.dto.StoreCredentialRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Credential vault endpoints.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /api/credentials: store (insert or replace)</li>
 * <li>GET /api/credentials/{userId}: retrieve decrypted credentials</li>
 * <li>POST /api/credentials/{userId}/login: check a password</li>
 * <li>DELETE /api/credentials/{userId}: delete credentials, token and
 * biometric profile</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/credentials")
@RequiredArgsConstructor
public class CredentialController {

    private final CredentialVaultService vaultService;

    @PostMapping
    public ResponseEntity<Map<String, String>> store(@Valid @RequestBody StoreCredentialRequest request) {
        vaultService.store(request.getUserId(), request.getUsername(), request.getPassword(), request.getHint());
        return ResponseEntity.ok(Map.of("message", "Credentials stored successfully"));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<RetrievedCredential> retrieve(@PathVariable String userId) {
        return ResponseEntity.ok(vaultService.retrieve(userId));
    }

    @PostMapping("/{userId}/login")
    public ResponseEntity<Map<String, Object>> login(@PathVariable String userId,
            @Valid @RequestBody LoginRequest request) {
        if (vaultService.verifyPassword(userId, request.getPassword())) {
            return ResponseEntity.ok(Map.of("authenticated", true));
        }
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Map.of("authenticated", false,
                        "error", "INVALID_CREDENTIALS",
                        "message", "Incorrect password"));
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> delete(@PathVariable String userId) {
        vaultService.delete(userId);
        return ResponseEntity.noContent().build();
    }
}
