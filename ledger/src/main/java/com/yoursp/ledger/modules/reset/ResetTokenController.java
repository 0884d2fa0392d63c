package com.yoursp.ledger.modules.reset;

import com.yoursp.ledger.modules.reset.dto.IssuedResetToken;
import com.yoursp.ledger.modules.reset.dto.ResetPasswordRequest;
import com.yoursp.ledger.modules.reset.dto.VerifyResetTokenRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Password reset endpoints.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /api/credentials/{userId}/reset-token: issue a token</li>
 * <li>DELETE /api/credentials/{userId}/reset-token: revoke the active token</li>
 * <li>POST /api/credentials/{userId}/reset-token/verify: check a token</li>
 * <li>POST /api/credentials/{userId}/password: set a new password with a
 * token</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/credentials/{userId}")
@RequiredArgsConstructor
public class ResetTokenController {

    private final ResetTokenService resetTokenService;
    private final PasswordResetService passwordResetService;

    @PostMapping("/reset-token")
    public ResponseEntity<IssuedResetToken> issue(@PathVariable String userId) {
        return ResponseEntity.ok(resetTokenService.issue(userId));
    }

    @DeleteMapping("/reset-token")
    public ResponseEntity<Void> revoke(@PathVariable String userId) {
        resetTokenService.revoke(userId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/reset-token/verify")
    public ResponseEntity<Map<String, Boolean>> verify(@PathVariable String userId,
            @Valid @RequestBody VerifyResetTokenRequest request) {
        return ResponseEntity.ok(Map.of("valid", resetTokenService.verify(userId, request.getToken())));
    }

    @PostMapping("/password")
    public ResponseEntity<Map<String, String>> resetPassword(@PathVariable String userId,
            @Valid @RequestBody ResetPasswordRequest request) {
        passwordResetService.resetPassword(userId, request.getToken(), request.getNewPassword());
        return ResponseEntity.ok(Map.of("message", "Password reset successfully"));
    }
}
