package com.yoursp.ledger.modules.biometric;

import com.yoursp.ledger.modules.biometric.dto.BiometricMatch;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;

/**
 * Biometric enrolment and login.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /api/biometrics/{userId}: enrol a face (multipart "image")</li>
 * <li>POST /api/biometrics/authenticate: identify a face (multipart
 * "image")</li>
 * <li>DELETE /api/biometrics/{userId}: remove the profile</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/biometrics")
@RequiredArgsConstructor
public class BiometricController {

    private final BiometricMatcherService matcherService;

    // ================================================================
    // POST /api/biometrics/authenticate
    // ================================================================

    @PostMapping(value = "/authenticate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> authenticate(@RequestParam("image") MultipartFile image) throws IOException {
        return matcherService.authenticate(image.getBytes())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                        .body(Map.of("error", "NO_MATCH",
                                "message", "No enrolled user matches this face")));
    }

    // ================================================================
    // POST /api/biometrics/{userId}
    // ================================================================

    @PostMapping(value = "/{userId}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, String>> enroll(@PathVariable String userId,
            @RequestParam("image") MultipartFile image) throws IOException {
        matcherService.enroll(userId, image.getBytes());
        return ResponseEntity.ok(Map.of("message", "Biometric data enrolled"));
    }

    // ================================================================
    // DELETE /api/biometrics/{userId}
    // ================================================================

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> unenroll(@PathVariable String userId) {
        matcherService.unenroll(userId);
        return ResponseEntity.noContent().build();
    }
}
