package com.yoursp.ledger.modules.biometric;

import com.yoursp.ledger.config.LedgerProperties;
import com.yoursp.ledger.exception.BiometricProfileNotFoundException;
import com.yoursp.ledger.exception.FeatureExtractionException;
import com.yoursp.ledger.exception.NoFaceDetectedException;
import com.yoursp.ledger.exception.ValidationException;
import com.yoursp.ledger.model.entity.BiometricProfile;
import com.yoursp.ledger.model.entity.UserCredential;
import com.yoursp.ledger.modules.biometric.dto.BiometricMatch;
import com.yoursp.ledger.modules.vault.VaultCipher;
import com.yoursp.ledger.repository.BiometricProfileRepository;
import com.yoursp.ledger.repository.UserCredentialRepository;
import com.yoursp.ledger.service.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Face enrolment and passwordless matching.
 * <ul>
 * <li>Exactly one encoding is used per image: the first in detector order</li>
 * <li>Encodings are stored encrypted and compared as raw vectors by Euclidean
 * distance against {@code ledger.biometric.match-threshold}</li>
 * <li>Authentication scans every profile and returns the closest one under the
 * threshold; equal distances keep the first profile in user-id order</li>
 * <li>The encoder is called before any transaction opens, so a slow encoder
 * never holds a database connection</li>
 * </ul>
 */
@Slf4j
@Service
public class BiometricMatcherService {

    private final FaceEncoder faceEncoder;
    private final BiometricProfileRepository profileRepository;
    private final UserCredentialRepository credentialRepository;
    private final VaultCipher vaultCipher;
    private final AuditService auditService;
    private final TransactionTemplate transactionTemplate;
    private final double matchThreshold;
    private final int encodingDimension;

    public BiometricMatcherService(FaceEncoder faceEncoder,
            BiometricProfileRepository profileRepository,
            UserCredentialRepository credentialRepository,
            VaultCipher vaultCipher,
            AuditService auditService,
            TransactionTemplate transactionTemplate,
            LedgerProperties properties) {
        this.faceEncoder = faceEncoder;
        this.profileRepository = profileRepository;
        this.credentialRepository = credentialRepository;
        this.vaultCipher = vaultCipher;
        this.auditService = auditService;
        this.transactionTemplate = transactionTemplate;
        this.matchThreshold = properties.getBiometric().getMatchThreshold();
        this.encodingDimension = properties.getBiometric().getEncodingDimension();
    }

    /**
     * Enrol (or re-enrol) a user's face.
     *
     * @throws NoFaceDetectedException    if the image is empty or has no face
     * @throws FeatureExtractionException if the encoder fails or returns an
     *                                    encoding of the wrong dimension
     */
    public void enroll(String userId, byte[] image) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("user_id is required");
        }
        if (userId.length() > UserCredential.MAX_USER_ID_LENGTH) {
            throw new ValidationException("user_id is too long");
        }

        double[] encoding = extractSingleEncoding(image);
        String sealed = vaultCipher.encryptBytes(FaceEncodings.toBytes(encoding), context(userId));

        transactionTemplate.executeWithoutResult(status -> {
            profileRepository.save(BiometricProfile.builder()
                    .userId(userId)
                    .encoding(sealed)
                    .dimension(encoding.length)
                    .build());
            credentialRepository.updateBiometricEnabled(userId, true);
            auditService.log(userId, AuditService.BIOMETRIC_ENROLLED);
        });
        log.info("Biometric data enrolled for user {}", userId);
    }

    /**
     * Identify the user in an image.
     *
     * @return the best match under the threshold, or empty when nobody matches
     */
    public Optional<BiometricMatch> authenticate(byte[] image) {
        double[] candidate = extractSingleEncoding(image);

        // Read-only scan in the repository's own transaction
        BiometricMatch best = null;
        for (BiometricProfile profile : profileRepository.findAllByOrderByUserIdAsc()) {
            if (profile.getDimension() != candidate.length) {
                log.warn("Skipping biometric profile with dimension {} for user {}",
                        profile.getDimension(), profile.getUserId());
                continue;
            }
            double[] stored = FaceEncodings.fromBytes(
                    vaultCipher.decryptBytes(profile.getEncoding(), context(profile.getUserId())));
            double distance = FaceEncodings.euclideanDistance(candidate, stored);

            if (distance < matchThreshold && (best == null || distance < best.distance())) {
                best = new BiometricMatch(profile.getUserId(), distance);
            }
        }

        if (best == null) {
            log.info("No match found for input image.");
            return Optional.empty();
        }

        auditService.log(best.userId(), AuditService.BIOMETRIC_AUTHENTICATED,
                Map.of("distance", best.distance()));
        log.info("User authenticated: {}", best.userId());
        return Optional.of(best);
    }

    @Transactional(readOnly = true)
    public boolean isEnrolled(String userId) {
        return userId != null && profileRepository.existsById(userId);
    }

    /**
     * Remove a user's profile and clear the biometric flag on their credential.
     */
    @Transactional
    public void unenroll(String userId) {
        if (!isEnrolled(userId)) {
            throw new BiometricProfileNotFoundException("No biometric profile for user: " + userId);
        }
        profileRepository.deleteById(userId);
        credentialRepository.updateBiometricEnabled(userId, false);

        auditService.log(userId, AuditService.BIOMETRIC_REMOVED);
        log.info("Biometric data removed for user {}", userId);
    }

    private double[] extractSingleEncoding(byte[] image) {
        if (image == null || image.length == 0) {
            throw new NoFaceDetectedException("Image is empty");
        }

        List<double[]> encodings = faceEncoder.encode(image);
        if (encodings == null || encodings.isEmpty()) {
            log.warn("No face detected in image");
            throw new NoFaceDetectedException("No face detected in image");
        }
        if (encodings.size() > 1) {
            log.info("{} faces detected, using the first", encodings.size());
        }

        double[] encoding = encodings.get(0);
        if (encoding == null || encoding.length != encodingDimension) {
            throw new FeatureExtractionException("Expected a " + encodingDimension + "-dimension encoding, got "
                    + (encoding == null ? "none" : encoding.length));
        }
        return encoding;
    }

    private static String context(String userId) {
        return userId + ":encoding";
    }
}
