package com.yoursp.ledger.modules.biometric.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful biometric match: the enrolled user and how far the candidate was from
 * their profile.
 */
public record BiometricMatch(
        @JsonProperty("user_id") String userId,
        double distance) {
}
