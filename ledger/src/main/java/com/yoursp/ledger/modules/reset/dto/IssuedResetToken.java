package com.yoursp.ledger.modules.reset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A freshly issued reset token. The token is the sole proof of possession and
 * is masked in {@link #toString()}.
 */
public record IssuedResetToken(
        String token,
        @JsonProperty("expires_at") Instant expiresAt) {

    @Override
    public String toString() {
        return "IssuedResetToken[token=***, expiresAt=" + expiresAt + "]";
    }
}
