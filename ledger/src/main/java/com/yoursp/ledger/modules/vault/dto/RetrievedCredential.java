package com.yoursp.ledger.modules.vault.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decrypted view of a stored credential.
 */
public record RetrievedCredential(
        String username,
        String password,
        String hint,
        @JsonProperty("biometric_enabled") boolean biometricEnabled) {

    @Override
    public String toString() {
        return "RetrievedCredential[username=" + username + ", password=***, hint=***, biometricEnabled="
                + biometricEnabled + "]";
    }
}
