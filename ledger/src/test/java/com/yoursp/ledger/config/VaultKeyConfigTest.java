package com.yoursp.ledger.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class VaultKeyConfigTest {

    @Test
    @DisplayName("configured key material takes precedence")
    void usesConfiguredKey() {
        byte[] raw = new byte[32];
        raw[0] = 7;
        LedgerProperties.Vault vault = new LedgerProperties.Vault();
        vault.setKey(Base64.getEncoder().encodeToString(raw));
        vault.setPassphrase("ignored");

        assertArrayEquals(raw, VaultKeyConfig.resolveKey(vault).getEncoded());
    }

    @Test
    @DisplayName("passphrase without salt → startup failure")
    void passphraseNeedsSalt() {
        LedgerProperties.Vault vault = new LedgerProperties.Vault();
        vault.setPassphrase("secret");

        assertThrows(IllegalStateException.class, () -> VaultKeyConfig.resolveKey(vault));
    }

    @Test
    @DisplayName("passphrase with salt → derived key")
    void passphraseWithSalt() {
        LedgerProperties.Vault vault = new LedgerProperties.Vault();
        vault.setPassphrase("secret");
        vault.setSalt(Base64.getEncoder().encodeToString(new byte[16]));

        assertEquals(32, VaultKeyConfig.resolveKey(vault).getEncoded().length);
    }

    @Test
    @DisplayName("no key source → startup failure unless ephemeral keys are allowed")
    void ephemeralKeyIsOptIn() {
        LedgerProperties.Vault vault = new LedgerProperties.Vault();
        assertThrows(IllegalStateException.class, () -> VaultKeyConfig.resolveKey(vault));

        vault.setAllowEphemeralKey(true);
        assertEquals(32, VaultKeyConfig.resolveKey(vault).getEncoded().length);
    }
}
