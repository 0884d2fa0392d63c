package com.yoursp.ledger.config;

import com.yoursp.ledger.modules.vault.VaultCipher;
import com.yoursp.ledger.modules.vault.VaultKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.crypto.SecretKey;
import java.util.Base64;

/**
 * Creates the single {@link VaultCipher} shared by the vault and the biometric
 * matcher.
 * <p>
 * Key sources, in order: {@code ledger.vault.key}, then
 * {@code ledger.vault.passphrase} + {@code ledger.vault.salt}, then (only with
 * {@code ledger.vault.allow-ephemeral-key=true}) a random in-memory key.
 * Startup fails when none applies.
 * </p>
 */
@Slf4j
@Configuration
public class VaultKeyConfig {

    @Bean
    public VaultCipher vaultCipher(LedgerProperties properties) {
        return new VaultCipher(resolveKey(properties.getVault()));
    }

    static SecretKey resolveKey(LedgerProperties.Vault vault) {
        if (hasText(vault.getKey())) {
            log.info("Vault key loaded from configured key material");
            return VaultKeys.fromBase64(vault.getKey());
        }

        if (hasText(vault.getPassphrase())) {
            if (!hasText(vault.getSalt())) {
                throw new IllegalStateException("ledger.vault.salt is required with ledger.vault.passphrase");
            }
            log.info("Vault key derived from configured passphrase");
            return VaultKeys.fromPassphrase(vault.getPassphrase().toCharArray(),
                    Base64.getDecoder().decode(vault.getSalt().trim()));
        }

        if (vault.isAllowEphemeralKey()) {
            log.warn("No vault key configured - using an ephemeral key. "
                    + "Stored credentials will be unreadable after restart.");
            return VaultKeys.generate();
        }

        throw new IllegalStateException(
                "No vault key configured: set ledger.vault.key or ledger.vault.passphrase/salt");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
