package com.yoursp.ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Binds the {@code ledger.*} YAML properties into a typed bean.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Vault vault = new Vault();
    private Reset reset = new Reset();
    private Biometric biometric = new Biometric();

    @Getter
    @Setter
    public static class Vault {

        /** Base64 of a raw 32-byte AES key. Takes precedence over the passphrase. */
        private String key;

        private String passphrase;

        /** Base64 salt for the passphrase derivation. */
        private String salt;

        /** Dev only: generate a throwaway key when nothing else is configured. */
        private boolean allowEphemeralKey = false;
    }

    @Getter
    @Setter
    public static class Reset {

        private Duration tokenTtl = Duration.ofHours(24);

        private int tokenBytes = 32;
    }

    @Getter
    @Setter
    public static class Biometric {

        private String encoderUrl = "http://localhost:8090";

        /** Euclidean distance below which two encodings are the same face. */
        private double matchThreshold = 0.6;

        private int encodingDimension = 128;

        private Duration encoderTimeout = Duration.ofSeconds(15);
    }
}
