package com.yoursp.ledger.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

@Entity
@Table(name = "user_credentials")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserCredential {

    public static final int MAX_USER_ID_LENGTH = 255;

    @Id
    @Column(name = "user_id", length = UserCredential.MAX_USER_ID_LENGTH, updatable = false, nullable = false)
    private String userId;

    // Ciphertext grows with the secret, so no fixed column width
    @Lob
    @Column(name = "encrypted_username", nullable = false)
    private String encryptedUsername;

    @Lob
    @Column(name = "encrypted_password", nullable = false)
    private String encryptedPassword;

    @Lob
    @Column(name = "hint")
    private String hint;

    @Column(name = "biometric_enabled", nullable = false)
    private boolean biometricEnabled;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null)
            createdAt = now;
        if (updatedAt == null)
            updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }
}
