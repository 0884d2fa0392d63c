package com.yoursp.ledger.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

@Entity
@Table(name = "biometric_profiles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BiometricProfile {

    @Id
    @Column(name = "user_id", updatable = false, nullable = false)
    private String userId;

    /** Encrypted little-endian float64 vector, Base64. */
    @Column(name = "encoding", length = 8192, nullable = false)
    private String encoding;

    @Column(name = "dimension", nullable = false)
    private int dimension;

    @Column(name = "enrolled_at")
    private OffsetDateTime enrolledAt;

    @PrePersist
    @PreUpdate
    protected void onSave() {
        enrolledAt = OffsetDateTime.now();
    }
}
