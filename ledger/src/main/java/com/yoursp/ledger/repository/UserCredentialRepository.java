package com.yoursp.ledger.repository;

import com.yoursp.ledger.model.entity.UserCredential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface UserCredentialRepository extends JpaRepository<UserCredential, String> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE UserCredential uc SET uc.biometricEnabled = :enabled WHERE uc.userId = :userId")
    int updateBiometricEnabled(String userId, boolean enabled);
}
