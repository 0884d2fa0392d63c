package com.yoursp.ledger.repository;

import com.yoursp.ledger.model.entity.BiometricProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BiometricProfileRepository extends JpaRepository<BiometricProfile, String> {

    /**
     * Full scan used by authentication. Ordered so ties resolve the same way on
     * every call.
     */
    List<BiometricProfile> findAllByOrderByUserIdAsc();
}
