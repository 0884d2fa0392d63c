package com.yoursp.ledger.repository;

import com.yoursp.ledger.model.entity.ResetToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface ResetTokenRepository extends JpaRepository<ResetToken, String> {

    /**
     * Delete the user's token only if it still carries this digest and has not
     * expired. Concurrent callers serialize on the row, so at most one sees 1.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("DELETE FROM ResetToken t WHERE t.userId = :userId AND t.tokenHash = :tokenHash AND t.expiresAt > :now")
    int deleteLive(String userId, String tokenHash, Instant now);
}
