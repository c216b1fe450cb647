package com.privinsight.core.repository;

import com.privinsight.core.domain.PossessionChallenge;
import com.privinsight.core.domain.PossessionChallenge.ChallengeStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for possession challenges.
 * Answering takes a row lock so a nonce is consumed exactly once.
 */
@Repository
public interface PossessionChallengeRepository extends JpaRepository<PossessionChallenge, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM PossessionChallenge c WHERE c.nonce = :nonce")
    Optional<PossessionChallenge> findByNonceForUpdate(@Param("nonce") String nonce);

    List<PossessionChallenge> findByDatasetHandleOrderByIssuedAtAsc(String datasetHandle);

    long countByDatasetHandleAndStatus(String datasetHandle, ChallengeStatus status);
}
