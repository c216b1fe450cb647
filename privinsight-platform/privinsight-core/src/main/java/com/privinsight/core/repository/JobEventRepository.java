package com.privinsight.core.repository;

import com.privinsight.core.domain.JobEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the append-only job journal.
 */
@Repository
public interface JobEventRepository extends JpaRepository<JobEvent, Long> {

    List<JobEvent> findByJobIdOrderByIdAsc(Long jobId);

    Optional<JobEvent> findByEventHash(String eventHash);

    /**
     * Gets the most recent event hash for chaining.
     */
    @Query("SELECT e.eventHash FROM JobEvent e WHERE e.eventHash IS NOT NULL ORDER BY e.id DESC LIMIT 1")
    Optional<String> findMostRecentEventHash();

    @Query("SELECT e FROM JobEvent e WHERE e.merkleProof IS NULL ORDER BY e.id ASC")
    List<JobEvent> findUnanchoredEvents(Pageable pageable);

    @Query("SELECT e FROM JobEvent e WHERE e.anchorTxHash IS NULL ORDER BY e.id ASC")
    List<JobEvent> findEventsWithoutAnchorTx(Pageable pageable);

    List<JobEvent> findAllByOrderByIdAsc();
}
