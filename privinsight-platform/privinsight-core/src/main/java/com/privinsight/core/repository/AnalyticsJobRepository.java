package com.privinsight.core.repository;

import com.privinsight.core.domain.AnalyticsJob;
import com.privinsight.core.domain.AnalyticsJob.JobState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for analytics jobs.
 * All state transitions load the job through {@link #findByIdForUpdate(Long)}.
 */
@Repository
public interface AnalyticsJobRepository extends JpaRepository<AnalyticsJob, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM AnalyticsJob j WHERE j.id = :id")
    Optional<AnalyticsJob> findByIdForUpdate(@Param("id") Long id);

    List<AnalyticsJob> findByState(JobState state);

    List<AnalyticsJob> findByRequesterOrderByIdDesc(String requester);

    long countByState(JobState state);

    @Query("SELECT j FROM AnalyticsJob j WHERE j.state = 'PROCESSING' AND j.processingDeadline <= :now")
    List<AnalyticsJob> findOverdueProcessing(@Param("now") Instant now);
}
