package com.privinsight.core.repository;

import com.privinsight.core.domain.BudgetReservation;
import com.privinsight.core.domain.BudgetReservation.ReservationStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BudgetReservationRepository extends JpaRepository<BudgetReservation, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM BudgetReservation r WHERE r.id = :id")
    Optional<BudgetReservation> findByIdForUpdate(@Param("id") UUID id);

    List<BudgetReservation> findByCategoryAndStatus(String category, ReservationStatus status);

    /**
     * Held reservations whose job already failed; these should have been released.
     */
    @Query("SELECT r FROM BudgetReservation r WHERE r.status = 'HELD' AND r.jobId IN " +
           "(SELECT j.id FROM AnalyticsJob j WHERE j.state = 'FAILED')")
    List<BudgetReservation> findHeldForFailedJobs();

    /**
     * Held reservations never attached to a job, e.g. after a crash between reserve and job creation.
     */
    @Query("SELECT r FROM BudgetReservation r WHERE r.status = 'HELD' AND r.jobId IS NULL AND r.createdAt < :cutoff")
    List<BudgetReservation> findOrphanedHeldBefore(@Param("cutoff") Instant cutoff);
}
