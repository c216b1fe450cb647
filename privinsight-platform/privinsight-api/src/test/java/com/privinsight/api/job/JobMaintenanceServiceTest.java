package com.privinsight.api.job;

import com.privinsight.api.job.JobMaintenanceService.SweepReport;
import com.privinsight.api.journal.JournalAnchorService;
import com.privinsight.api.ledger.PrivacyLedgerService.ReservationResult;
import com.privinsight.api.support.PipelineIntegrationSupport;
import com.privinsight.core.domain.AnalyticsJob;
import com.privinsight.core.domain.AnalyticsJob.JobState;
import com.privinsight.core.domain.BudgetReservation.ReservationStatus;
import com.privinsight.core.domain.RejectionReason;
import com.privinsight.core.repository.AnalyticsJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class JobMaintenanceServiceTest extends PipelineIntegrationSupport {

    @Autowired
    private JournalAnchorService journalAnchorService;

    @Autowired
    private AnalyticsJobRepository jobRepository;

    private JobMaintenanceService maintenance;

    @BeforeEach
    void setUp() {
        maintenance = new JobMaintenanceService(coordinator, journalAnchorService);
    }

    @Test
    void sweepReleasesReservationsThatNeverGotAJob() {
        String category = newCategory("5");
        ReservationResult orphan = ledgerService.checkAndReserve(category, new BigDecimal("2"));
        clock.advance(Duration.ofMinutes(1));

        SweepReport report = maintenance.sweep();

        assertThat(report.reservationsReleased()).isGreaterThanOrEqualTo(1);
        assertThat(report.hasWork()).isTrue();
        assertThat(ledgerService.getReservation(orphan.reservationId()).orElseThrow().getStatus())
                .isEqualTo(ReservationStatus.RELEASED);
        assertThat(ledgerService.getBudgetStatus(category).reserved()).isEqualByComparingTo("0");
    }

    @Test
    void freshReservationIsLeftAlone() {
        String category = newCategory("5");
        ReservationResult fresh = ledgerService.checkAndReserve(category, new BigDecimal("2"));

        maintenance.sweep();

        assertThat(ledgerService.getReservation(fresh.reservationId()).orElseThrow().isHeld()).isTrue();
        ledgerService.release(fresh.reservationId());
    }

    @Test
    void sweepFailsOverdueJobsAndAnchorsTheirEvents() {
        String category = newCategory("5");
        Long jobId = coordinator.submit(request(category, newDataset(), newCircuit(), "1")).jobId();
        assertThat(coordinator.beginProcessing(jobId).success()).isTrue();
        clock.advance(Duration.ofMinutes(1));

        SweepReport report = maintenance.sweep();

        AnalyticsJob job = awaitState(jobId, JobState.FAILED);
        assertThat(job.getFailureReason()).isEqualTo(RejectionReason.COMPUTATION_TIMEOUT);
        assertThat(report.eventsAnchored()).isPositive();
        assertThat(ledgerService.getBudgetStatus(category).reserved()).isEqualByComparingTo("0");
    }

    @Test
    void sweepFinalizesCompletedJobs() {
        String category = newCategory("5");
        String circuitId = newCircuit();
        String handle = newDataset();
        ReservationResult reservation = ledgerService.checkAndReserve(category, new BigDecimal("1.5"));
        Instant now = clock.instant();
        AnalyticsJob job = jobRepository.save(AnalyticsJob.submit(unique("requester"), handle, category,
                circuitId, new BigDecimal("1.5"), null, reservation.reservationId(), now));
        ledgerService.attachJob(reservation.reservationId(), job.getId());
        job.startProcessing(now.plus(Duration.ofDays(1)), now);
        job.complete("stuck-result", circuitId, new byte[] {1, 2, 3}, JobCoordinatorService.publicInputs("stuck-result", handle), now);
        jobRepository.save(job);

        SweepReport report = maintenance.sweep();

        assertThat(report.finalized()).isGreaterThanOrEqualTo(1);
        assertThat(coordinator.getJob(job.getId()).orElseThrow().getState()).isEqualTo(JobState.VERIFIED);
        assertThat(ledgerService.getBudgetStatus(category).consumed()).isEqualByComparingTo("1.5");
        assertThat(ledgerService.getBudgetStatus(category).reserved()).isEqualByComparingTo("0");
    }
}
