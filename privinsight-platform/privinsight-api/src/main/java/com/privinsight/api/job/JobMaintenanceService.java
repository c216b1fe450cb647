package com.privinsight.api.job;

import com.privinsight.api.journal.JournalAnchorService;
import com.privinsight.api.journal.JournalAnchorService.AnchorBatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic sweep that keeps job and ledger state consistent after crashes, missed callbacks
 * and failed commits, then anchors the journal.
 */
@Service
@ConditionalOnProperty(prefix = "privinsight.jobs", name = "maintenance-enabled", havingValue = "true",
        matchIfMissing = true)
public class JobMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(JobMaintenanceService.class);

    private final JobCoordinatorService coordinator;
    private final JournalAnchorService journalAnchorService;

    public JobMaintenanceService(JobCoordinatorService coordinator, JournalAnchorService journalAnchorService) {
        this.coordinator = coordinator;
        this.journalAnchorService = journalAnchorService;
    }

    @Scheduled(fixedDelayString = "${privinsight.jobs.sweep-interval-ms:60000}")
    public SweepReport sweep() {
        int timedOut = coordinator.timeOutOverdueJobs();
        int finalized = coordinator.finalizeCompletedJobs();
        int released = coordinator.releaseStrandedReservations();
        AnchorBatchResult anchored = journalAnchorService.anchorPending();

        SweepReport report = new SweepReport(timedOut, finalized, released, anchored.eventCount());
        if (report.hasWork()) {
            log.info("Maintenance sweep: {} timed out, {} finalized, {} reservations released, {} events anchored",
                    timedOut, finalized, released, anchored.eventCount());
        }
        return report;
    }

    public record SweepReport(int timedOut, int finalized, int reservationsReleased, int eventsAnchored) {
        public boolean hasWork() {
            return timedOut + finalized + reservationsReleased + eventsAnchored > 0;
        }
    }
}
