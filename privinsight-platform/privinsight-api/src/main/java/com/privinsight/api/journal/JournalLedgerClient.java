package com.privinsight.api.journal;

import com.privinsight.core.domain.JobEvent;
import com.privinsight.core.repository.JobEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Append-only job journal with a single hash chain across all jobs.
 * Each append commits on its own so the next append always chains onto a durable hash.
 */
@Service
public class JournalLedgerClient implements LedgerClient {

    private static final Logger log = LoggerFactory.getLogger(JournalLedgerClient.class);

    static final String GENESIS = "GENESIS";

    private final JobEventRepository eventRepository;
    private final Clock clock;
    private final TransactionTemplate appendTransaction;

    public JournalLedgerClient(
            JobEventRepository eventRepository,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.eventRepository = eventRepository;
        this.clock = clock;
        this.appendTransaction = new TransactionTemplate(transactionManager);
        this.appendTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public synchronized JobEvent persist(JobEventDraft draft) {
        Objects.requireNonNull(draft, "Event draft cannot be null");
        return appendTransaction.execute(status -> {
            String previousHash = eventRepository.findMostRecentEventHash().orElse(GENESIS);
            JobEvent event = JobEvent.create(draft.jobId(), draft.eventType(), draft.fromState(),
                    draft.toState(), draft.detail(), previousHash, clock.instant());
            event.setEventHash(MerkleTree.sha256(event.canonicalForm()));
            JobEvent saved = eventRepository.save(event);
            log.debug("Journaled {} for job {}", draft.eventType(), draft.jobId());
            return saved;
        });
    }

    @Override
    public List<JobEvent> read(Long jobId) {
        return eventRepository.findByJobIdOrderByIdAsc(jobId);
    }

    /**
     * Recomputes each of a job's event hashes and checks that every event chains onto an
     * earlier journal entry.
     */
    public ChainVerification verifyChain(Long jobId) {
        List<JobEvent> events = read(jobId);
        for (JobEvent event : events) {
            if (!isIntact(event)) {
                return new ChainVerification(events.size(), false, event.getId());
            }
            String previousHash = event.getPreviousEventHash();
            if (!GENESIS.equals(previousHash)) {
                boolean linked = eventRepository.findByEventHash(previousHash)
                        .map(previous -> previous.getId() < event.getId())
                        .orElse(false);
                if (!linked) {
                    return new ChainVerification(events.size(), false, event.getId());
                }
            }
        }
        return new ChainVerification(events.size(), true, null);
    }

    /**
     * Walks the whole journal in append order.
     */
    public ChainVerification verifyJournal() {
        List<JobEvent> events = eventRepository.findAllByOrderByIdAsc();
        String expectedPrevious = GENESIS;
        for (JobEvent event : events) {
            if (!isIntact(event) || !expectedPrevious.equals(event.getPreviousEventHash())) {
                log.warn("Journal chain broken at event {}", event.getId());
                return new ChainVerification(events.size(), false, event.getId());
            }
            expectedPrevious = event.getEventHash();
        }
        return new ChainVerification(events.size(), true, null);
    }

    private static boolean isIntact(JobEvent event) {
        return event.getEventHash() != null
                && event.getEventHash().equals(MerkleTree.sha256(event.canonicalForm()));
    }

    public record ChainVerification(int eventsChecked, boolean valid, Long firstInvalidEventId) {}
}
