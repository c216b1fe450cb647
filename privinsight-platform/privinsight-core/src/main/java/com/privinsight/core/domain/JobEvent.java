package com.privinsight.core.domain;

import com.privinsight.core.domain.AnalyticsJob.JobState;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Append-only journal entry for job state transitions and budget movements.
 * Entries form a hash chain across the whole journal.
 */
@Entity
@Table(name = "job_events", indexes = {
    @Index(name = "idx_event_job", columnList = "job_id"),
    @Index(name = "idx_event_type", columnList = "event_type"),
    @Index(name = "idx_event_occurred", columnList = "occurred_at")
})
public class JobEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40)
    private EventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", length = 20)
    private JobState fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", length = 20)
    private JobState toState;

    @Column(name = "detail", length = 1024)
    private String detail;

    @NotNull
    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @NotNull
    @Column(name = "previous_event_hash", nullable = false, length = 64)
    private String previousEventHash;

    @Column(name = "event_hash", length = 64)
    private String eventHash;

    @Column(name = "merkle_root", length = 64)
    private String merkleRoot;

    @Column(name = "merkle_proof", columnDefinition = "TEXT")
    private String merkleProof;

    @Column(name = "anchor_tx_hash", length = 80)
    private String anchorTxHash;

    public enum EventType {
        JOB_SUBMITTED,
        PROCESSING_STARTED,
        POSSESSION_VERIFIED,
        POSSESSION_FAILED,
        COMPUTATION_DISPATCHED,
        COMPUTATION_FAILED,
        PROCESSING_TIMED_OUT,
        RESULT_ACCEPTED,
        PROOF_REJECTED,
        JOB_CANCELLED,
        BUDGET_COMMITTED,
        BUDGET_RELEASED,
        JOB_VERIFIED
    }

    protected JobEvent() {}

    public static JobEvent create(Long jobId, EventType eventType, JobState fromState, JobState toState,
                                  String detail, String previousEventHash, Instant occurredAt) {
        if (jobId == null) {
            throw new IllegalArgumentException("Job ID cannot be null");
        }
        if (eventType == null) {
            throw new IllegalArgumentException("Event type cannot be null");
        }
        if (previousEventHash == null || previousEventHash.isBlank()) {
            throw new IllegalArgumentException("Previous event hash cannot be null or blank");
        }
        JobEvent event = new JobEvent();
        event.jobId = jobId;
        event.eventType = eventType;
        event.fromState = fromState;
        event.toState = toState;
        event.detail = detail != null && detail.length() > 1024 ? detail.substring(0, 1024) : detail;
        event.previousEventHash = previousEventHash;
        // Truncated so the canonical form is identical after a database round trip.
        event.occurredAt = occurredAt.truncatedTo(ChronoUnit.MILLIS);
        return event;
    }

    /**
     * Canonical form hashed into the chain.
     */
    public String canonicalForm() {
        return String.join("|",
                jobId.toString(),
                eventType.name(),
                fromState != null ? fromState.name() : "-",
                toState != null ? toState.name() : "-",
                detail != null ? detail : "",
                occurredAt.toString(),
                previousEventHash);
    }

    public void setEventHash(String eventHash) {
        if (this.eventHash != null) {
            throw new IllegalStateException("Event hash is write-once");
        }
        this.eventHash = eventHash;
    }

    public void recordMerkleProof(String merkleRoot, String merkleProof) {
        this.merkleRoot = merkleRoot;
        this.merkleProof = merkleProof;
    }

    public void recordAnchor(String anchorTxHash) {
        this.anchorTxHash = anchorTxHash;
    }

    // Getters
    public Long getId() { return id; }
    public Long getJobId() { return jobId; }
    public EventType getEventType() { return eventType; }
    public JobState getFromState() { return fromState; }
    public JobState getToState() { return toState; }
    public String getDetail() { return detail; }
    public Instant getOccurredAt() { return occurredAt; }
    public String getPreviousEventHash() { return previousEventHash; }
    public String getEventHash() { return eventHash; }
    public String getMerkleRoot() { return merkleRoot; }
    public String getMerkleProof() { return merkleProof; }
    public String getAnchorTxHash() { return anchorTxHash; }
}
