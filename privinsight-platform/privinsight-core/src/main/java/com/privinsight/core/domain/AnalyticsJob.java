package com.privinsight.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Privacy-governed analytics job.
 *
 * Lifecycle: PENDING -> PROCESSING -> {COMPLETED, FAILED}; COMPLETED -> VERIFIED.
 * FAILED and VERIFIED are terminal. Jobs are never deleted.
 */
@Entity
@Table(name = "analytics_jobs", indexes = {
    @Index(name = "idx_job_state", columnList = "state"),
    @Index(name = "idx_job_category", columnList = "category"),
    @Index(name = "idx_job_requester", columnList = "requester")
})
public class AnalyticsJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "requester", nullable = false)
    private String requester;

    @NotNull
    @Column(name = "dataset_handle", nullable = false, length = 128)
    private String datasetHandle;

    @NotNull
    @Column(name = "category", nullable = false, length = 64)
    private String category;

    @NotNull
    @Column(name = "circuit_id", nullable = false, length = 128)
    private String circuitId;

    @NotNull
    @Column(name = "epsilon_requested", nullable = false, precision = 19, scale = 6)
    private BigDecimal epsilonRequested;

    @Column(name = "metadata_hash", length = 64)
    private String metadataHash;

    @NotNull
    @Column(name = "reservation_id", nullable = false)
    private UUID reservationId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private JobState state;

    @Column(name = "challenge_nonce", length = 64)
    private String challengeNonce;

    @Column(name = "processing_deadline")
    private Instant processingDeadline;

    @Column(name = "result_hash", length = 128)
    private String resultHash;

    @Column(name = "proof_circuit_id", length = 128)
    private String proofCircuitId;

    @Column(name = "proof_bytes", columnDefinition = "TEXT")
    private String proofBytes;

    @Convert(converter = StringListConverter.class)
    @Column(name = "proof_public_inputs", columnDefinition = "TEXT")
    private List<String> proofPublicInputs;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 40)
    private RejectionReason failureReason;

    @Column(name = "failure_detail", length = 1024)
    private String failureDetail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    public enum JobState {
        PENDING,
        PROCESSING,
        COMPLETED,
        FAILED,
        VERIFIED;

        public boolean isTerminal() {
            return this == FAILED || this == VERIFIED;
        }
    }

    protected AnalyticsJob() {}

    public static AnalyticsJob submit(String requester, String datasetHandle, String category, String circuitId,
                                      BigDecimal epsilonRequested, String metadataHash, UUID reservationId,
                                      Instant now) {
        if (requester == null || requester.isBlank()) {
            throw new IllegalArgumentException("Requester cannot be null or blank");
        }
        if (datasetHandle == null || datasetHandle.isBlank()) {
            throw new IllegalArgumentException("Dataset handle cannot be null or blank");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category cannot be null or blank");
        }
        if (circuitId == null || circuitId.isBlank()) {
            throw new IllegalArgumentException("Circuit ID cannot be null or blank");
        }
        if (epsilonRequested == null || epsilonRequested.signum() <= 0) {
            throw new IllegalArgumentException("Epsilon must be positive");
        }
        if (reservationId == null) {
            throw new IllegalArgumentException("Reservation ID cannot be null");
        }
        AnalyticsJob job = new AnalyticsJob();
        job.requester = requester;
        job.datasetHandle = datasetHandle;
        job.category = category;
        job.circuitId = circuitId;
        job.epsilonRequested = epsilonRequested;
        job.metadataHash = metadataHash;
        job.reservationId = reservationId;
        job.state = JobState.PENDING;
        job.createdAt = now;
        job.updatedAt = now;
        return job;
    }

    public void startProcessing(Instant deadline, Instant now) {
        requireState(JobState.PENDING, "begin processing");
        this.state = JobState.PROCESSING;
        this.processingDeadline = deadline;
        this.updatedAt = now;
    }

    public void attachChallenge(String nonce, Instant now) {
        requireState(JobState.PROCESSING, "attach a possession challenge");
        this.challengeNonce = nonce;
        this.updatedAt = now;
    }

    /**
     * Records the accepted result and its proof. Both are write-once.
     */
    public void complete(String resultHash, String proofCircuitId, byte[] proof, List<String> publicInputs,
                         Instant now) {
        requireState(JobState.PROCESSING, "complete");
        if (this.proofBytes != null) {
            throw new InvalidTransitionException("Proof already attached to job " + id);
        }
        this.resultHash = resultHash;
        this.proofCircuitId = proofCircuitId;
        this.proofBytes = Base64.getEncoder().encodeToString(proof);
        this.proofPublicInputs = List.copyOf(publicInputs);
        this.state = JobState.COMPLETED;
        this.updatedAt = now;
    }

    public void fail(RejectionReason reason, String detail, Instant now) {
        if (state != JobState.PENDING && state != JobState.PROCESSING) {
            throw new InvalidTransitionException("Cannot fail job " + id + " in state " + state);
        }
        this.failureReason = reason;
        this.failureDetail = detail != null && detail.length() > 1024 ? detail.substring(0, 1024) : detail;
        this.state = JobState.FAILED;
        this.updatedAt = now;
    }

    public void markVerified(Instant now) {
        requireState(JobState.COMPLETED, "finalize");
        this.state = JobState.VERIFIED;
        this.updatedAt = now;
    }

    public boolean isProcessingOverdue(Instant now) {
        return state == JobState.PROCESSING && processingDeadline != null && !now.isBefore(processingDeadline);
    }

    public byte[] proofBytes() {
        return proofBytes != null ? Base64.getDecoder().decode(proofBytes) : null;
    }

    private void requireState(JobState expected, String action) {
        if (state != expected) {
            throw new InvalidTransitionException(
                    "Cannot " + action + " job " + id + " in state " + state + " (expected " + expected + ")");
        }
    }

    // Getters
    public Long getId() { return id; }
    public String getRequester() { return requester; }
    public String getDatasetHandle() { return datasetHandle; }
    public String getCategory() { return category; }
    public String getCircuitId() { return circuitId; }
    public BigDecimal getEpsilonRequested() { return epsilonRequested; }
    public String getMetadataHash() { return metadataHash; }
    public UUID getReservationId() { return reservationId; }
    public JobState getState() { return state; }
    public String getChallengeNonce() { return challengeNonce; }
    public Instant getProcessingDeadline() { return processingDeadline; }
    public String getResultHash() { return resultHash; }
    public String getProofCircuitId() { return proofCircuitId; }
    public List<String> getProofPublicInputs() { return proofPublicInputs; }
    public RejectionReason getFailureReason() { return failureReason; }
    public String getFailureDetail() { return failureDetail; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    /**
     * Thrown when a transition is attempted from a state that does not allow it.
     */
    public static class InvalidTransitionException extends RuntimeException {
        public InvalidTransitionException(String message) {
            super(message);
        }
    }
}
