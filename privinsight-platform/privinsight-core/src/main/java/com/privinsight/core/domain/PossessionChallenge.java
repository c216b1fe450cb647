package com.privinsight.core.domain;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Single-use possession challenge for a stored dataset.
 *
 * Once answered (verified or not) or invalidated the nonce can never
 * satisfy another access.
 */
@Entity
@Table(name = "possession_challenges", indexes = {
    @Index(name = "idx_challenge_dataset", columnList = "dataset_handle")
})
public class PossessionChallenge {

    @Id
    @Column(name = "nonce", length = 64)
    private String nonce;

    @Column(name = "dataset_handle", nullable = false, length = 128)
    private String datasetHandle;

    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "answered_at")
    private Instant answeredAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ChallengeStatus status;

    @Column(name = "verified")
    private Boolean verified;

    @Column(name = "proof", columnDefinition = "TEXT")
    private String proof;

    @Version
    private Long version;

    public enum ChallengeStatus {
        OPEN,
        ANSWERED,
        INVALIDATED
    }

    protected PossessionChallenge() {}

    public static PossessionChallenge issue(String nonce, String datasetHandle, Instant issuedAt, Instant expiresAt) {
        if (nonce == null || nonce.isBlank()) {
            throw new IllegalArgumentException("Nonce cannot be null or blank");
        }
        if (datasetHandle == null || datasetHandle.isBlank()) {
            throw new IllegalArgumentException("Dataset handle cannot be null or blank");
        }
        if (expiresAt == null || !expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("Expiry must be after issue time");
        }

        PossessionChallenge challenge = new PossessionChallenge();
        challenge.nonce = nonce;
        challenge.datasetHandle = datasetHandle;
        challenge.issuedAt = issuedAt;
        challenge.expiresAt = expiresAt;
        challenge.status = ChallengeStatus.OPEN;
        return challenge;
    }

    /**
     * Records the verification outcome and consumes the nonce in the same step.
     */
    public void recordAnswer(String proof, boolean verified, Instant now) {
        if (status != ChallengeStatus.OPEN) {
            throw new IllegalStateException("Challenge is no longer open: " + status);
        }
        this.proof = proof;
        this.verified = verified;
        this.answeredAt = now;
        this.status = ChallengeStatus.ANSWERED;
    }

    public void invalidate(Instant now) {
        if (status == ChallengeStatus.OPEN) {
            this.status = ChallengeStatus.INVALIDATED;
            this.answeredAt = now;
        }
    }

    public boolean isAnswered() {
        return status == ChallengeStatus.ANSWERED;
    }

    public boolean isOpen() {
        return status == ChallengeStatus.OPEN;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    // Getters
    public String getNonce() { return nonce; }
    public String getDatasetHandle() { return datasetHandle; }
    public Instant getIssuedAt() { return issuedAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public Instant getAnsweredAt() { return answeredAt; }
    public ChallengeStatus getStatus() { return status; }
    public Boolean getVerified() { return verified; }
    public String getProof() { return proof; }
}
