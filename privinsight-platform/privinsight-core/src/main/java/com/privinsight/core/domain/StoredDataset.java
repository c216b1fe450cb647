package com.privinsight.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Duration;
import java.time.Instant;

/**
 * A content-addressed encrypted dataset held by the possession store.
 *
 * The handle (content hash), owner, size and encryption-metadata hash are
 * fixed at registration. Only the storage deadline and challenge statistics
 * move afterwards.
 */
@Entity
@Table(name = "stored_datasets", indexes = {
    @Index(name = "idx_dataset_owner", columnList = "owner"),
    @Index(name = "idx_dataset_expires", columnList = "expires_at")
})
public class StoredDataset {

    @Id
    @Column(name = "content_hash", length = 128)
    private String contentHash;

    @NotNull
    @Column(name = "owner", nullable = false)
    private String owner;

    @PositiveOrZero
    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "encryption_metadata_hash", length = 128)
    private String encryptionMetadataHash;

    @NotNull
    @Column(name = "stored_at", nullable = false)
    private Instant storedAt;

    @NotNull
    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "pinned", nullable = false)
    private boolean pinned;

    @Column(name = "challenges_passed", nullable = false)
    private long challengesPassed;

    @Column(name = "challenges_failed", nullable = false)
    private long challengesFailed;

    @Column(name = "renewal_count", nullable = false)
    private int renewalCount;

    @Version
    private Long version;

    protected StoredDataset() {}

    public static StoredDataset register(String contentHash, String owner, long sizeBytes,
                                         String encryptionMetadataHash, Duration duration, Instant now) {
        if (contentHash == null || contentHash.isBlank()) {
            throw new IllegalArgumentException("Content hash cannot be null or blank");
        }
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("Owner cannot be null or blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("Size cannot be negative");
        }
        requirePositive(duration);

        StoredDataset dataset = new StoredDataset();
        dataset.contentHash = contentHash;
        dataset.owner = owner;
        dataset.sizeBytes = sizeBytes;
        dataset.encryptionMetadataHash = encryptionMetadataHash;
        dataset.storedAt = now;
        dataset.expiresAt = now.plus(duration);
        return dataset;
    }

    /**
     * Storage is active strictly before the deadline.
     */
    public boolean isActive(Instant now) {
        return now.isBefore(expiresAt);
    }

    /**
     * Extends the deadline. An already lapsed deadline is extended from now.
     * Challenge history is kept.
     */
    public void renew(Duration extra, Instant now) {
        requirePositive(extra);
        Instant base = expiresAt.isAfter(now) ? expiresAt : now;
        this.expiresAt = base.plus(extra);
        this.renewalCount++;
    }

    /**
     * Re-registers a lapsed dataset under the same handle.
     */
    public void restore(Duration duration, Instant now) {
        if (isActive(now)) {
            throw new IllegalStateException("Dataset is still active: " + contentHash);
        }
        requirePositive(duration);
        this.storedAt = now;
        this.expiresAt = now.plus(duration);
    }

    public void markPinned() {
        this.pinned = true;
    }

    public void recordChallengeOutcome(boolean passed) {
        if (passed) {
            challengesPassed++;
        } else {
            challengesFailed++;
        }
    }

    private static void requirePositive(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Duration must be positive");
        }
    }

    // Getters
    public String getContentHash() { return contentHash; }
    public String getOwner() { return owner; }
    public long getSizeBytes() { return sizeBytes; }
    public String getEncryptionMetadataHash() { return encryptionMetadataHash; }
    public Instant getStoredAt() { return storedAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public boolean isPinned() { return pinned; }
    public long getChallengesPassed() { return challengesPassed; }
    public long getChallengesFailed() { return challengesFailed; }
    public int getRenewalCount() { return renewalCount; }
}
