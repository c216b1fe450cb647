package com.privinsight.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-category differential-privacy budget.
 *
 * Tracks committed consumption and provisional holds separately so that
 * {@code consumed + reserved <= limit} always holds and a release returns
 * the exact amount it took.
 */
@Entity
@Table(name = "privacy_ledger_entries")
public class PrivacyLedgerEntry {

    @Id
    @Column(name = "category", length = 64)
    private String category;

    @NotNull
    @PositiveOrZero
    @Column(name = "consumed", nullable = false, precision = 19, scale = 6)
    private BigDecimal consumed;

    @NotNull
    @PositiveOrZero
    @Column(name = "reserved", nullable = false, precision = 19, scale = 6)
    private BigDecimal reserved;

    @NotNull
    @Column(name = "epsilon_limit", nullable = false, precision = 19, scale = 6)
    private BigDecimal epsilonLimit;

    @NotNull
    @Column(name = "reset_at", nullable = false)
    private Instant resetAt;

    @Column(name = "last_reset_at")
    private Instant lastResetAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    protected PrivacyLedgerEntry() {}

    public static PrivacyLedgerEntry open(String category, BigDecimal limit, Instant resetAt, Instant now) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category cannot be null or blank");
        }
        if (limit == null || limit.signum() <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        if (resetAt == null || !resetAt.isAfter(now)) {
            throw new IllegalArgumentException("Reset time must be in the future");
        }
        PrivacyLedgerEntry entry = new PrivacyLedgerEntry();
        entry.category = category;
        entry.consumed = BigDecimal.ZERO;
        entry.reserved = BigDecimal.ZERO;
        entry.epsilonLimit = limit;
        entry.resetAt = resetAt;
        entry.createdAt = now;
        entry.updatedAt = now;
        return entry;
    }

    public BigDecimal remaining() {
        return epsilonLimit.subtract(consumed).subtract(reserved);
    }

    public boolean canReserve(BigDecimal epsilon) {
        return epsilon != null && epsilon.signum() > 0 && epsilon.compareTo(remaining()) <= 0;
    }

    /**
     * Places a provisional hold.
     *
     * @throws InsufficientBudgetException if the hold would exceed the limit
     */
    public void hold(BigDecimal epsilon, Instant now) {
        requirePositive(epsilon);
        if (!canReserve(epsilon)) {
            throw new InsufficientBudgetException(
                    "Insufficient budget for " + category + ". Requested: " + epsilon + ", Remaining: " + remaining());
        }
        this.reserved = reserved.add(epsilon);
        this.updatedAt = now;
    }

    /**
     * Converts a hold into committed consumption.
     */
    public void commitHeld(BigDecimal epsilon, Instant now) {
        requirePositive(epsilon);
        if (epsilon.compareTo(reserved) > 0) {
            throw new IllegalStateException("Commit exceeds reserved amount for " + category);
        }
        this.reserved = reserved.subtract(epsilon);
        this.consumed = consumed.add(epsilon);
        this.updatedAt = now;
    }

    public void releaseHeld(BigDecimal epsilon, Instant now) {
        requirePositive(epsilon);
        if (epsilon.compareTo(reserved) > 0) {
            throw new IllegalStateException("Release exceeds reserved amount for " + category);
        }
        this.reserved = reserved.subtract(epsilon);
        this.updatedAt = now;
    }

    /**
     * Starts a new accounting period. Held reservations carry over.
     *
     * @throws ResetNotDueException if called before {@code resetAt}
     */
    public void reset(Duration period, Instant now) {
        if (period == null || period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("Reset period must be positive");
        }
        if (now.isBefore(resetAt)) {
            throw new ResetNotDueException("Reset for " + category + " not due until " + resetAt);
        }
        this.consumed = BigDecimal.ZERO;
        while (!resetAt.isAfter(now)) {
            this.resetAt = resetAt.plus(period);
        }
        this.lastResetAt = now;
        this.updatedAt = now;
    }

    public void adjustLimit(BigDecimal newLimit, Instant now) {
        if (newLimit == null || newLimit.signum() <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        if (newLimit.compareTo(consumed.add(reserved)) < 0) {
            throw new IllegalStateException(
                    "Limit " + newLimit + " is below current usage " + consumed.add(reserved) + " for " + category);
        }
        this.epsilonLimit = newLimit;
        this.updatedAt = now;
    }

    public BigDecimal utilization() {
        return consumed.divide(epsilonLimit, 4, RoundingMode.HALF_UP);
    }

    private static void requirePositive(BigDecimal epsilon) {
        if (epsilon == null || epsilon.signum() <= 0) {
            throw new IllegalArgumentException("Epsilon must be positive");
        }
    }

    // Getters
    public String getCategory() { return category; }
    public BigDecimal getConsumed() { return consumed; }
    public BigDecimal getReserved() { return reserved; }
    public BigDecimal getEpsilonLimit() { return epsilonLimit; }
    public Instant getResetAt() { return resetAt; }
    public Instant getLastResetAt() { return lastResetAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public static class InsufficientBudgetException extends RuntimeException {
        public InsufficientBudgetException(String message) {
            super(message);
        }
    }

    public static class ResetNotDueException extends RuntimeException {
        public ResetNotDueException(String message) {
            super(message);
        }
    }
}
