package com.privinsight.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Provisional budget hold created at job admission, later committed or released.
 */
@Entity
@Table(name = "budget_reservations", indexes = {
    @Index(name = "idx_reservation_category", columnList = "category"),
    @Index(name = "idx_reservation_status", columnList = "status"),
    @Index(name = "idx_reservation_job", columnList = "job_id")
})
public class BudgetReservation {

    @Id
    private UUID id;

    @NotNull
    @Column(name = "category", nullable = false, length = 64)
    private String category;

    @NotNull
    @Column(name = "epsilon", nullable = false, precision = 19, scale = 6)
    private BigDecimal epsilon;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "job_id")
    private Long jobId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "settled_at")
    private Instant settledAt;

    @Version
    private Long version;

    public enum ReservationStatus {
        HELD,
        COMMITTED,
        RELEASED
    }

    protected BudgetReservation() {}

    public static BudgetReservation hold(String category, BigDecimal epsilon, Instant now) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category cannot be null or blank");
        }
        if (epsilon == null || epsilon.signum() <= 0) {
            throw new IllegalArgumentException("Epsilon must be positive");
        }
        BudgetReservation reservation = new BudgetReservation();
        reservation.id = UUID.randomUUID();
        reservation.category = category;
        reservation.epsilon = epsilon;
        reservation.status = ReservationStatus.HELD;
        reservation.createdAt = now;
        return reservation;
    }

    public void attachJob(Long jobId) {
        if (this.jobId != null && !this.jobId.equals(jobId)) {
            throw new IllegalStateException("Reservation " + id + " already belongs to job " + this.jobId);
        }
        this.jobId = jobId;
    }

    public void markCommitted(Instant now) {
        if (status != ReservationStatus.HELD) {
            throw new IllegalStateException("Reservation " + id + " is not held: " + status);
        }
        this.status = ReservationStatus.COMMITTED;
        this.settledAt = now;
    }

    public void markReleased(Instant now) {
        if (status != ReservationStatus.HELD) {
            throw new IllegalStateException("Reservation " + id + " is not held: " + status);
        }
        this.status = ReservationStatus.RELEASED;
        this.settledAt = now;
    }

    public boolean isHeld() {
        return status == ReservationStatus.HELD;
    }

    // Getters
    public UUID getId() { return id; }
    public String getCategory() { return category; }
    public BigDecimal getEpsilon() { return epsilon; }
    public ReservationStatus getStatus() { return status; }
    public Long getJobId() { return jobId; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getSettledAt() { return settledAt; }
}
