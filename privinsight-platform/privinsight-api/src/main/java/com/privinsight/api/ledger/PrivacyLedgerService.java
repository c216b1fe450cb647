package com.privinsight.api.ledger;

import com.privinsight.api.ledger.LedgerException.LedgerFailure;
import com.privinsight.core.domain.BudgetReservation;
import com.privinsight.core.domain.BudgetReservation.ReservationStatus;
import com.privinsight.core.domain.PrivacyLedgerEntry;
import com.privinsight.core.domain.PrivacyLedgerEntry.ResetNotDueException;
import com.privinsight.core.repository.BudgetReservationRepository;
import com.privinsight.core.repository.PrivacyLedgerEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Privacy Ledger: per-category differential-privacy budgets.
 *
 * Budget is reserved at admission and only consumed on commit, so a job that
 * later fails hands its reservation back. Reservation is the single operation
 * that must be mutually exclusive per category: it runs under a per-category
 * lock around its own transaction, and the ledger row is also locked in the
 * database for deployments with more than one instance.
 */
@Service
public class PrivacyLedgerService {

    private static final Logger log = LoggerFactory.getLogger(PrivacyLedgerService.class);

    private final PrivacyLedgerEntryRepository entryRepository;
    private final BudgetReservationRepository reservationRepository;
    private final PrivacyLedgerConfig config;
    private final Clock clock;
    private final TransactionTemplate reservationTransaction;
    private final Map<String, ReentrantLock> categoryLocks = new ConcurrentHashMap<>();

    public PrivacyLedgerService(
            PrivacyLedgerEntryRepository entryRepository,
            BudgetReservationRepository reservationRepository,
            PrivacyLedgerConfig config,
            Clock clock,
            PlatformTransactionManager transactionManager) {
        this.entryRepository = entryRepository;
        this.reservationRepository = reservationRepository;
        this.config = config;
        this.clock = clock;
        this.reservationTransaction = new TransactionTemplate(transactionManager);
        this.reservationTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    // ==================== Ledger entries ====================

    /**
     * Opens the ledger for a category. Returns the existing entry if already open.
     */
    @Transactional
    public PrivacyLedgerEntry openLedger(String category, BigDecimal limit) {
        Objects.requireNonNull(category, "Category cannot be null");
        BigDecimal normalized = Epsilons.normalize(limit);
        Optional<PrivacyLedgerEntry> existing = entryRepository.findById(category);
        if (existing.isPresent()) {
            return existing.get();
        }
        Instant now = clock.instant();
        PrivacyLedgerEntry entry = PrivacyLedgerEntry.open(category, normalized, now.plus(config.getResetPeriod()), now);
        log.info("Opened privacy ledger for {} with limit {} (reset at {})", category, normalized, entry.getResetAt());
        return entryRepository.save(entry);
    }

    /**
     * Changes a category's limit.
     *
     * @throws LedgerException LIMIT_BELOW_USAGE if consumed + reserved already exceeds the new limit
     */
    @Transactional
    public PrivacyLedgerEntry adjustLimit(String category, BigDecimal newLimit) {
        BigDecimal normalized = Epsilons.normalize(newLimit);
        PrivacyLedgerEntry entry = requireEntryForUpdate(category);
        try {
            entry.adjustLimit(normalized, clock.instant());
        } catch (IllegalStateException e) {
            throw new LedgerException(LedgerFailure.LIMIT_BELOW_USAGE, e.getMessage());
        }
        log.info("Adjusted privacy budget limit for {} to {}", category, normalized);
        return entryRepository.save(entry);
    }

    // ==================== Reservation ====================

    /**
     * Atomically checks the remaining budget and places a provisional hold.
     * Two concurrent calls for one category never both succeed when their
     * combined epsilon exceeds what remains.
     *
     * @throws IllegalArgumentException for a null, non-positive or over-precise epsilon
     */
    public ReservationResult checkAndReserve(String category, BigDecimal epsilon) {
        Objects.requireNonNull(category, "Category cannot be null");
        BigDecimal amount = Epsilons.normalize(epsilon);

        ReentrantLock lock = categoryLocks.computeIfAbsent(category, k -> new ReentrantLock());
        lock.lock();
        try {
            return reservationTransaction.execute(status -> reserveLocked(category, amount));
        } finally {
            lock.unlock();
        }
    }

    private ReservationResult reserveLocked(String category, BigDecimal amount) {
        Optional<PrivacyLedgerEntry> found = entryRepository.findByCategoryForUpdate(category);
        if (found.isEmpty()) {
            return new ReservationResult(ReservationOutcome.UNKNOWN_CATEGORY, null, null,
                    "No privacy ledger for category " + category);
        }
        PrivacyLedgerEntry entry = found.get();
        if (!entry.canReserve(amount)) {
            log.warn("Insufficient privacy budget for {}: requested {}, remaining {}",
                    category, amount, entry.remaining());
            return new ReservationResult(ReservationOutcome.INSUFFICIENT_BUDGET, null, entry.remaining(),
                    "Insufficient budget: requested " + amount + ", remaining " + entry.remaining());
        }

        Instant now = clock.instant();
        entry.hold(amount, now);
        entryRepository.save(entry);
        BudgetReservation reservation = reservationRepository.save(BudgetReservation.hold(category, amount, now));

        log.info("Reserved {} epsilon in {} (reservation {}, remaining {})",
                amount, category, reservation.getId(), entry.remaining());
        return new ReservationResult(ReservationOutcome.RESERVED, reservation.getId(), entry.remaining(),
                "Reserved");
    }

    @Transactional
    public BudgetReservation attachJob(UUID reservationId, Long jobId) {
        BudgetReservation reservation = requireReservationForUpdate(reservationId);
        reservation.attachJob(jobId);
        return reservationRepository.save(reservation);
    }

    /**
     * Turns a held reservation into consumed budget. Committing an already
     * committed reservation is a no-op.
     *
     * @throws LedgerException RESERVATION_NOT_HELD if the reservation was released
     */
    @Transactional
    public BudgetReservation commit(UUID reservationId) {
        BudgetReservation reservation = requireReservationForUpdate(reservationId);
        if (reservation.getStatus() == ReservationStatus.COMMITTED) {
            return reservation;
        }
        if (reservation.getStatus() == ReservationStatus.RELEASED) {
            throw new LedgerException(LedgerFailure.RESERVATION_NOT_HELD,
                    "Reservation " + reservationId + " was released and cannot be committed");
        }

        PrivacyLedgerEntry entry = requireEntryForUpdate(reservation.getCategory());
        BigDecimal utilizationBefore = entry.utilization();
        Instant now = clock.instant();

        entry.commitHeld(reservation.getEpsilon(), now);
        reservation.markCommitted(now);
        entryRepository.save(entry);
        BudgetReservation saved = reservationRepository.save(reservation);

        log.info("Committed {} epsilon in {} (reservation {}, consumed {}/{})",
                reservation.getEpsilon(), entry.getCategory(), reservationId,
                entry.getConsumed(), entry.getEpsilonLimit());

        BigDecimal threshold = config.getUtilizationWarningThreshold();
        if (utilizationBefore.compareTo(threshold) < 0 && entry.utilization().compareTo(threshold) >= 0) {
            log.warn("Privacy budget for {} is {}% used", entry.getCategory(),
                    entry.utilization().movePointRight(2).stripTrailingZeros().toPlainString());
        }
        return saved;
    }

    /**
     * Returns a held reservation to the budget.
     *
     * @return false if the reservation was already released
     * @throws LedgerException RESERVATION_NOT_HELD if the reservation was committed
     */
    @Transactional
    public boolean release(UUID reservationId) {
        BudgetReservation reservation = requireReservationForUpdate(reservationId);
        if (reservation.getStatus() == ReservationStatus.RELEASED) {
            return false;
        }
        if (reservation.getStatus() == ReservationStatus.COMMITTED) {
            throw new LedgerException(LedgerFailure.RESERVATION_NOT_HELD,
                    "Reservation " + reservationId + " is already committed");
        }

        PrivacyLedgerEntry entry = requireEntryForUpdate(reservation.getCategory());
        Instant now = clock.instant();
        entry.releaseHeld(reservation.getEpsilon(), now);
        reservation.markReleased(now);
        entryRepository.save(entry);
        reservationRepository.save(reservation);

        log.info("Released {} epsilon in {} (reservation {}, remaining {})",
                reservation.getEpsilon(), entry.getCategory(), reservationId, entry.remaining());
        return true;
    }

    // ==================== Period reset ====================

    /**
     * Starts a new accounting period once {@code resetAt} has been reached.
     *
     * @throws LedgerException RESET_NOT_DUE before {@code resetAt}
     */
    @Transactional
    public PrivacyLedgerEntry resetPeriod(String category) {
        PrivacyLedgerEntry entry = requireEntryForUpdate(category);
        BigDecimal consumedBefore = entry.getConsumed();
        try {
            entry.reset(config.getResetPeriod(), clock.instant());
        } catch (ResetNotDueException e) {
            throw new LedgerException(LedgerFailure.RESET_NOT_DUE, e.getMessage());
        }
        log.info("Reset privacy budget for {} (consumed was {}, next reset {})",
                category, consumedBefore, entry.getResetAt());
        return entryRepository.save(entry);
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public BudgetStatus getBudgetStatus(String category) {
        PrivacyLedgerEntry entry = entryRepository.findById(category)
                .orElseThrow(() -> unknownCategory(category));
        BigDecimal utilization = entry.utilization();
        return new BudgetStatus(
                entry.getCategory(),
                entry.getConsumed(),
                entry.getReserved(),
                entry.getEpsilonLimit(),
                entry.remaining(),
                utilization,
                entry.getResetAt(),
                utilization.compareTo(config.getUtilizationWarningThreshold()) >= 0
        );
    }

    public Optional<BudgetReservation> getReservation(UUID reservationId) {
        return reservationRepository.findById(reservationId);
    }

    public boolean hasLedger(String category) {
        return entryRepository.existsById(category);
    }

    public BigDecimal totalConsumed() {
        return Objects.requireNonNullElse(entryRepository.sumConsumed(), BigDecimal.ZERO);
    }

    public BigDecimal totalReserved() {
        return Objects.requireNonNullElse(entryRepository.sumReserved(), BigDecimal.ZERO);
    }

    private PrivacyLedgerEntry requireEntryForUpdate(String category) {
        return entryRepository.findByCategoryForUpdate(category)
                .orElseThrow(() -> unknownCategory(category));
    }

    private BudgetReservation requireReservationForUpdate(UUID reservationId) {
        Objects.requireNonNull(reservationId, "Reservation ID cannot be null");
        return reservationRepository.findByIdForUpdate(reservationId)
                .orElseThrow(() -> new LedgerException(LedgerFailure.RESERVATION_NOT_FOUND,
                        "Reservation not found: " + reservationId));
    }

    private static LedgerException unknownCategory(String category) {
        return new LedgerException(LedgerFailure.UNKNOWN_CATEGORY, "No privacy ledger for category " + category);
    }

    // ==================== Inner Types ====================

    public enum ReservationOutcome { RESERVED, INSUFFICIENT_BUDGET, UNKNOWN_CATEGORY }

    public record ReservationResult(
            ReservationOutcome outcome,
            UUID reservationId,
            BigDecimal remaining,
            String message
    ) {
        public boolean reserved() {
            return outcome == ReservationOutcome.RESERVED;
        }
    }

    public record BudgetStatus(
            String category,
            BigDecimal consumed,
            BigDecimal reserved,
            BigDecimal limit,
            BigDecimal remaining,
            BigDecimal utilization,
            Instant resetAt,
            boolean nearLimit
    ) {}
}
