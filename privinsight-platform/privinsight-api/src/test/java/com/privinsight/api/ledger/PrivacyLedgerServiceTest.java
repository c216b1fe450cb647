package com.privinsight.api.ledger;

import com.privinsight.api.ledger.LedgerException.LedgerFailure;
import com.privinsight.api.ledger.PrivacyLedgerService.BudgetStatus;
import com.privinsight.api.ledger.PrivacyLedgerService.ReservationOutcome;
import com.privinsight.api.ledger.PrivacyLedgerService.ReservationResult;
import com.privinsight.api.support.PipelineIntegrationSupport;
import com.privinsight.core.domain.BudgetReservation.ReservationStatus;
import com.privinsight.core.domain.PrivacyLedgerEntry;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class PrivacyLedgerServiceTest extends PipelineIntegrationSupport {

    @Test
    void openLedgerIsIdempotent() {
        String category = unique("ledger");
        PrivacyLedgerEntry first = ledgerService.openLedger(category, new BigDecimal("5"));
        PrivacyLedgerEntry second = ledgerService.openLedger(category, new BigDecimal("99"));

        assertThat(second.getEpsilonLimit()).isEqualByComparingTo(first.getEpsilonLimit());
        assertThat(ledgerService.getBudgetStatus(category).limit()).isEqualByComparingTo("5");
    }

    @Test
    void reservationHoldsBudgetUntilCommitted() {
        String category = unique("ledger");
        ledgerService.openLedger(category, new BigDecimal("1.0"));

        ReservationResult reserved = ledgerService.checkAndReserve(category, new BigDecimal("0.4"));
        assertThat(reserved.reserved()).isTrue();
        assertThat(reserved.remaining()).isEqualByComparingTo("0.6");

        BudgetStatus held = ledgerService.getBudgetStatus(category);
        assertThat(held.reserved()).isEqualByComparingTo("0.4");
        assertThat(held.consumed()).isEqualByComparingTo("0");

        ledgerService.commit(reserved.reservationId());
        BudgetStatus committed = ledgerService.getBudgetStatus(category);
        assertThat(committed.reserved()).isEqualByComparingTo("0");
        assertThat(committed.consumed()).isEqualByComparingTo("0.4");
        assertThat(committed.remaining()).isEqualByComparingTo("0.6");
        assertThat(committed.utilization()).isEqualByComparingTo("0.4");

        // committing twice is a no-op
        ledgerService.commit(reserved.reservationId());
        assertThat(ledgerService.getBudgetStatus(category).consumed()).isEqualByComparingTo("0.4");
    }

    @Test
    void releaseRestoresBudgetAndIsSingleShot() {
        String category = unique("ledger");
        ledgerService.openLedger(category, new BigDecimal("2"));
        ReservationResult reserved = ledgerService.checkAndReserve(category, new BigDecimal("1.5"));

        assertThat(ledgerService.release(reserved.reservationId())).isTrue();
        assertThat(ledgerService.release(reserved.reservationId())).isFalse();
        assertThat(ledgerService.getBudgetStatus(category).remaining()).isEqualByComparingTo("2");
        assertThat(ledgerService.getReservation(reserved.reservationId()))
                .get()
                .extracting(r -> r.getStatus())
                .isEqualTo(ReservationStatus.RELEASED);

        assertThatThrownBy(() -> ledgerService.commit(reserved.reservationId()))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getFailure())
                .isEqualTo(LedgerFailure.RESERVATION_NOT_HELD);
    }

    @Test
    void reservationBeyondRemainingIsRejected() {
        String category = unique("ledger");
        ledgerService.openLedger(category, new BigDecimal("10"));

        assertThat(ledgerService.checkAndReserve(category, new BigDecimal("6")).reserved()).isTrue();
        ReservationResult second = ledgerService.checkAndReserve(category, new BigDecimal("5"));

        assertThat(second.outcome()).isEqualTo(ReservationOutcome.INSUFFICIENT_BUDGET);
        assertThat(second.reservationId()).isNull();
        assertThat(second.remaining()).isEqualByComparingTo("4");
    }

    @Test
    void unknownCategoryIsReportedNotThrown() {
        ReservationResult result = ledgerService.checkAndReserve(unique("missing"), BigDecimal.ONE);
        assertThat(result.outcome()).isEqualTo(ReservationOutcome.UNKNOWN_CATEGORY);
    }

    @Test
    void overPreciseEpsilonIsRejected() {
        String category = unique("ledger");
        ledgerService.openLedger(category, BigDecimal.ONE);

        assertThatThrownBy(() -> ledgerService.checkAndReserve(category, new BigDecimal("0.0000001")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledgerService.checkAndReserve(category, BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentReservationsNeverOverspend() throws Exception {
        String category = unique("ledger");
        ledgerService.openLedger(category, new BigDecimal("10"));

        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ReservationResult>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Callable<ReservationResult> attempt = () -> {
                    start.await();
                    return ledgerService.checkAndReserve(category, new BigDecimal("3"));
                };
                results.add(pool.submit(attempt));
            }
            start.countDown();

            int granted = 0;
            for (Future<ReservationResult> result : results) {
                if (result.get(30, TimeUnit.SECONDS).reserved()) {
                    granted++;
                }
            }
            assertThat(granted).isEqualTo(3);
        } finally {
            pool.shutdownNow();
        }

        BudgetStatus status = ledgerService.getBudgetStatus(category);
        assertThat(status.reserved()).isEqualByComparingTo("9");
        assertThat(status.remaining()).isEqualByComparingTo("1");
    }

    @Test
    void twoRacingReservationsForMoreThanTheLimitAdmitExactlyOne() throws Exception {
        String category = unique("ledger");
        ledgerService.openLedger(category, new BigDecimal("10"));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<ReservationResult> a = pool.submit(() -> {
                start.await();
                return ledgerService.checkAndReserve(category, new BigDecimal("6"));
            });
            Future<ReservationResult> b = pool.submit(() -> {
                start.await();
                return ledgerService.checkAndReserve(category, new BigDecimal("5"));
            });
            start.countDown();

            boolean aReserved = a.get(30, TimeUnit.SECONDS).reserved();
            boolean bReserved = b.get(30, TimeUnit.SECONDS).reserved();
            assertThat(aReserved ^ bReserved).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void resetIsRefusedBeforeDueAndKeepsHeldReservations() {
        String category = unique("ledger");
        ledgerService.openLedger(category, new BigDecimal("1"));
        ReservationResult committed = ledgerService.checkAndReserve(category, new BigDecimal("0.5"));
        ledgerService.commit(committed.reservationId());
        ReservationResult held = ledgerService.checkAndReserve(category, new BigDecimal("0.25"));

        assertThatThrownBy(() -> ledgerService.resetPeriod(category))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getFailure())
                .isEqualTo(LedgerFailure.RESET_NOT_DUE);

        clock.advance(Duration.ofDays(31));
        PrivacyLedgerEntry reset = ledgerService.resetPeriod(category);

        assertThat(reset.getConsumed()).isEqualByComparingTo("0");
        assertThat(reset.getReserved()).isEqualByComparingTo("0.25");
        assertThat(reset.getResetAt()).isAfter(clock.instant());

        // the held reservation still settles normally after the reset
        ledgerService.commit(held.reservationId());
        assertThat(ledgerService.getBudgetStatus(category).consumed()).isEqualByComparingTo("0.25");
    }

    @Test
    void limitCannotDropBelowUsage() {
        String category = unique("ledger");
        ledgerService.openLedger(category, new BigDecimal("5"));
        ledgerService.checkAndReserve(category, new BigDecimal("3"));

        assertThatThrownBy(() -> ledgerService.adjustLimit(category, new BigDecimal("2")))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getFailure())
                .isEqualTo(LedgerFailure.LIMIT_BELOW_USAGE);

        ledgerService.adjustLimit(category, new BigDecimal("8"));
        assertThat(ledgerService.getBudgetStatus(category).remaining()).isEqualByComparingTo("5");
    }

    @Test
    void nearLimitIsFlaggedAtEightyPercent() {
        String category = unique("ledger");
        ledgerService.openLedger(category, new BigDecimal("1"));
        ReservationResult reserved = ledgerService.checkAndReserve(category, new BigDecimal("0.8"));
        assertThat(ledgerService.getBudgetStatus(category).nearLimit()).isFalse();

        ledgerService.commit(reserved.reservationId());
        assertThat(ledgerService.getBudgetStatus(category).nearLimit()).isTrue();
    }
}
