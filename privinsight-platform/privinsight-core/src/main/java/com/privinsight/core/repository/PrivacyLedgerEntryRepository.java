package com.privinsight.core.repository;

import com.privinsight.core.domain.PrivacyLedgerEntry;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for per-category privacy ledger entries.
 */
@Repository
public interface PrivacyLedgerEntryRepository extends JpaRepository<PrivacyLedgerEntry, String> {

    /**
     * Loads the entry with a row lock; every mutation of consumed/reserved goes through this.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM PrivacyLedgerEntry e WHERE e.category = :category")
    Optional<PrivacyLedgerEntry> findByCategoryForUpdate(@Param("category") String category);

    @Query("SELECT e FROM PrivacyLedgerEntry e WHERE e.resetAt <= :now")
    List<PrivacyLedgerEntry> findDueForReset(@Param("now") Instant now);

    @Query("SELECT SUM(e.consumed) FROM PrivacyLedgerEntry e")
    BigDecimal sumConsumed();

    @Query("SELECT SUM(e.reserved) FROM PrivacyLedgerEntry e")
    BigDecimal sumReserved();
}
