package com.privinsight.core.repository;

import com.privinsight.core.domain.StoredDataset;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface StoredDatasetRepository extends JpaRepository<StoredDataset, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM StoredDataset d WHERE d.contentHash = :handle")
    Optional<StoredDataset> findByHandleForUpdate(@Param("handle") String handle);

    List<StoredDataset> findByOwner(String owner);

    @Query("SELECT d FROM StoredDataset d WHERE d.expiresAt <= :now")
    List<StoredDataset> findExpired(@Param("now") Instant now);
}
