package com.privinsight.api.possession;

import com.privinsight.api.possession.PossessionException.PossessionFailure;
import com.privinsight.core.domain.PossessionChallenge;
import com.privinsight.core.domain.PossessionChallenge.ChallengeStatus;
import com.privinsight.core.domain.StoredDataset;
import com.privinsight.core.repository.PossessionChallengeRepository;
import com.privinsight.core.repository.StoredDatasetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;

/**
 * Possession store: registers content-addressed datasets with a storage
 * deadline and runs single-use proof-of-possession challenges against them.
 */
@Service
public class PossessionStoreService {

    private static final Logger log = LoggerFactory.getLogger(PossessionStoreService.class);
    private static final int NONCE_LENGTH = 32;
    private static final BigDecimal BYTES_PER_GB = BigDecimal.valueOf(1024L * 1024 * 1024);
    private static final BigDecimal HOURS_PER_MONTH = BigDecimal.valueOf(30L * 24);

    private final StoredDatasetRepository datasetRepository;
    private final PossessionChallengeRepository challengeRepository;
    private final ContentStore contentStore;
    private final PossessionProofVerifier proofVerifier;
    private final PossessionStoreConfig config;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public PossessionStoreService(
            StoredDatasetRepository datasetRepository,
            PossessionChallengeRepository challengeRepository,
            ContentStore contentStore,
            PossessionProofVerifier proofVerifier,
            PossessionStoreConfig config,
            Clock clock) {
        this.datasetRepository = datasetRepository;
        this.challengeRepository = challengeRepository;
        this.contentStore = contentStore;
        this.proofVerifier = proofVerifier;
        this.config = config;
        this.clock = clock;
    }

    // ==================== Storage ====================

    /**
     * Registers a dataset for the given duration.
     * A lapsed registration under the same handle is restored with its history intact.
     *
     * @throws PossessionException ALREADY_EXISTS or SIZE_EXCEEDS_LIMIT
     */
    @Transactional
    public StoredDataset store(DatasetHandle handle, long size, Duration duration) {
        Objects.requireNonNull(handle, "Dataset handle cannot be null");
        Objects.requireNonNull(duration, "Duration cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("Size cannot be negative");
        }
        if (size > config.getMaxDatasetSizeBytes()) {
            throw new PossessionException(PossessionFailure.SIZE_EXCEEDS_LIMIT,
                    "Dataset size " + size + " exceeds limit " + config.getMaxDatasetSizeBytes());
        }

        Instant now = clock.instant();
        var existing = datasetRepository.findByHandleForUpdate(handle.contentHash());
        if (existing.isPresent()) {
            StoredDataset dataset = existing.get();
            if (dataset.isActive(now)) {
                throw new PossessionException(PossessionFailure.ALREADY_EXISTS,
                        "Dataset already stored: " + handle.contentHash());
            }
            dataset.restore(duration, now);
            log.info("Restored lapsed dataset {} until {}", dataset.getContentHash(), dataset.getExpiresAt());
            return datasetRepository.save(dataset);
        }

        StoredDataset dataset = StoredDataset.register(
                handle.contentHash(), handle.owner(), size, handle.encryptionMetadataHash(), duration, now);
        try {
            StoredDataset saved = datasetRepository.saveAndFlush(dataset);
            log.info("Stored dataset {} ({} bytes) until {}", saved.getContentHash(), size, saved.getExpiresAt());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new PossessionException(PossessionFailure.ALREADY_EXISTS,
                    "Dataset already stored: " + handle.contentHash());
        }
    }

    /**
     * Puts encrypted bytes into the content store, pins them and registers the resulting handle.
     */
    @Transactional
    public StoredDataset storeContent(String owner, byte[] encryptedBytes, String encryptionMetadataHash,
                                      Duration duration) {
        Objects.requireNonNull(encryptedBytes, "Content cannot be null");
        if (encryptedBytes.length > config.getMaxDatasetSizeBytes()) {
            throw new PossessionException(PossessionFailure.SIZE_EXCEEDS_LIMIT,
                    "Dataset size " + encryptedBytes.length + " exceeds limit " + config.getMaxDatasetSizeBytes());
        }
        String contentHash = contentStore.put(encryptedBytes);
        contentStore.pin(contentHash);

        StoredDataset dataset = store(new DatasetHandle(contentHash, owner, encryptionMetadataHash),
                encryptedBytes.length, duration);
        dataset.markPinned();
        return datasetRepository.save(dataset);
    }

    public boolean isActive(String handle) {
        return datasetRepository.findById(handle)
                .map(d -> d.isActive(clock.instant()))
                .orElse(false);
    }

    /**
     * Extends the storage deadline. Past challenge history is kept.
     */
    @Transactional
    public StoredDataset renew(String handle, Duration extraDuration) {
        StoredDataset dataset = datasetRepository.findByHandleForUpdate(handle)
                .orElseThrow(() -> notFound(handle));
        dataset.renew(extraDuration, clock.instant());
        log.info("Renewed dataset {} until {}", handle, dataset.getExpiresAt());
        return datasetRepository.save(dataset);
    }

    /**
     * Reads dataset bytes.
     *
     * @throws PossessionException STORAGE_EXPIRED once the deadline has passed
     */
    @Transactional(readOnly = true)
    public byte[] read(String handle) {
        StoredDataset dataset = requireActive(handle);
        return contentStore.get(dataset.getContentHash())
                .orElseThrow(() -> new PossessionException(PossessionFailure.DATASET_NOT_FOUND,
                        "No content held for dataset: " + handle));
    }

    // ==================== Challenges ====================

    /**
     * Issues a fresh single-use challenge.
     *
     * @throws PossessionException STORAGE_EXPIRED or DATASET_NOT_FOUND
     */
    @Transactional
    public PossessionChallenge issueChallenge(String handle) {
        requireActive(handle);
        Instant now = clock.instant();
        PossessionChallenge challenge = PossessionChallenge.issue(
                generateNonce(), handle, now, now.plus(config.getChallengeTtl()));
        PossessionChallenge saved = challengeRepository.save(challenge);
        log.debug("Issued possession challenge for dataset {}", handle);
        return saved;
    }

    /**
     * Verifies a challenge answer. The nonce is consumed together with the
     * recorded outcome, so a second answer for it always fails.
     *
     * @return whether the proof verified
     * @throws PossessionException CHALLENGE_ALREADY_ANSWERED on replay
     */
    @Transactional
    public boolean answerChallenge(String handle, String nonce, String proof) {
        Objects.requireNonNull(handle, "Dataset handle cannot be null");
        Objects.requireNonNull(nonce, "Nonce cannot be null");

        PossessionChallenge challenge = challengeRepository.findByNonceForUpdate(nonce)
                .filter(c -> c.getDatasetHandle().equals(handle))
                .orElseThrow(() -> new PossessionException(PossessionFailure.CHALLENGE_NOT_FOUND,
                        "No challenge " + nonce + " for dataset " + handle));

        if (challenge.isAnswered()) {
            log.warn("Replayed possession challenge nonce for dataset {}", handle);
            throw new PossessionException(PossessionFailure.CHALLENGE_ALREADY_ANSWERED,
                    "Challenge already answered: " + nonce);
        }
        if (challenge.getStatus() == ChallengeStatus.INVALIDATED) {
            throw new PossessionException(PossessionFailure.CHALLENGE_INVALIDATED,
                    "Challenge was invalidated: " + nonce);
        }
        Instant now = clock.instant();
        if (challenge.isExpired(now)) {
            throw new PossessionException(PossessionFailure.CHALLENGE_EXPIRED,
                    "Challenge expired at " + challenge.getExpiresAt());
        }

        boolean verified = safeVerify(proof, nonce, handle);
        challenge.recordAnswer(proof, verified, now);
        challengeRepository.save(challenge);

        datasetRepository.findByHandleForUpdate(handle).ifPresent(dataset -> {
            dataset.recordChallengeOutcome(verified);
            datasetRepository.save(dataset);
        });

        if (!verified) {
            log.warn("Possession proof rejected for dataset {}", handle);
        }
        return verified;
    }

    /**
     * Closes an open challenge without answering it.
     *
     * @return true if the challenge was open
     */
    @Transactional
    public boolean invalidateChallenge(String nonce) {
        return challengeRepository.findByNonceForUpdate(nonce)
                .filter(PossessionChallenge::isOpen)
                .map(challenge -> {
                    challenge.invalidate(clock.instant());
                    challengeRepository.save(challenge);
                    return true;
                })
                .orElse(false);
    }

    // ==================== Statistics ====================

    @Transactional(readOnly = true)
    public StorageStats getStorageStats(String handle) {
        StoredDataset dataset = datasetRepository.findById(handle).orElseThrow(() -> notFound(handle));
        long open = challengeRepository.countByDatasetHandleAndStatus(handle, ChallengeStatus.OPEN);
        return new StorageStats(
                dataset.getContentHash(),
                dataset.getOwner(),
                dataset.getSizeBytes(),
                dataset.getStoredAt(),
                dataset.getExpiresAt(),
                dataset.isActive(clock.instant()),
                dataset.isPinned(),
                dataset.getChallengesPassed(),
                dataset.getChallengesFailed(),
                open,
                dataset.getRenewalCount()
        );
    }

    /**
     * Estimated storage cost: price per GB-month x GB x months (30-day months).
     */
    public BigDecimal estimateStorageCost(long sizeBytes, Duration duration) {
        if (sizeBytes < 0 || duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("Size and duration must be non-negative");
        }
        BigDecimal gigabytes = BigDecimal.valueOf(sizeBytes).divide(BYTES_PER_GB, 12, RoundingMode.HALF_UP);
        BigDecimal months = BigDecimal.valueOf(duration.toHours()).divide(HOURS_PER_MONTH, 12, RoundingMode.HALF_UP);
        return config.getPricePerGbMonth().multiply(gigabytes).multiply(months).setScale(8, RoundingMode.HALF_UP);
    }

    // ==================== Helpers ====================

    private StoredDataset requireActive(String handle) {
        StoredDataset dataset = datasetRepository.findById(handle).orElseThrow(() -> notFound(handle));
        if (!dataset.isActive(clock.instant())) {
            log.warn("Access to expired dataset {} (expired {})", handle, dataset.getExpiresAt());
            throw new PossessionException(PossessionFailure.STORAGE_EXPIRED,
                    "Storage expired for dataset " + handle + " at " + dataset.getExpiresAt());
        }
        return dataset;
    }

    private boolean safeVerify(String proof, String nonce, String handle) {
        try {
            return proofVerifier.verify(proof, nonce, handle);
        } catch (RuntimeException e) {
            log.warn("Possession verifier failed for dataset {}; treating proof as invalid", handle, e);
            return false;
        }
    }

    private String generateNonce() {
        byte[] nonceBytes = new byte[NONCE_LENGTH];
        secureRandom.nextBytes(nonceBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(nonceBytes);
    }

    private static PossessionException notFound(String handle) {
        return new PossessionException(PossessionFailure.DATASET_NOT_FOUND, "Dataset not found: " + handle);
    }

    public record StorageStats(
            String handle,
            String owner,
            long sizeBytes,
            Instant storedAt,
            Instant expiresAt,
            boolean active,
            boolean pinned,
            long challengesPassed,
            long challengesFailed,
            long openChallenges,
            int renewalCount
    ) {}
}
