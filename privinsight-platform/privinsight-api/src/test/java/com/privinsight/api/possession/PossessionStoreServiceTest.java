package com.privinsight.api.possession;

import com.privinsight.api.possession.PossessionException.PossessionFailure;
import com.privinsight.api.possession.PossessionStoreService.StorageStats;
import com.privinsight.api.support.PipelineIntegrationSupport;
import com.privinsight.core.domain.PossessionChallenge;
import com.privinsight.core.domain.StoredDataset;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class PossessionStoreServiceTest extends PipelineIntegrationSupport {

    @Autowired
    private PossessionProver prover;

    private static PossessionFailure failureOf(Throwable e) {
        return ((PossessionException) e).getFailure();
    }

    private StoredDataset storeRandom(Duration duration) {
        byte[] content = ("content " + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);
        return possessionStore.storeContent("alice", content, "meta-hash", duration);
    }

    @Test
    void storedDatasetIsActiveAndCannotBeStoredTwice() {
        DatasetHandle handle = new DatasetHandle(unique("hash"), "alice", null);
        possessionStore.store(handle, 1024, Duration.ofDays(30));

        assertThat(possessionStore.isActive(handle.contentHash())).isTrue();
        assertThatThrownBy(() -> possessionStore.store(handle, 1024, Duration.ofDays(30)))
                .isInstanceOf(PossessionException.class)
                .extracting(PossessionStoreServiceTest::failureOf)
                .isEqualTo(PossessionFailure.ALREADY_EXISTS);
    }

    @Test
    void oversizedDatasetIsRefused() {
        DatasetHandle handle = new DatasetHandle(unique("hash"), "alice", null);
        long tooLarge = 33L * 1024 * 1024 * 1024;

        assertThatThrownBy(() -> possessionStore.store(handle, tooLarge, Duration.ofDays(1)))
                .isInstanceOf(PossessionException.class)
                .extracting(PossessionStoreServiceTest::failureOf)
                .isEqualTo(PossessionFailure.SIZE_EXCEEDS_LIMIT);
        assertThat(possessionStore.isActive(handle.contentHash())).isFalse();
    }

    @Test
    void honestProverPassesAndTheNonceCannotBeReplayed() {
        String handle = storeRandom(LONG_STORAGE).getContentHash();
        PossessionChallenge challenge = possessionStore.issueChallenge(handle);
        String proof = prover.prove(handle, challenge.getNonce()).orElseThrow();

        assertThat(challenge.getNonce()).hasSize(43);
        assertThat(possessionStore.answerChallenge(handle, challenge.getNonce(), proof)).isTrue();
        assertThatThrownBy(() -> possessionStore.answerChallenge(handle, challenge.getNonce(), proof))
                .isInstanceOf(PossessionException.class)
                .extracting(PossessionStoreServiceTest::failureOf)
                .isEqualTo(PossessionFailure.CHALLENGE_ALREADY_ANSWERED);

        StorageStats stats = possessionStore.getStorageStats(handle);
        assertThat(stats.challengesPassed()).isEqualTo(1);
        assertThat(stats.challengesFailed()).isZero();
        assertThat(stats.pinned()).isTrue();
    }

    @Test
    void proofForAnotherNonceIsRejected() {
        String handle = storeRandom(LONG_STORAGE).getContentHash();
        PossessionChallenge first = possessionStore.issueChallenge(handle);
        PossessionChallenge second = possessionStore.issueChallenge(handle);
        String staleProof = prover.prove(handle, first.getNonce()).orElseThrow();

        assertThat(first.getNonce()).isNotEqualTo(second.getNonce());
        assertThat(possessionStore.answerChallenge(handle, second.getNonce(), staleProof)).isFalse();
        // a failed answer still consumes the nonce
        assertThatThrownBy(() -> possessionStore.answerChallenge(handle, second.getNonce(), "anything"))
                .isInstanceOf(PossessionException.class);
        assertThat(possessionStore.getStorageStats(handle).challengesFailed()).isEqualTo(1);
    }

    @Test
    void challengeForAnotherDatasetIsNotFound() {
        String handle = storeRandom(LONG_STORAGE).getContentHash();
        String other = storeRandom(LONG_STORAGE).getContentHash();
        PossessionChallenge challenge = possessionStore.issueChallenge(handle);

        assertThatThrownBy(() -> possessionStore.answerChallenge(other, challenge.getNonce(), "proof"))
                .isInstanceOf(PossessionException.class)
                .extracting(PossessionStoreServiceTest::failureOf)
                .isEqualTo(PossessionFailure.CHALLENGE_NOT_FOUND);
    }

    @Test
    void invalidatedChallengeCannotBeAnswered() {
        String handle = storeRandom(LONG_STORAGE).getContentHash();
        PossessionChallenge challenge = possessionStore.issueChallenge(handle);
        String proof = prover.prove(handle, challenge.getNonce()).orElseThrow();

        assertThat(possessionStore.invalidateChallenge(challenge.getNonce())).isTrue();
        assertThat(possessionStore.invalidateChallenge(challenge.getNonce())).isFalse();
        assertThatThrownBy(() -> possessionStore.answerChallenge(handle, challenge.getNonce(), proof))
                .isInstanceOf(PossessionException.class)
                .extracting(PossessionStoreServiceTest::failureOf)
                .isEqualTo(PossessionFailure.CHALLENGE_INVALIDATED);
    }

    @Test
    void challengeExpiresAfterItsTtl() {
        String handle = storeRandom(LONG_STORAGE).getContentHash();
        PossessionChallenge challenge = possessionStore.issueChallenge(handle);
        String proof = prover.prove(handle, challenge.getNonce()).orElseThrow();

        clock.advance(Duration.ofMinutes(11));

        assertThatThrownBy(() -> possessionStore.answerChallenge(handle, challenge.getNonce(), proof))
                .isInstanceOf(PossessionException.class)
                .extracting(PossessionStoreServiceTest::failureOf)
                .isEqualTo(PossessionFailure.CHALLENGE_EXPIRED);
    }

    @Test
    void expiredStorageRefusesAccessUntilRenewed() {
        String handle = storeRandom(Duration.ofHours(1)).getContentHash();
        clock.advance(Duration.ofHours(2));

        assertThat(possessionStore.isActive(handle)).isFalse();
        assertThatThrownBy(() -> possessionStore.issueChallenge(handle))
                .isInstanceOf(PossessionException.class)
                .extracting(PossessionStoreServiceTest::failureOf)
                .isEqualTo(PossessionFailure.STORAGE_EXPIRED);
        assertThatThrownBy(() -> possessionStore.read(handle))
                .isInstanceOf(PossessionException.class)
                .extracting(PossessionStoreServiceTest::failureOf)
                .isEqualTo(PossessionFailure.STORAGE_EXPIRED);

        StoredDataset renewed = possessionStore.renew(handle, Duration.ofDays(1));
        assertThat(renewed.getExpiresAt()).isAfter(clock.instant());
        assertThat(possessionStore.isActive(handle)).isTrue();
        assertThat(possessionStore.read(handle)).isNotEmpty();
    }

    @Test
    void lapsedDatasetCanBeStoredAgain() {
        DatasetHandle handle = new DatasetHandle(unique("hash"), "alice", null);
        possessionStore.store(handle, 10, Duration.ofHours(1));
        clock.advance(Duration.ofHours(2));

        StoredDataset restored = possessionStore.store(handle, 10, Duration.ofDays(1));
        assertThat(restored.isActive(clock.instant())).isTrue();
    }

    @Test
    void unknownDatasetIsNotFound() {
        assertThat(possessionStore.isActive(unique("nothing"))).isFalse();
        assertThatThrownBy(() -> possessionStore.issueChallenge(unique("nothing")))
                .isInstanceOf(PossessionException.class)
                .extracting(PossessionStoreServiceTest::failureOf)
                .isEqualTo(PossessionFailure.DATASET_NOT_FOUND);
    }

    @Test
    void storageCostScalesWithSizeAndDuration() {
        long oneGb = 1024L * 1024 * 1024;
        BigDecimal month = possessionStore.estimateStorageCost(oneGb, Duration.ofDays(30));
        BigDecimal twoMonthsTwoGb = possessionStore.estimateStorageCost(2 * oneGb, Duration.ofDays(60));

        assertThat(month).isEqualByComparingTo("0.02");
        assertThat(twoMonthsTwoGb).isEqualByComparingTo("0.08");
    }

    @Test
    void possessionDigestBindsNonceAndContent() {
        byte[] content = "exact bytes".getBytes(StandardCharsets.UTF_8);
        String nonce = Base64.getUrlEncoder().withoutPadding().encodeToString(new byte[32]);
        String first = ContentDigestPossessionVerifier.digest(nonce, content);
        String second = ContentDigestPossessionVerifier.digest(nonce, "other bytes".getBytes(StandardCharsets.UTF_8));

        assertThat(first).hasSize(64).isNotEqualTo(second);
    }
}
