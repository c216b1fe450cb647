package com.privinsight.core.domain;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Single-use semantics of possession challenges and dataset deadlines.
 */
class PossessionChallengePropertyTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @Property(tries = 100)
    @Label("An answered challenge can never be answered again, whatever the first outcome")
    void answeredChallengeIsSingleUse(
            @ForAll @AlphaChars @StringLength(min = 8, max = 64) String nonce,
            @ForAll boolean firstOutcome,
            @ForAll boolean secondOutcome) {

        PossessionChallenge challenge = PossessionChallenge.issue(nonce, "handle", T0, T0.plusSeconds(600));
        challenge.recordAnswer("proof-1", firstOutcome, T0.plusSeconds(1));

        assertThat(challenge.isAnswered()).isTrue();
        assertThat(challenge.getVerified()).isEqualTo(firstOutcome);
        assertThatThrownBy(() -> challenge.recordAnswer("proof-2", secondOutcome, T0.plusSeconds(2)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(challenge.getVerified())
                .as("replay must not overwrite the recorded outcome")
                .isEqualTo(firstOutcome);
        assertThat(challenge.getProof()).isEqualTo("proof-1");
    }

    @Example
    void invalidatedChallengeCannotBeAnswered() {
        PossessionChallenge challenge = PossessionChallenge.issue("nonce", "handle", T0, T0.plusSeconds(600));
        challenge.invalidate(T0.plusSeconds(5));

        assertThat(challenge.isOpen()).isFalse();
        assertThatThrownBy(() -> challenge.recordAnswer("proof", true, T0.plusSeconds(6)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Property(tries = 100)
    @Label("Renewal extends the deadline and keeps challenge history")
    void renewalExtendsDeadline(
            @ForAll @LongRange(min = 1, max = 10_000) long storeSeconds,
            @ForAll @LongRange(min = 1, max = 10_000) long extraSeconds,
            @ForAll @LongRange(min = 0, max = 20_000) long elapsedSeconds) {

        StoredDataset dataset = StoredDataset.register("hash", "owner", 1024, "meta",
                Duration.ofSeconds(storeSeconds), T0);
        dataset.recordChallengeOutcome(true);
        dataset.recordChallengeOutcome(false);

        Instant now = T0.plusSeconds(elapsedSeconds);
        Instant before = dataset.getExpiresAt();
        dataset.renew(Duration.ofSeconds(extraSeconds), now);

        assertThat(dataset.getExpiresAt()).isAfter(before);
        assertThat(dataset.isActive(now)).isTrue();
        assertThat(dataset.getChallengesPassed()).isEqualTo(1);
        assertThat(dataset.getChallengesFailed()).isEqualTo(1);
    }

    @Property(tries = 50)
    @Label("Storage is inactive from the deadline onwards")
    void inactiveFromDeadline(@ForAll @LongRange(min = 1, max = 100_000) long storeSeconds) {
        StoredDataset dataset = StoredDataset.register("hash", "owner", 1, null, Duration.ofSeconds(storeSeconds), T0);

        assertThat(dataset.isActive(T0.plusSeconds(storeSeconds - 1))).isTrue();
        assertThat(dataset.isActive(T0.plusSeconds(storeSeconds))).isFalse();
    }
}
