package com.phillippitts.airplay.service.fingerprint;

import com.phillippitts.airplay.config.properties.FingerprintProperties;
import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.domain.FingerprintEntry;
import com.phillippitts.airplay.testutil.TestFingerprints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class InMemoryFingerprintStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private FingerprintProperties props;
    private InMemoryFingerprintStore store;

    @BeforeEach
    void setUp() {
        props = new FingerprintProperties();
        store = new InMemoryFingerprintStore(props);
    }

    @Test
    void exactDigestHitReturnsStoredConfidence() {
        AudioFingerprint fp = TestFingerprints.random(1);
        store.upsert(entry(fp, 10L, 0.92, T0));

        Optional<FingerprintMatch> match = store.lookup(fp);

        assertThat(match).hasValueSatisfying(m -> {
            assertThat(m.trackId()).isEqualTo(10L);
            assertThat(m.matchType()).isEqualTo(FingerprintMatch.MatchType.EXACT);
            assertThat(m.confidence()).isEqualTo(0.92);
            assertThat(m.similarity()).isEqualTo(1.0);
        });
    }

    @Test
    void nearDuplicateScalesConfidenceBySimilarity() {
        int[] raw = TestFingerprints.randomRaw(2, 200);
        store.upsert(entry(TestFingerprints.of(raw), 10L, 0.9, T0));
        AudioFingerprint noisy = TestFingerprints.of(TestFingerprints.withNoise(raw, 2));

        Optional<FingerprintMatch> match = store.lookup(noisy);

        assertThat(match).hasValueSatisfying(m -> {
            assertThat(m.matchType()).isEqualTo(FingerprintMatch.MatchType.SIMILAR);
            assertThat(m.similarity()).isCloseTo(1.0 - 2.0 / 32.0, within(1e-9));
            assertThat(m.confidence()).isCloseTo(0.9 * (1.0 - 2.0 / 32.0), within(1e-9));
        });
    }

    @Test
    void shiftedCaptureOfSameRecordingMatches() {
        int[] raw = TestFingerprints.randomRaw(3, 300);
        store.upsert(entry(TestFingerprints.of(raw), 10L, 0.9, T0));

        Optional<FingerprintMatch> match = store.lookup(TestFingerprints.of(Arrays.copyOfRange(raw, 12, 260)));

        assertThat(match).hasValueSatisfying(m -> assertThat(m.trackId()).isEqualTo(10L));
    }

    @Test
    void similarityBelowFloorIsMiss() {
        int[] raw = TestFingerprints.randomRaw(4, 200);
        store.upsert(entry(TestFingerprints.of(raw), 10L, 0.9, T0));

        // 8 of 32 bits flipped: 0.75 similarity, under the 0.85 floor
        assertThat(store.lookup(TestFingerprints.of(TestFingerprints.withNoise(raw, 8)))).isEmpty();
    }

    @Test
    void nearDuplicateSearchCanBeDisabled() {
        props.getSimilarity().setEnabled(false);
        int[] raw = TestFingerprints.randomRaw(5, 200);
        store.upsert(entry(TestFingerprints.of(raw), 10L, 0.9, T0));

        assertThat(store.lookup(TestFingerprints.of(TestFingerprints.withNoise(raw, 1)))).isEmpty();
    }

    @Test
    void unrelatedFingerprintIsMiss() {
        store.upsert(entry(TestFingerprints.random(6), 10L, 0.9, T0));

        assertThat(store.lookup(TestFingerprints.random(7))).isEmpty();
    }

    @Test
    void higherConfidenceReplacesLowerButNotViceVersa() {
        AudioFingerprint fp = TestFingerprints.random(8);
        store.upsert(entry(fp, 10L, 0.7, T0));

        FingerprintEntry held = store.upsert(entry(fp, 20L, 0.9, T0));
        FingerprintEntry kept = store.upsert(entry(fp, 30L, 0.8, T0.plusSeconds(60)));

        assertThat(held.trackId()).isEqualTo(20L);
        assertThat(kept.trackId()).isEqualTo(20L);
        assertThat(store.findByDigest(fp.digest())).hasValueSatisfying(e -> assertThat(e.trackId()).isEqualTo(20L));
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void equalConfidenceTieGoesToLaterVerification() {
        AudioFingerprint fp = TestFingerprints.random(9);
        store.upsert(entry(fp, 10L, 0.9, T0));

        FingerprintEntry held = store.upsert(entry(fp, 20L, 0.9, T0.plusSeconds(1)));

        assertThat(held.trackId()).isEqualTo(20L);
    }

    @Test
    void repointMovesEveryEntryOfTrack() {
        AudioFingerprint a = TestFingerprints.random(10);
        AudioFingerprint b = TestFingerprints.random(11);
        AudioFingerprint other = TestFingerprints.random(12);
        store.upsert(entry(a, 10L, 0.9, T0));
        store.upsert(entry(b, 10L, 0.9, T0));
        store.upsert(entry(other, 11L, 0.9, T0));

        int moved = store.repoint(10L, 99L);

        assertThat(moved).isEqualTo(2);
        assertThat(store.lookup(a)).hasValueSatisfying(m -> assertThat(m.trackId()).isEqualTo(99L));
        assertThat(store.lookup(b)).hasValueSatisfying(m -> assertThat(m.trackId()).isEqualTo(99L));
        assertThat(store.lookup(other)).hasValueSatisfying(m -> assertThat(m.trackId()).isEqualTo(11L));
        assertThat(store.repoint(10L, 99L)).isZero();
    }

    @Test
    void concurrentUpsertsOfSameDigestKeepOneWinner() throws Exception {
        AudioFingerprint fp = TestFingerprints.random(13);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int i = 0; i < 40; i++) {
                long trackId = i;
                double confidence = 0.5 + i / 100.0;
                pool.submit(() -> {
                    start.await();
                    store.upsert(entry(fp, trackId, confidence, T0));
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.findByDigest(fp.digest()))
                .hasValueSatisfying(e -> assertThat(e.trackId()).isEqualTo(39L));
    }

    private static FingerprintEntry entry(AudioFingerprint fp, long trackId, double confidence, Instant at) {
        return new FingerprintEntry(fp.digest(), fp.raw(), trackId, confidence, DetectionSource.FINGERPRINT_EXTERNAL, at);
    }
}
