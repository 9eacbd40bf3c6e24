package com.phillippitts.airplay.service.orchestration;

import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.domain.FingerprintEntry;
import com.phillippitts.airplay.domain.Track;
import com.phillippitts.airplay.domain.TrackCandidate;
import com.phillippitts.airplay.exception.PersistenceUnavailableException;
import com.phillippitts.airplay.exception.PollDeadlineExceededException;
import com.phillippitts.airplay.service.adapter.RecognitionInput;
import com.phillippitts.airplay.service.adapter.RecognitionOutcome;
import com.phillippitts.airplay.testutil.PipelineFixture;
import com.phillippitts.airplay.testutil.TestFingerprints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultDetectionOrchestratorTest {

    private static final Instant AT = Instant.parse("2024-05-01T10:00:00Z");

    private PipelineFixture fx;
    private AudioFingerprint fingerprint;
    private RecognitionInput input;

    @BeforeEach
    void setUp() {
        fx = new PipelineFixture();
        fingerprint = TestFingerprints.random(7L);
        input = new RecognitionInput(TestFingerprints.segment(1L, "segment-a", AT), fingerprint,
                "Radio One", "Artist - Song");
    }

    @Test
    void localHitWinsWithoutCallingExternalServices() {
        // Arrange
        Track known = fx.registry.resolveOrCreate(TrackCandidate.of("Song", "Artist"), 0.9).track();
        fx.fingerprintStore.upsert(new FingerprintEntry(fingerprint.digest(), fingerprint.raw(), known.id(),
                0.9, DetectionSource.FULL_AUDIO_EXTERNAL, AT));

        // Act
        DetectionOutcome outcome = fx.orchestrator().resolve(input);

        // Assert
        assertThat(outcome.isResolved()).isTrue();
        assertThat(outcome.source()).isEqualTo(DetectionSource.LOCAL);
        assertThat(outcome.track().id()).isEqualTo(known.id());
        assertThat(outcome.trackCreated()).isFalse();
        assertThat(outcome.trace()).singleElement()
                .satisfies(a -> assertThat(a.outcome()).isEqualTo(TierOutcome.ACCEPT));
        assertThat(fx.metadata.calls()).isZero();
        assertThat(fx.fingerprint.calls()).isZero();
        assertThat(fx.fullAudio.calls()).isZero();
    }

    @Test
    void cancelledCascadeStopsBeforeResolvingTrack() {
        // deadline fires while the metadata call is in flight
        fx.metadata.answering(in -> {
            Thread.currentThread().interrupt();
            return RecognitionOutcome.match(TrackCandidate.of("Song", "Artist"), 0.95);
        });

        try {
            assertThatThrownBy(() -> fx.orchestrator().resolve(input))
                    .isInstanceOf(PollDeadlineExceededException.class)
                    .hasMessage("detect-1 cancelled at its deadline");
        } finally {
            Thread.interrupted();
        }

        assertThat(fx.trackStore.count()).isZero();
        assertThat(fx.fingerprintStore.size()).isZero();
        assertThat(fx.fingerprint.calls()).isZero();
        assertThat(fx.fullAudio.calls()).isZero();
    }

    @Test
    void externalAcceptCreatesTrackAndCachesFingerprint() {
        fx.metadata.returning(RecognitionOutcome.match(TrackCandidate.of("Song", "Artist"), 0.9));

        DetectionOutcome outcome = fx.orchestrator().resolve(input);

        assertThat(outcome.source()).isEqualTo(DetectionSource.METADATA);
        assertThat(outcome.trackCreated()).isTrue();
        assertThat(outcome.trace()).extracting(TierAttempt::outcome)
                .containsExactly(TierOutcome.NO_MATCH, TierOutcome.ACCEPT);
        assertThat(outcome.trace().get(1).detail()).isEqualTo("new track");
        assertThat(fx.fingerprintStore.findByDigest(fingerprint.digest()))
                .hasValueSatisfying(e -> {
                    assertThat(e.trackId()).isEqualTo(outcome.track().id());
                    assertThat(e.source()).isEqualTo(DetectionSource.METADATA);
                });
        assertThat(fx.fingerprint.calls()).isZero();
    }

    @Test
    void belowThresholdIsRejectedAndCascadeContinues() {
        fx.metadata.returning(RecognitionOutcome.match(TrackCandidate.of("Wrong", "Guess"), 0.5));
        fx.fingerprint.returning(RecognitionOutcome.match(TrackCandidate.of("Song", "Artist"), 0.8));

        DetectionOutcome outcome = fx.orchestrator().resolve(input);

        assertThat(outcome.source()).isEqualTo(DetectionSource.FINGERPRINT_EXTERNAL);
        assertThat(outcome.track().title()).isEqualTo("Song");
        TierAttempt rejected = outcome.trace().get(1);
        assertThat(rejected.outcome()).isEqualTo(TierOutcome.REJECT);
        assertThat(rejected.confidence()).isEqualTo(0.5);
        assertThat(fx.trackStore.count()).isEqualTo(1);
    }

    @Test
    void adapterErrorAdvancesToNextTier() {
        fx.metadata.returning(RecognitionOutcome.of(RecognitionOutcome.Kind.TIMEOUT, "8s"));
        fx.fingerprint.returning(RecognitionOutcome.match(TrackCandidate.of("Song", "Artist"), 0.95));

        DetectionOutcome outcome = fx.orchestrator().resolve(input);

        assertThat(outcome.isResolved()).isTrue();
        assertThat(outcome.hadErrors()).isTrue();
        assertThat(outcome.trace().get(1).outcome()).isEqualTo(TierOutcome.ERROR);
        assertThat(outcome.trace().get(1).detail()).contains("musicbrainz").contains("TIMEOUT");
    }

    @Test
    void quotaAndOpenCircuitCountAsMisses() {
        fx.metadata.returning(RecognitionOutcome.of(RecognitionOutcome.Kind.CIRCUIT_OPEN, null));
        fx.fingerprint.returning(RecognitionOutcome.of(RecognitionOutcome.Kind.QUOTA_EXCEEDED, "local"));

        DetectionOutcome outcome = fx.orchestrator().resolve(input);

        assertThat(outcome.isResolved()).isFalse();
        assertThat(outcome.hadErrors()).isFalse();
        assertThat(outcome.trace()).extracting(TierAttempt::outcome).containsOnly(TierOutcome.NO_MATCH);
    }

    @Test
    void everyTierMissingLeavesSegmentUnresolved() {
        DetectionOutcome outcome = fx.orchestrator().resolve(input);

        assertThat(outcome.state()).isEqualTo(DetectionState.UNRESOLVED);
        assertThat(outcome.track()).isNull();
        assertThat(outcome.trace()).extracting(TierAttempt::source).containsExactly(
                DetectionSource.LOCAL, DetectionSource.METADATA,
                DetectionSource.FINGERPRINT_EXTERNAL, DetectionSource.FULL_AUDIO_EXTERNAL);
        assertThat(outcome.trace()).allSatisfy(a -> assertThat(a.confidence()).isZero());
        assertThat(fx.trackStore.count()).isZero();
    }

    @Test
    void disabledTierIsSkippedWithoutTrace() {
        fx.metadata.disabled();

        DetectionOutcome outcome = fx.orchestrator().resolve(input);

        assertThat(outcome.trace()).extracting(TierAttempt::source).doesNotContain(DetectionSource.METADATA);
        assertThat(fx.metadata.calls()).isZero();
    }

    @Test
    void throwingTierIsRecordedAsError() {
        fx.metadata.answering(in -> {
            throw new IllegalStateException("boom");
        });

        DetectionOutcome outcome = fx.orchestrator().resolve(input);

        TierAttempt failed = outcome.trace().get(1);
        assertThat(failed.outcome()).isEqualTo(TierOutcome.ERROR);
        assertThat(failed.detail()).isEqualTo("IllegalStateException");
        assertThat(fx.fullAudio.calls()).isEqualTo(1);
    }

    @Test
    void persistenceOutagePropagates() {
        fx.metadata.answering(in -> {
            throw new PersistenceUnavailableException("store down");
        });

        assertThatThrownBy(() -> fx.orchestrator().resolve(input))
                .isInstanceOf(PersistenceUnavailableException.class);
        assertThat(fx.fingerprint.calls()).isZero();
    }

    @Test
    void localHitOnMissingTrackFallsThroughToExternalTiers() {
        fx.fingerprintStore.upsert(new FingerprintEntry(fingerprint.digest(), fingerprint.raw(), 999L,
                0.9, DetectionSource.FULL_AUDIO_EXTERNAL, AT));
        fx.fullAudio.returning(RecognitionOutcome.match(TrackCandidate.of("Song", "Artist"), 0.9));

        DetectionOutcome outcome = fx.orchestrator().resolve(input);

        assertThat(outcome.trace().get(0).outcome()).isEqualTo(TierOutcome.ERROR);
        assertThat(outcome.trace().get(0).detail()).isEqualTo("dangling track id");
        assertThat(outcome.source()).isEqualTo(DetectionSource.FULL_AUDIO_EXTERNAL);
        assertThat(fx.fingerprintStore.findByDigest(fingerprint.digest()))
                .hasValueSatisfying(e -> assertThat(e.trackId()).isEqualTo(outcome.track().id()));
    }

    @Test
    void mergedLocalHitResolvesToSurvivor() {
        Track loser = fx.registry.resolveOrCreate(TrackCandidate.of("Song", "Artist"), 0.9).track();
        fx.fingerprintStore.upsert(new FingerprintEntry(fingerprint.digest(), fingerprint.raw(), loser.id(),
                0.9, DetectionSource.FULL_AUDIO_EXTERNAL, AT));
        Track other = fx.registry.resolveOrCreate(TrackCandidate.of("Other", "Band"), 0.9).track();
        fx.ledger.foldInto(loser.id(), other.id());

        DetectionOutcome outcome = fx.orchestrator().resolve(input);

        assertThat(outcome.source()).isEqualTo(DetectionSource.LOCAL);
        assertThat(outcome.track().id()).isEqualTo(other.id());
    }

    @Test
    void tierLatencyIsTimedPerOutcome() {
        fx.orchestrator().resolve(input);

        assertThat(fx.meterRegistry.find("airplay.detection.tier.latency")
                .tag("source", "metadata").tag("outcome", "no_match").timer())
                .isNotNull()
                .satisfies(t -> assertThat(t.count()).isEqualTo(1));
    }

    @Test
    void thresholdsAreConfigurable() {
        fx.detectionProps.getThresholds().setMetadata(0.95);
        fx.metadata.returning(RecognitionOutcome.match(TrackCandidate.of("Song", "Artist"), 0.9));

        DetectionOutcome outcome = fx.orchestrator().resolve(input);

        assertThat(outcome.trace().get(1).outcome()).isEqualTo(TierOutcome.REJECT);
        assertThat(outcome.isResolved()).isFalse();
    }
}
