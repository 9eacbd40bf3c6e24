package com.phillippitts.airplay.service.orchestration;

import com.phillippitts.airplay.config.properties.DetectionProperties;
import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.domain.FingerprintEntry;
import com.phillippitts.airplay.domain.Track;
import com.phillippitts.airplay.exception.PersistenceUnavailableException;
import com.phillippitts.airplay.exception.PollDeadlineExceededException;
import com.phillippitts.airplay.service.adapter.RecognitionInput;
import com.phillippitts.airplay.service.fingerprint.FingerprintStore;
import com.phillippitts.airplay.service.metrics.DetectionMetrics;
import com.phillippitts.airplay.service.registry.TrackRegistry;
import com.phillippitts.airplay.service.registry.TrackResolution;
import com.phillippitts.airplay.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Default cascade: LOCAL, METADATA, FINGERPRINT_EXTERNAL, FULL_AUDIO_EXTERNAL.
 *
 * <p>Each tier's match is accepted only at or above that tier's threshold; anything else
 * (reject, miss, error) moves on to the next tier. Accepted external candidates are resolved
 * through the {@link TrackRegistry} and the fingerprint is written back to the
 * {@link FingerprintStore} so the next airing of the same audio is resolved locally.
 *
 * <p><b>Thread Safety:</b> stateless; shared by all pipeline workers.
 */
public class DefaultDetectionOrchestrator implements DetectionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultDetectionOrchestrator.class);

    private final List<DetectionTier> tiers;
    private final TrackRegistry registry;
    private final FingerprintStore fingerprintStore;
    private final DetectionProperties props;
    private final DetectionMetrics metrics;
    private final Clock clock;

    public DefaultDetectionOrchestrator(List<DetectionTier> tiers,
                                        TrackRegistry registry,
                                        FingerprintStore fingerprintStore,
                                        DetectionProperties props,
                                        DetectionMetrics metrics,
                                        Clock clock) {
        Objects.requireNonNull(tiers, "tiers");
        List<DetectionTier> ordered = new ArrayList<>(tiers);
        ordered.sort(Comparator.comparing(DetectionTier::source));
        this.tiers = List.copyOf(ordered);
        this.registry = Objects.requireNonNull(registry, "registry");
        this.fingerprintStore = Objects.requireNonNull(fingerprintStore, "fingerprintStore");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public DetectionOutcome resolve(RecognitionInput input) {
        Objects.requireNonNull(input, "input");
        List<TierAttempt> trace = new ArrayList<>();

        for (DetectionTier tier : tiers) {
            checkNotCancelled(input, tier.source());
            if (!tier.isAvailable()) {
                LOG.debug("Skipping tier {}: unavailable", tier.source());
                continue;
            }
            long start = System.nanoTime();
            TierResult result;
            try {
                result = tier.attempt(input);
            } catch (PersistenceUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                LOG.warn("Tier {} failed for station {}: {}", tier.source(), input.stationId(), e.toString());
                result = TierResult.error(e.getClass().getSimpleName());
            }

            if (!result.isMatch()) {
                TierOutcome outcome = result.kind() == TierResult.Kind.ERROR ? TierOutcome.ERROR : TierOutcome.NO_MATCH;
                record(trace, tier.source(), outcome, 0.0, start, result.detail());
                continue;
            }

            double threshold = props.thresholdFor(tier.source());
            if (result.confidence() < threshold) {
                LOG.info("Tier {} matched below threshold for station {} (confidence={}, threshold={})",
                        tier.source(), input.stationId(), result.confidence(), threshold);
                record(trace, tier.source(), TierOutcome.REJECT, result.confidence(), start, "below threshold");
                continue;
            }

            checkNotCancelled(input, tier.source());
            DetectionOutcome accepted = accept(tier.source(), result, input, trace, start);
            if (accepted != null) {
                return accepted;
            }
        }

        LOG.debug("Station {} unresolved after {} tier(s)", input.stationId(), trace.size());
        return DetectionOutcome.unresolved(trace);
    }

    /**
     * Turns an accepted tier result into a canonical track. Returns null (after recording an
     * ERROR attempt) when a local hit points at a track that no longer exists.
     */
    private DetectionOutcome accept(DetectionSource source, TierResult result, RecognitionInput input,
                                    List<TierAttempt> trace, long start) {
        if (result.trackId() != null) {
            Track track;
            try {
                track = registry.canonical(result.trackId());
            } catch (IllegalArgumentException e) {
                LOG.warn("Local fingerprint points at unknown track {}: {}", result.trackId(), e.getMessage());
                record(trace, source, TierOutcome.ERROR, result.confidence(), start, "dangling track id");
                return null;
            }
            record(trace, source, TierOutcome.ACCEPT, result.confidence(), start, result.detail());
            return DetectionOutcome.resolved(track, source, result.confidence(), false, trace);
        }

        TrackResolution resolution = registry.resolveOrCreate(result.candidate(), result.confidence());
        writeBack(input.fingerprint(), resolution.track(), result.confidence(), source);
        record(trace, source, TierOutcome.ACCEPT, result.confidence(), start,
                resolution.created() ? "new track" : "known track");
        LOG.info("Station {} resolved by {}: track {} '{}' by '{}' (confidence={})", input.stationId(), source,
                resolution.track().id(), resolution.track().title(), resolution.track().artist(), result.confidence());
        return DetectionOutcome.resolved(resolution.track(), source, result.confidence(), resolution.created(), trace);
    }

    /** A poll past its deadline must not go on to create tracks or cache entries. */
    private static void checkNotCancelled(RecognitionInput input, DetectionSource source) {
        if (Thread.currentThread().isInterrupted()) {
            LOG.debug("Cascade of station {} cancelled before {}", input.stationId(), source);
            throw new PollDeadlineExceededException("detect-" + input.stationId());
        }
    }

    private void writeBack(AudioFingerprint fingerprint, Track track, double confidence, DetectionSource source) {
        if (fingerprint == null) {
            return;
        }
        FingerprintEntry entry = new FingerprintEntry(fingerprint.digest(), fingerprint.raw(), track.id(),
                confidence, source, clock.instant());
        try {
            FingerprintEntry held = fingerprintStore.upsert(entry);
            if (held.trackId() != track.id()) {
                LOG.debug("Digest {} kept on track {} (stronger association than {})",
                        fingerprint.digest(), held.trackId(), track.id());
            }
        } catch (RuntimeException e) {
            // the detection stands; only the cache entry is lost
            LOG.warn("Fingerprint write-back failed for track {}: {}", track.id(), e.toString());
        }
    }

    private void record(List<TierAttempt> trace, DetectionSource source, TierOutcome outcome,
                        double confidence, long startNanos, String detail) {
        long elapsedNanos = System.nanoTime() - startNanos;
        trace.add(new TierAttempt(source, outcome, confidence, TimeUtils.nanosToMillis(elapsedNanos), detail));
        metrics.recordTier(source, outcome.name().toLowerCase(), elapsedNanos);
    }
}
