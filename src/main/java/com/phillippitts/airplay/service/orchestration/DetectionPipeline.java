package com.phillippitts.airplay.service.orchestration;

import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.AudioSegment;
import com.phillippitts.airplay.domain.DetectionResult;
import com.phillippitts.airplay.domain.Track;
import com.phillippitts.airplay.exception.PollDeadlineExceededException;
import com.phillippitts.airplay.exception.RecorderWriteException;
import com.phillippitts.airplay.service.adapter.RecognitionInput;
import com.phillippitts.airplay.service.fingerprint.FingerprintGenerator;
import com.phillippitts.airplay.service.metrics.DetectionMetrics;
import com.phillippitts.airplay.service.recorder.DetectionRecorder;
import com.phillippitts.airplay.service.recorder.RecordingOutcome;
import com.phillippitts.airplay.service.recorder.RecordingRequest;
import com.phillippitts.airplay.service.registry.TrackRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Runs one segment through fingerprinting, the detection cascade and the recorder.
 *
 * <p>Segments of the same station are processed one at a time in arrival order; different
 * stations run in parallel on whichever worker picked them up.
 */
public class DetectionPipeline {

    private static final Logger LOG = LogManager.getLogger(DetectionPipeline.class);

    private final FingerprintGenerator generator;
    private final DetectionOrchestrator orchestrator;
    private final DetectionRecorder recorder;
    private final TrackRegistry registry;
    private final DetectionMetrics metrics;
    private final ConcurrentMap<Long, ReentrantLock> stationLocks = new ConcurrentHashMap<>();

    public DetectionPipeline(FingerprintGenerator generator,
                             DetectionOrchestrator orchestrator,
                             DetectionRecorder recorder,
                             TrackRegistry registry,
                             DetectionMetrics metrics) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Processes one captured segment.
     *
     * @param stationName display name passed to metadata lookups, may be null
     * @param streamTitle "Artist - Title" tag, may be null
     * @return SUCCESS, UNRESOLVED, or ERROR when the detection could not be recorded
     * @throws com.phillippitts.airplay.exception.FingerprintException if fingerprinting fails
     * @throws com.phillippitts.airplay.exception.PersistenceUnavailableException if the store is down
     * @throws PollDeadlineExceededException if the worker was interrupted before the detection was written
     */
    public DetectionResult process(AudioSegment segment, String stationName, String streamTitle) {
        Objects.requireNonNull(segment, "segment");
        ReentrantLock lock = stationLocks.computeIfAbsent(segment.stationId(), id -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DetectionResult.error(segment.stationId(), "interrupted while waiting for station");
        }
        try {
            DetectionResult result = run(segment, stationName, streamTitle);
            metrics.incrementResult(result.status());
            return result;
        } finally {
            lock.unlock();
        }
    }

    private DetectionResult run(AudioSegment segment, String stationName, String streamTitle) {
        long stationId = segment.stationId();
        AudioFingerprint fingerprint = generator.fingerprint(segment);
        String title = streamTitle != null ? streamTitle : segment.streamTitle();
        DetectionOutcome outcome = orchestrator.resolve(new RecognitionInput(segment, fingerprint, stationName, title));

        if (!outcome.isResolved()) {
            String summary = outcome.trace().stream()
                    .map(a -> a.source().label() + "=" + a.outcome().name().toLowerCase())
                    .collect(Collectors.joining(", "));
            LOG.info("No track identified on station {} [{}]", stationId, summary);
            return DetectionResult.unresolved(stationId, summary.isEmpty() ? "no tier available" : summary);
        }

        if (Thread.currentThread().isInterrupted()) {
            throw new PollDeadlineExceededException("detect-" + stationId);
        }
        Track track = outcome.track();
        RecordingOutcome recorded;
        try {
            recorded = recorder.record(new RecordingRequest(stationId, track.id(), outcome.confidence(),
                    outcome.source(), segment.capturedAt(), segment.duration()));
        } catch (RecorderWriteException e) {
            LOG.error("Discarding detection of track {} on station {}: {}", track.id(), stationId, e.getMessage(), e);
            return DetectionResult.error(stationId, "recording failed");
        }
        Track current = registry.findById(recorded.detection().trackId()).orElse(track);
        return DetectionResult.success(stationId, current, outcome.confidence(), outcome.source(),
                recorded.detection().id(), recorded.continuation());
    }
}
