package com.phillippitts.airplay.service.recorder;

import com.phillippitts.airplay.config.properties.RecorderProperties;
import com.phillippitts.airplay.domain.Detection;
import com.phillippitts.airplay.exception.PersistenceUnavailableException;
import com.phillippitts.airplay.exception.PollDeadlineExceededException;
import com.phillippitts.airplay.exception.RecorderWriteException;
import com.phillippitts.airplay.persistence.LedgerEntry;
import com.phillippitts.airplay.persistence.PlayLedger;
import com.phillippitts.airplay.service.registry.TrackRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link DetectionRecorder} on top of a {@link PlayLedger}.
 *
 * <p><b>Continuation rule:</b> when the station's latest detection is the same canonical track
 * and the gap between its end and the new segment is at most {@code continuationGap}, that
 * detection's play duration is stretched to cover the new segment instead of inserting a row.
 * Play count stays the same; total play time grows by the added span.
 *
 * <p>Writes for one station are serialized; different stations proceed in parallel.
 */
public class DefaultDetectionRecorder implements DetectionRecorder {

    private static final Logger LOG = LogManager.getLogger(DefaultDetectionRecorder.class);

    private final PlayLedger ledger;
    private final TrackRegistry registry;
    private final RecorderProperties props;
    private final ApplicationEventPublisher publisher;
    private final ConcurrentMap<Long, ReentrantLock> stationLocks = new ConcurrentHashMap<>();

    public DefaultDetectionRecorder(PlayLedger ledger,
                                    TrackRegistry registry,
                                    RecorderProperties props,
                                    ApplicationEventPublisher publisher) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public RecordingOutcome record(RecordingRequest request) {
        Objects.requireNonNull(request, "request");
        ReentrantLock lock = stationLocks.computeIfAbsent(request.stationId(), id -> new ReentrantLock());
        lock.lock();
        try {
            RecordingOutcome outcome = write(request);
            Detection d = outcome.detection();
            publisher.publishEvent(new DetectionRecordedEvent(d.id(), d.stationId(), d.trackId(), d.source(),
                    outcome.continuation(), null));
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    private RecordingOutcome write(RecordingRequest request) {
        try {
            long trackId = registry.canonical(request.trackId()).id();
            Optional<Detection> continued = ledger.latestForStation(request.stationId())
                    .filter(latest -> isSamePlay(latest, trackId, request.detectedAt()));

            if (continued.isPresent()) {
                Detection latest = continued.get();
                Instant segmentEnd = request.detectedAt().plus(request.playDuration());
                Instant newEnd = segmentEnd.isAfter(latest.endsAt()) ? segmentEnd : latest.endsAt();
                Duration delta = Duration.between(latest.endsAt(), newEnd);
                Detection extended = latest.withPlayDuration(Duration.between(latest.detectedAt(), newEnd));
                checkNotCancelled(request);
                Detection stored = ledger.commit(LedgerEntry.continuation(extended, delta, request.detectedAt()));
                LOG.debug("Extended detection {} on station {} by {}s", stored.id(), request.stationId(),
                        delta.toSeconds());
                return new RecordingOutcome(stored, true);
            }

            Detection detection = new Detection(0L, request.stationId(), trackId, request.confidence(),
                    request.source(), request.detectedAt(), request.playDuration());
            checkNotCancelled(request);
            Detection stored = ledger.commit(LedgerEntry.newPlay(detection));
            LOG.info("Recorded detection {} on station {} (track={}, source={})", stored.id(),
                    request.stationId(), trackId, request.source().label());
            return new RecordingOutcome(stored, false);
        } catch (PersistenceUnavailableException | PollDeadlineExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RecorderWriteException(request.stationId(), request.trackId(), e);
        }
    }

    private static void checkNotCancelled(RecordingRequest request) {
        if (Thread.currentThread().isInterrupted()) {
            throw new PollDeadlineExceededException("record-" + request.stationId());
        }
    }

    private boolean isSamePlay(Detection latest, long trackId, Instant detectedAt) {
        if (registry.canonical(latest.trackId()).id() != trackId) {
            return false;
        }
        Duration gap = Duration.between(latest.endsAt(), detectedAt);
        return gap.compareTo(props.continuationGap()) <= 0 && !detectedAt.isBefore(latest.detectedAt());
    }
}
