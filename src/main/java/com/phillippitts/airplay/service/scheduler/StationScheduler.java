package com.phillippitts.airplay.service.scheduler;

import com.phillippitts.airplay.config.properties.SchedulerProperties;
import com.phillippitts.airplay.domain.AudioSegment;
import com.phillippitts.airplay.domain.DetectionResult;
import com.phillippitts.airplay.domain.DetectionStatus;
import com.phillippitts.airplay.domain.Station;
import com.phillippitts.airplay.exception.CaptureException;
import com.phillippitts.airplay.exception.FingerprintException;
import com.phillippitts.airplay.exception.PersistenceUnavailableException;
import com.phillippitts.airplay.exception.PipelineSaturatedException;
import com.phillippitts.airplay.persistence.StationStore;
import com.phillippitts.airplay.service.capture.AudioCaptureService;
import com.phillippitts.airplay.service.metrics.DetectionMetrics;
import com.phillippitts.airplay.service.orchestration.DetectionPipeline;
import com.phillippitts.airplay.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Drives station polls on the bounded pipeline pool.
 *
 * <p>Every tick lists the due stations (highest priority first, then oldest due time) and
 * submits each one. The tick thread only submits; capture, fingerprinting and detection run
 * on pipeline workers. A refused submission (pool saturated) leaves the station due, so it is
 * retried on the next tick.
 *
 * <p><b>Health:</b> capture, fingerprint, deadline and unexpected failures count toward a
 * station's consecutive failure total. At {@code unhealthy-threshold} the station turns
 * UNHEALTHY and its poll interval is multiplied by {@code unhealthy-backoff-multiplier}
 * (capped by {@code max-backoff}); one successful poll restores it.
 *
 * <p><b>Thread Safety:</b> a station is never polled twice at once; its in-flight flag is set
 * on submit and cleared when the worker actually finishes.
 */
public class StationScheduler {

    private static final Logger LOG = LogManager.getLogger(StationScheduler.class);

    private final StationStore stationStore;
    private final AudioCaptureService captureService;
    private final DetectionPipeline pipeline;
    private final DeadlineExecutor executor;
    private final SchedulerProperties props;
    private final DetectionMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final ConcurrentMap<Long, StationPollState> states = new ConcurrentHashMap<>();

    public StationScheduler(StationStore stationStore,
                            AudioCaptureService captureService,
                            DetectionPipeline pipeline,
                            DeadlineExecutor executor,
                            SchedulerProperties props,
                            DetectionMetrics metrics,
                            ApplicationEventPublisher publisher,
                            Clock clock) {
        this.stationStore = Objects.requireNonNull(stationStore, "stationStore");
        this.captureService = Objects.requireNonNull(captureService, "captureService");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Periodic tick: submits every due station.
     */
    @Scheduled(fixedDelayString = "${airplay.scheduler.tick-ms:1000}")
    public void tick() {
        if (!props.isEnabled()) {
            return;
        }
        schedule().forEach(this::submit);
    }

    /**
     * Stations due now, not in flight, ordered by priority (desc) then due time.
     *
     * <p>The stream is lazy: active stations are read from the store when a terminal operation
     * runs, so every call reflects the current station set.
     */
    public Stream<StationPoll> schedule() {
        return StreamSupport.stream(() -> stationStore.findActive().spliterator(), Spliterator.ORDERED, false)
                .filter(Station::active)
                .map(station -> new StationPoll(station, dueAt(station)))
                .filter(poll -> !poll.dueAt().isAfter(clock.instant()))
                .filter(poll -> !stateOf(poll.stationId()).isInFlight())
                .sorted(Comparator.comparingInt((StationPoll p) -> p.station().priority()).reversed()
                        .thenComparing(StationPoll::dueAt));
    }

    /**
     * Submits one poll to the pipeline pool.
     *
     * @return false when the station is already in flight or the pool is saturated
     */
    public boolean submit(StationPoll poll) {
        Station station = poll.station();
        StationPollState state = stateOf(station.id());
        if (!state.tryStart()) {
            LOG.debug("Station {} still in flight; skipping", station.id());
            return false;
        }
        String pollId = UUID.randomUUID().toString().substring(0, 8);
        AtomicBoolean settled = new AtomicBoolean();
        try {
            executor.submit("poll-" + station.id(), () -> runPoll(station, state, settled, pollId),
                    props.getPollDeadline(), () -> fail(station, state, settled, "deadline"));
            return true;
        } catch (PipelineSaturatedException e) {
            state.finish();
            metrics.incrementBackpressure();
            LOG.debug("Pipeline saturated; station {} retried next tick", station.id());
            return false;
        }
    }

    public List<StationPollState.Snapshot> snapshots() {
        return states.values().stream().map(StationPollState::snapshot).toList();
    }

    public Optional<StationPollState.Snapshot> snapshot(long stationId) {
        return Optional.ofNullable(states.get(stationId)).map(StationPollState::snapshot);
    }

    private Instant dueAt(Station station) {
        Duration interval = station.pollInterval();
        Duration backoff = TimeUtils.multiplyCapped(interval, props.getUnhealthyBackoffMultiplier(), props.getMaxBackoff());
        return stateOf(station.id()).dueAt(interval, backoff);
    }

    private StationPollState stateOf(long stationId) {
        return states.computeIfAbsent(stationId, id -> new StationPollState(id, clock.instant()));
    }

    private Void runPoll(Station station, StationPollState state, AtomicBoolean settled, String pollId) {
        ThreadContext.put("stationId", String.valueOf(station.id()));
        ThreadContext.put("pollId", pollId);
        long start = System.nanoTime();
        try {
            AudioSegment segment = captureService.capture(station);
            DetectionResult result = pipeline.process(segment, station.name(), segment.streamTitle());
            if (result.status() == DetectionStatus.ERROR) {
                // recorder failures are data-path errors, not station faults
                settled.compareAndSet(false, true);
            } else {
                succeed(station, state, settled);
            }
        } catch (CaptureException e) {
            LOG.warn("Capture failed on station {}: {}", station.id(), e.getMessage());
            fail(station, state, settled, interruptedOr("capture"));
        } catch (FingerprintException e) {
            LOG.warn("Fingerprinting failed on station {}: {}", station.id(), e.getMessage());
            fail(station, state, settled, interruptedOr("fingerprint"));
        } catch (PersistenceUnavailableException e) {
            LOG.error("Persistence unavailable while polling station {}", station.id(), e);
            settled.compareAndSet(false, true);
        } catch (RuntimeException e) {
            if (!Thread.currentThread().isInterrupted()) {
                LOG.error("Unexpected failure polling station {}", station.id(), e);
            }
            fail(station, state, settled, interruptedOr("unexpected"));
        } finally {
            reschedule(station, state);
            metrics.recordPollLatency(System.nanoTime() - start);
            LOG.debug("Poll {} of station {} finished in {}ms", pollId, station.id(), TimeUtils.elapsedMillis(start));
            ThreadContext.remove("stationId");
            ThreadContext.remove("pollId");
        }
        return null;
    }

    private void reschedule(Station station, StationPollState state) {
        Instant now = clock.instant();
        state.polled(now);
        try {
            stationStore.markChecked(station.id(), now);
        } catch (RuntimeException e) {
            LOG.warn("Could not update lastChecked of station {}: {}", station.id(), e.getMessage());
        } finally {
            state.finish();
        }
    }

    private void succeed(Station station, StationPollState state, AtomicBoolean settled) {
        if (!settled.compareAndSet(false, true)) {
            return;
        }
        StationHealth previous = state.recordSuccess();
        if (previous != null) {
            LOG.info("Station {} ({}) recovered", station.id(), station.name());
            publisher.publishEvent(new StationHealthChangedEvent(station.id(), previous, StationHealth.HEALTHY,
                    0, null, clock.instant()));
        }
    }

    private void fail(Station station, StationPollState state, AtomicBoolean settled, String reason) {
        if (!settled.compareAndSet(false, true)) {
            return;
        }
        metrics.incrementStationFailure(reason);
        StationHealth previous = state.recordFailure(reason, props.getUnhealthyThreshold());
        if (previous != null) {
            int failures = state.consecutiveFailures();
            LOG.warn("Station {} ({}) marked UNHEALTHY after {} consecutive failures (last: {})",
                    station.id(), station.name(), failures, reason);
            publisher.publishEvent(new StationHealthChangedEvent(station.id(), previous, StationHealth.UNHEALTHY,
                    failures, reason, clock.instant()));
        }
    }

    /** A failure seen after the deadline interrupted the worker is the deadline's. */
    private static String interruptedOr(String reason) {
        return Thread.currentThread().isInterrupted() ? "deadline" : reason;
    }
}
