package com.phillippitts.airplay.service.scheduler;

import com.phillippitts.airplay.config.properties.SchedulerProperties;
import com.phillippitts.airplay.domain.AudioSegment;
import com.phillippitts.airplay.domain.Station;
import com.phillippitts.airplay.domain.TrackCandidate;
import com.phillippitts.airplay.exception.CaptureException;
import com.phillippitts.airplay.persistence.InMemoryStationStore;
import com.phillippitts.airplay.service.adapter.RecognitionOutcome;
import com.phillippitts.airplay.service.capture.AudioCaptureService;
import com.phillippitts.airplay.testutil.PipelineFixture;
import com.phillippitts.airplay.testutil.TestFingerprints;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class StationSchedulerTest {

    private static final Duration INTERVAL = Duration.ofSeconds(60);

    private PipelineFixture fx;
    private InMemoryStationStore stations;
    private ScriptedCapture capture;
    private SchedulerProperties props;
    private DeadlineExecutor executor;
    private StationScheduler scheduler;

    @BeforeEach
    void setUp() {
        fx = new PipelineFixture();
        stations = new InMemoryStationStore(List.of(
                station(1L, "Radio One", 0),
                station(2L, "Radio Two", 5),
                new Station(3L, "Off Air", "http://off", false, null, INTERVAL, 0)));
        capture = new ScriptedCapture(st -> TestFingerprints.segment(st.id(), "audio-" + st.id(), fx.clock.instant()));
        props = new SchedulerProperties();
        props.setUnhealthyThreshold(3);
        props.setUnhealthyBackoffMultiplier(5);
        props.setMaxBackoff(Duration.ofMinutes(30));
        // runs polls on the calling thread so each tick is fully settled when it returns
        executor = new DeadlineExecutor(Runnable::run);
        scheduler = newScheduler(executor);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void dueStationsAreOrderedByPriority() {
        List<StationPoll> due = scheduler.schedule().toList();

        assertThat(due).extracting(StationPoll::stationId).containsExactly(2L, 1L);
    }

    @Test
    void polledStationIsNotDueBeforeItsInterval() {
        scheduler.tick();

        assertThat(capture.calls()).containsExactlyInAnyOrder(2L, 1L);
        assertThat(scheduler.schedule().toList()).isEmpty();

        fx.clock.advance(INTERVAL);
        assertThat(scheduler.schedule().toList()).hasSize(2);
        assertThat(stations.findById(1L)).hasValueSatisfying(s -> assertThat(s.lastChecked()).isNotNull());
    }

    @Test
    void successfulPollRecordsDetection() {
        fx.fullAudio.returning(RecognitionOutcome.match(TrackCandidate.of("Song", "Artist"), 0.9));

        scheduler.tick();

        assertThat(fx.ledger.detectionsForStation(1L)).hasSize(1);
        assertThat(fx.ledger.detectionsForStation(2L)).hasSize(1);
        assertThat(scheduler.snapshot(1L)).hasValueSatisfying(s -> {
            assertThat(s.health()).isEqualTo(StationHealth.HEALTHY);
            assertThat(s.inFlight()).isFalse();
        });
    }

    @Test
    void repeatedCaptureFailuresMarkStationUnhealthyAndBackOff() {
        // Arrange
        capture.failFor(1L);

        // Act
        for (int i = 0; i < 3; i++) {
            scheduler.tick();
            fx.clock.advance(INTERVAL);
        }

        // Assert
        assertThat(scheduler.snapshot(1L)).hasValueSatisfying(s -> {
            assertThat(s.health()).isEqualTo(StationHealth.UNHEALTHY);
            assertThat(s.consecutiveFailures()).isEqualTo(3);
            assertThat(s.lastFailure()).isEqualTo("capture");
        });
        assertThat(fx.publisher.eventsOf(StationHealthChangedEvent.class)).singleElement().satisfies(e -> {
            assertThat(e.stationId()).isEqualTo(1L);
            assertThat(e.current()).isEqualTo(StationHealth.UNHEALTHY);
        });
        assertThat(fx.meterRegistry.counter("airplay.detection.station.failure", "reason", "capture").count())
                .isEqualTo(3.0);

        // healthy station stays on its interval; the failing one waits five intervals
        assertThat(scheduler.schedule().toList()).extracting(StationPoll::stationId).containsExactly(2L);
        fx.clock.advance(INTERVAL.multipliedBy(4));
        assertThat(scheduler.schedule().toList()).extracting(StationPoll::stationId).containsExactly(2L, 1L);
    }

    @Test
    void successAfterUnhealthyRestoresStation() {
        capture.failFor(1L);
        for (int i = 0; i < 3; i++) {
            scheduler.tick();
            fx.clock.advance(INTERVAL);
        }
        capture.recover(1L);
        fx.clock.advance(INTERVAL.multipliedBy(5));

        scheduler.tick();

        assertThat(scheduler.snapshot(1L)).hasValueSatisfying(s -> {
            assertThat(s.health()).isEqualTo(StationHealth.HEALTHY);
            assertThat(s.consecutiveFailures()).isZero();
        });
        assertThat(fx.publisher.eventsOf(StationHealthChangedEvent.class))
                .extracting(StationHealthChangedEvent::current)
                .containsExactly(StationHealth.UNHEALTHY, StationHealth.HEALTHY);
    }

    @Test
    void unresolvedAudioIsNotAFailure() {
        scheduler.tick();

        assertThat(scheduler.snapshot(1L)).hasValueSatisfying(s -> assertThat(s.consecutiveFailures()).isZero());
    }

    @Test
    void fingerprintFailureCountsAgainstStation() {
        capture.answering(st -> TestFingerprints.segment(st.id(), "FAIL-garbage", fx.clock.instant()));

        scheduler.tick();

        assertThat(scheduler.snapshot(1L)).hasValueSatisfying(s -> {
            assertThat(s.consecutiveFailures()).isEqualTo(1);
            assertThat(s.lastFailure()).isEqualTo("fingerprint");
        });
    }

    @Test
    void saturatedPoolDefersStationToNextTick() {
        DeadlineExecutor refusing = new DeadlineExecutor(r -> {
            throw new RejectedExecutionException("full");
        });
        try {
            StationScheduler saturated = newScheduler(refusing);
            StationPoll poll = saturated.schedule().findFirst().orElseThrow();

            boolean submitted = saturated.submit(poll);

            assertThat(submitted).isFalse();
            assertThat(capture.calls()).isEmpty();
            assertThat(fx.meterRegistry.counter("airplay.detection.backpressure").count()).isEqualTo(1.0);
            assertThat(saturated.schedule().toList()).extracting(StationPoll::stationId).contains(poll.stationId());
        } finally {
            refusing.close();
        }
    }

    @Test
    void disabledSchedulerDoesNothing() {
        props.setEnabled(false);

        scheduler.tick();

        assertThat(capture.calls()).isEmpty();
    }

    @Test
    void hungCaptureIsCutOffAndOthersKeepPolling() {
        // Arrange
        ExecutorService pool = Executors.newFixedThreadPool(2);
        DeadlineExecutor pooled = new DeadlineExecutor(pool);
        CountDownLatch never = new CountDownLatch(1);
        capture.answering(st -> {
            if (st.id() == 1L) {
                try {
                    never.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CaptureException(st.id(), "interrupted", e);
                }
            }
            return TestFingerprints.segment(st.id(), "audio-" + st.id(), fx.clock.instant());
        });
        props.setPollDeadline(Duration.ofMillis(200));
        StationScheduler withPool = newScheduler(pooled);
        try {
            // Act
            withPool.tick();

            // Assert
            await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                    assertThat(withPool.snapshot(1L)).hasValueSatisfying(s -> {
                        assertThat(s.consecutiveFailures()).isEqualTo(1);
                        assertThat(s.lastFailure()).isEqualTo("deadline");
                        assertThat(s.inFlight()).isFalse();
                    }));
            assertThat(withPool.snapshot(2L)).hasValueSatisfying(s -> assertThat(s.consecutiveFailures()).isZero());
            assertThat(fx.meterRegistry.counter("airplay.detection.station.failure", "reason", "deadline").count())
                    .isEqualTo(1.0);
        } finally {
            pooled.close();
            pool.shutdownNow();
        }
    }

    @Test
    void stationInFlightIsNotScheduledAgain() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        DeadlineExecutor pooled = new DeadlineExecutor(pool);
        CountDownLatch release = new CountDownLatch(1);
        capture.answering(st -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TestFingerprints.segment(st.id(), "audio-" + st.id(), fx.clock.instant());
        });
        StationScheduler withPool = newScheduler(pooled);
        try {
            StationPoll poll = withPool.schedule().filter(p -> p.stationId() == 1L).findFirst().orElseThrow();
            assertThat(withPool.submit(poll)).isTrue();

            assertThat(withPool.schedule().toList()).extracting(StationPoll::stationId).doesNotContain(1L);
            assertThat(withPool.submit(poll)).isFalse();
        } finally {
            release.countDown();
            pooled.close();
            pool.shutdown();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    private StationScheduler newScheduler(DeadlineExecutor deadlineExecutor) {
        return new StationScheduler(stations, capture, fx.pipeline(), deadlineExecutor, props, fx.metrics,
                fx.publisher, fx.clock);
    }

    private static Station station(long id, String name, int priority) {
        return new Station(id, name, "http://stream/" + id, true, null, INTERVAL, priority);
    }

    /** Capture double; stations listed in {@link #failFor} raise a CaptureException. */
    private static final class ScriptedCapture implements AudioCaptureService {
        private volatile Function<Station, AudioSegment> behavior;
        private final Set<Long> failing = ConcurrentHashMap.newKeySet();
        private final List<Long> calls = new CopyOnWriteArrayList<>();

        ScriptedCapture(Function<Station, AudioSegment> behavior) {
            this.behavior = behavior;
        }

        void answering(Function<Station, AudioSegment> behavior) {
            this.behavior = behavior;
        }

        void failFor(long stationId) {
            failing.add(stationId);
        }

        void recover(long stationId) {
            failing.remove(stationId);
        }

        List<Long> calls() {
            return List.copyOf(calls);
        }

        @Override
        public AudioSegment capture(Station station) {
            calls.add(station.id());
            if (failing.contains(station.id())) {
                throw new CaptureException(station.id(), "connection refused");
            }
            return behavior.apply(station);
        }
    }
}
