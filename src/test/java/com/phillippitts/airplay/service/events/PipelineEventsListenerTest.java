package com.phillippitts.airplay.service.events;

import com.phillippitts.airplay.service.adapter.AdapterFailureEvent;
import com.phillippitts.airplay.service.adapter.RecognitionOutcome;
import com.phillippitts.airplay.service.metrics.DetectionMetrics;
import com.phillippitts.airplay.service.registry.TrackMergedEvent;
import com.phillippitts.airplay.service.scheduler.StationHealth;
import com.phillippitts.airplay.service.scheduler.StationHealthChangedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineEventsListenerTest {

    private SimpleMeterRegistry registry;
    private PipelineEventsListener listener;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        listener = new PipelineEventsListener(new DetectionMetrics(registry));
    }

    @Test
    void throttlesRepeatLogs() {
        // first occurrence is logged
        assertThat(listener.shouldLog("adapter-audd-TIMEOUT")).isTrue();
        // an immediate repeat is not
        assertThat(listener.shouldLog("adapter-audd-TIMEOUT")).isFalse();
        // other keys are independent
        assertThat(listener.shouldLog("station-7")).isTrue();
    }

    @Test
    void adapterFailuresAreCountedEvenWhenLogIsThrottled() {
        AdapterFailureEvent event = new AdapterFailureEvent("audd", RecognitionOutcome.Kind.TIMEOUT,
                Instant.now(), "read timed out", null, Map.of("timeoutMs", "15000"));

        listener.onAdapterFailure(event);
        listener.onAdapterFailure(event);

        assertThat(registry.find("airplay.detection.adapter.failure")
                .tag("adapter", "audd").tag("kind", "timeout").counter().count()).isEqualTo(2.0);
    }

    @Test
    void trackMergesAreCounted() {
        listener.onTrackMerged(new TrackMergedEvent(4L, 2L, "US1234567890", 1, Instant.now()));

        assertThat(registry.find("airplay.detection.track.merge").counter().count()).isEqualTo(1.0);
    }

    @Test
    void recoveryResetsStationThrottle() {
        listener.onStationHealthChanged(new StationHealthChangedEvent(7L, StationHealth.HEALTHY,
                StationHealth.UNHEALTHY, 3, "capture", Instant.now()));
        assertThat(listener.shouldLog("station-7")).isFalse();

        listener.onStationHealthChanged(new StationHealthChangedEvent(7L, StationHealth.UNHEALTHY,
                StationHealth.HEALTHY, 0, null, Instant.now()));

        assertThat(listener.shouldLog("station-7")).isTrue();
    }
}
