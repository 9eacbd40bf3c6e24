package com.phillippitts.airplay.service.metrics;

import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.domain.DetectionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for the detection pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Tier latency and outcome per detection source</li>
 *   <li>Poll results per status and poll latency</li>
 *   <li>Station failures by reason and pool backpressure</li>
 *   <li>Adapter failures and track merges</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class DetectionMetrics {

    private static final String METRIC_PREFIX = "airplay.detection";

    private final MeterRegistry registry;

    public DetectionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one tier attempt.
     *
     * @param source tier that was attempted
     * @param outcome accept, reject, no_match or error
     * @param durationNanos time spent in the tier
     */
    public void recordTier(DetectionSource source, String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".tier.latency")
                .description("Time spent per detection tier")
                .tag("source", source.label())
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts a finished poll by its result status.
     */
    public void incrementResult(DetectionStatus status) {
        Counter.builder(METRIC_PREFIX + ".result")
                .description("Number of detection results by status")
                .tag("status", status.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordPollLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".poll.latency")
                .description("End-to-end station poll time")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts a station poll failure that counts toward unhealthy status.
     *
     * @param reason capture, fingerprint, deadline or unexpected
     */
    public void incrementStationFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".station.failure")
                .description("Number of failed station polls")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /** Counts a poll refused because the pipeline pool was saturated. */
    public void incrementBackpressure() {
        Counter.builder(METRIC_PREFIX + ".backpressure")
                .description("Number of polls deferred because the pipeline pool was full")
                .register(registry)
                .increment();
    }

    public void incrementAdapterFailure(String adapter, String kind) {
        Counter.builder(METRIC_PREFIX + ".adapter.failure")
                .description("Number of failed or refused adapter calls")
                .tag("adapter", adapter)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void incrementTrackMerge() {
        Counter.builder(METRIC_PREFIX + ".track.merge")
                .description("Number of track identities merged by ISRC")
                .register(registry)
                .increment();
    }
}
