package com.phillippitts.airplay.service.events;

import com.phillippitts.airplay.service.adapter.AdapterFailureEvent;
import com.phillippitts.airplay.service.metrics.DetectionMetrics;
import com.phillippitts.airplay.service.registry.TrackMergedEvent;
import com.phillippitts.airplay.service.scheduler.StationHealth;
import com.phillippitts.airplay.service.scheduler.StationHealthChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for pipeline events. Counts every event; logs are throttled per key to
 * avoid spam when a service or station keeps failing. Handled on the event pool so publishers
 * on pipeline workers are not held up.
 */
@Component
public class PipelineEventsListener {
    private static final Logger LOG = LogManager.getLogger(PipelineEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final DetectionMetrics metrics;

    public PipelineEventsListener(DetectionMetrics metrics) {
        this.metrics = metrics;
    }

    @Async("eventExecutor")
    @EventListener
    public void onAdapterFailure(AdapterFailureEvent e) {
        metrics.incrementAdapterFailure(e.adapter(), e.kind().name().toLowerCase());
        String key = "adapter-" + e.adapter() + '-' + e.kind();
        if (shouldLog(key)) {
            LOG.warn("Recognition service {} failing: kind={}, message={}, context={}",
                    e.adapter(), e.kind(), e.message(), e.context());
        }
    }

    @Async("eventExecutor")
    @EventListener
    public void onTrackMerged(TrackMergedEvent e) {
        metrics.incrementTrackMerge();
        LOG.info("Track {} merged into {} (isrc={}, fingerprints moved={})",
                e.mergedTrackId(), e.survivorTrackId(), e.isrc(), e.fingerprintsMoved());
    }

    @Async("eventExecutor")
    @EventListener
    public void onStationHealthChanged(StationHealthChangedEvent e) {
        if (e.current() == StationHealth.UNHEALTHY) {
            if (shouldLog("station-" + e.stationId())) {
                LOG.warn("Station {} unhealthy after {} consecutive failures (last: {}); polling backed off",
                        e.stationId(), e.consecutiveFailures(), e.lastFailure());
            }
        } else {
            lastLog.remove("station-" + e.stationId());
            LOG.info("Station {} healthy again", e.stationId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
