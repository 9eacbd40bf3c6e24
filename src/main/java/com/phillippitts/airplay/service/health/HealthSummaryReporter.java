package com.phillippitts.airplay.service.health;

import com.phillippitts.airplay.service.adapter.RecognitionAdapter;
import com.phillippitts.airplay.service.scheduler.StationHealth;
import com.phillippitts.airplay.service.scheduler.StationPollState;
import com.phillippitts.airplay.service.scheduler.StationScheduler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Logs a one-line summary of adapter and station health at a fixed interval.
 */
public class HealthSummaryReporter {

    private static final Logger LOG = LogManager.getLogger(HealthSummaryReporter.class);

    private final List<RecognitionAdapter> adapters;
    private final StationScheduler scheduler;

    public HealthSummaryReporter(List<RecognitionAdapter> adapters, StationScheduler scheduler) {
        this.adapters = List.copyOf(adapters);
        this.scheduler = scheduler;
    }

    @Scheduled(fixedDelayString = "${airplay.health.summary-interval-ms:60000}",
            initialDelayString = "${airplay.health.summary-interval-ms:60000}")
    public void logSummary() {
        LOG.info(summary());
    }

    String summary() {
        String adapterPart = adapters.stream()
                .map(a -> a.name() + "=" + AdapterHealthIndicator.adapterStatus(a))
                .collect(Collectors.joining(", "));
        List<StationPollState.Snapshot> snapshots = scheduler.snapshots();
        long unhealthy = snapshots.stream().filter(s -> s.health() == StationHealth.UNHEALTHY).count();
        long inFlight = snapshots.stream().filter(StationPollState.Snapshot::inFlight).count();
        return "Health summary: adapters [" + adapterPart + "], stations polled=" + snapshots.size()
                + ", unhealthy=" + unhealthy + ", in flight=" + inFlight;
    }
}
