package com.phillippitts.airplay.service.health;

import com.phillippitts.airplay.service.scheduler.StationHealth;
import com.phillippitts.airplay.service.scheduler.StationPollState;
import com.phillippitts.airplay.service.scheduler.StationScheduler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for polled stations. UP while no station is unhealthy, DEGRADED while some
 * are, DOWN when every polled station is.
 */
public class StationHealthIndicator implements HealthIndicator {

    private final StationScheduler scheduler;

    public StationHealthIndicator(StationScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public Health health() {
        List<StationPollState.Snapshot> snapshots = scheduler.snapshots();
        Map<String, Object> unhealthy = new TreeMap<>();
        for (StationPollState.Snapshot s : snapshots) {
            if (s.health() == StationHealth.UNHEALTHY) {
                unhealthy.put(String.valueOf(s.stationId()),
                        Map.of("consecutiveFailures", s.consecutiveFailures(),
                                "lastFailure", String.valueOf(s.lastFailure())));
            }
        }

        Health.Builder builder = new Health.Builder()
                .withDetail("stations", snapshots.size())
                .withDetail("unhealthy", unhealthy);
        if (unhealthy.isEmpty()) {
            builder.up();
        } else if (unhealthy.size() < snapshots.size()) {
            builder.status("DEGRADED");
        } else {
            builder.down();
        }
        return builder.build();
    }
}
