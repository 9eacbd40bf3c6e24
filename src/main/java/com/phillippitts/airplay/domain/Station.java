package com.phillippitts.airplay.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A monitored radio stream. Only active stations are scheduled.
 *
 * @param pollInterval cadence between polls while healthy
 * @param priority     higher values are dispatched first when several stations are due
 */
public record Station(
        long id,
        String name,
        String streamUrl,
        boolean active,
        Instant lastChecked,
        Duration pollInterval,
        int priority
) {
    public Station {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive, got: " + pollInterval);
        }
    }

    public Station withLastChecked(Instant at) {
        return new Station(id, name, streamUrl, active, at, pollInterval, priority);
    }
}
