package com.phillippitts.airplay.service.scheduler;

import com.phillippitts.airplay.domain.Station;

import java.time.Instant;
import java.util.Objects;

/**
 * A station that is due for polling.
 *
 * @param dueAt time the poll became due
 */
public record StationPoll(Station station, Instant dueAt) {
    public StationPoll {
        Objects.requireNonNull(station, "station");
        Objects.requireNonNull(dueAt, "dueAt");
    }

    public long stationId() {
        return station.id();
    }
}
