package com.phillippitts.airplay.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Aggregate play statistics of one track on one station.
 */
public record StationTrackStats(
        long stationId,
        long trackId,
        long playCount,
        Duration totalPlayTime,
        Instant firstPlayed,
        Instant lastPlayed
) {
    public static StationTrackStats first(long stationId, long trackId, Duration playTime, Instant at) {
        return new StationTrackStats(stationId, trackId, 1, playTime, at, at);
    }

    public StationTrackStats withNewPlay(Duration playTime, Instant at) {
        return new StationTrackStats(stationId, trackId, playCount + 1, totalPlayTime.plus(playTime),
                firstPlayed, at);
    }

    public StationTrackStats withExtendedPlay(Duration delta, Instant at) {
        return new StationTrackStats(stationId, trackId, playCount, totalPlayTime.plus(delta), firstPlayed, at);
    }
}
