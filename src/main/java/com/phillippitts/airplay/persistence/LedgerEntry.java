package com.phillippitts.airplay.persistence;

import com.phillippitts.airplay.domain.Detection;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One atomic unit of play accounting: a detection insert (new play) or extension (continuation),
 * together with the play time added to the track and station-track counters.
 *
 * @param detection detection to insert (id ignored) or the extended detection (id kept)
 * @param continuation true when {@code detection} extends an existing row
 * @param playTimeDelta play time added to totals; the full segment for a new play
 * @param playedAt      instant that becomes {@code lastPlayed}
 */
public record LedgerEntry(
        Detection detection,
        boolean continuation,
        Duration playTimeDelta,
        Instant playedAt
) {
    public LedgerEntry {
        Objects.requireNonNull(detection, "detection");
        Objects.requireNonNull(playTimeDelta, "playTimeDelta");
        Objects.requireNonNull(playedAt, "playedAt");
        if (playTimeDelta.isNegative()) {
            throw new IllegalArgumentException("playTimeDelta must not be negative: " + playTimeDelta);
        }
    }

    public static LedgerEntry newPlay(Detection detection) {
        return new LedgerEntry(detection, false, detection.playDuration(), detection.detectedAt());
    }

    public static LedgerEntry continuation(Detection extended, Duration delta, Instant playedAt) {
        return new LedgerEntry(extended, true, delta, playedAt);
    }
}
