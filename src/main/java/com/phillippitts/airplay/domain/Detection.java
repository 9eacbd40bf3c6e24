package com.phillippitts.airplay.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One accepted identification event on a station.
 *
 * <p>Identity, track, source, confidence and {@code detectedAt} never change once written;
 * a continuation of the same play only extends {@code playDuration}.
 */
public record Detection(
        long id,
        long stationId,
        long trackId,
        double confidence,
        DetectionSource source,
        Instant detectedAt,
        Duration playDuration
) {
    public Detection {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(detectedAt, "detectedAt");
        Objects.requireNonNull(playDuration, "playDuration");
    }

    /** Instant at which the attributed play ends. */
    public Instant endsAt() {
        return detectedAt.plus(playDuration);
    }

    public Detection withPlayDuration(Duration newDuration) {
        return new Detection(id, stationId, trackId, confidence, source, detectedAt, newDuration);
    }
}
