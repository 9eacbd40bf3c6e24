package com.phillippitts.airplay.service.recorder;

import com.phillippitts.airplay.domain.DetectionSource;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An accepted recognition to be written to the play ledger.
 *
 * @param detectedAt   capture time of the recognized segment
 * @param playDuration audio length attributable to this recognition (the segment length)
 */
public record RecordingRequest(
        long stationId,
        long trackId,
        double confidence,
        DetectionSource source,
        Instant detectedAt,
        Duration playDuration
) {
    public RecordingRequest {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(detectedAt, "detectedAt");
        Objects.requireNonNull(playDuration, "playDuration");
        if (playDuration.isNegative()) {
            throw new IllegalArgumentException("playDuration must not be negative: " + playDuration);
        }
    }
}
