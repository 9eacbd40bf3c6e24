package com.phillippitts.airplay.service.recorder;

import com.phillippitts.airplay.domain.DetectionSource;

import java.time.Instant;

/**
 * Published after a detection has been committed to the ledger.
 */
public record DetectionRecordedEvent(
        long detectionId,
        long stationId,
        long trackId,
        DetectionSource source,
        boolean continuation,
        Instant at
) {
    public DetectionRecordedEvent {
        at = at == null ? Instant.now() : at;
    }
}
