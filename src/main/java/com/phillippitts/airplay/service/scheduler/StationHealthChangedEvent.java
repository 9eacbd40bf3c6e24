package com.phillippitts.airplay.service.scheduler;

import java.time.Instant;

/**
 * Published when a station crosses between HEALTHY and UNHEALTHY.
 */
public record StationHealthChangedEvent(
        long stationId,
        StationHealth previous,
        StationHealth current,
        int consecutiveFailures,
        String lastFailure,
        Instant at
) {
    public StationHealthChangedEvent {
        at = at == null ? Instant.now() : at;
    }
}
