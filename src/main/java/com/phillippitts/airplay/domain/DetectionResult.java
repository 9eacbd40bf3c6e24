package com.phillippitts.airplay.domain;

import java.util.Objects;

/**
 * Summary of one {@code detect} call, rendered by the API layer in its own wire format.
 *
 * @param status      success, unresolved (no identifiable music) or error
 * @param stationId   station the audio belongs to
 * @param track       resolved canonical track, null unless SUCCESS
 * @param confidence  accepted confidence, null unless SUCCESS
 * @param source      tier that resolved the audio, null unless SUCCESS
 * @param detectionId recorded detection, null unless SUCCESS
 * @param continuation true when the detection extended an ongoing play
 * @param message     short diagnostic for UNRESOLVED/ERROR, may be null
 */
public record DetectionResult(
        DetectionStatus status,
        long stationId,
        Track track,
        Double confidence,
        DetectionSource source,
        Long detectionId,
        boolean continuation,
        String message
) {
    public DetectionResult {
        Objects.requireNonNull(status, "status");
    }

    public static DetectionResult success(long stationId, Track track, double confidence,
                                          DetectionSource source, long detectionId, boolean continuation) {
        return new DetectionResult(DetectionStatus.SUCCESS, stationId, track, confidence, source,
                detectionId, continuation, null);
    }

    public static DetectionResult unresolved(long stationId, String message) {
        return new DetectionResult(DetectionStatus.UNRESOLVED, stationId, null, null, null, null, false, message);
    }

    public static DetectionResult error(long stationId, String message) {
        return new DetectionResult(DetectionStatus.ERROR, stationId, null, null, null, null, false, message);
    }

    public boolean isSuccess() {
        return status == DetectionStatus.SUCCESS;
    }
}
