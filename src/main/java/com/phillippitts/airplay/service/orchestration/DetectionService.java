package com.phillippitts.airplay.service.orchestration;

import com.phillippitts.airplay.domain.DetectionResult;

/**
 * Entry point for callers that bring their own audio (API layer, batch re-detection).
 */
public interface DetectionService {

    /**
     * Identifies the track in an audio segment of a station and records the detection.
     *
     * <p>Failures of capture-independent steps (fingerprinting, deadline, saturation, recording)
     * are reported as {@code ERROR} results; an unidentified segment is {@code UNRESOLVED}.
     *
     * @param audio       encoded audio bytes (mp3 unless the caller knows better)
     * @param stationName display name, may be null
     * @param streamTitle "Artist - Title" tag, may be null
     * @throws com.phillippitts.airplay.exception.PersistenceUnavailableException if the store is down
     */
    DetectionResult detect(long stationId, byte[] audio, String stationName, String streamTitle);
}
