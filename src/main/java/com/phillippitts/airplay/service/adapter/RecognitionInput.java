package com.phillippitts.airplay.service.adapter;

import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.AudioSegment;

import java.util.Objects;

/**
 * Everything a recognition adapter may use; each adapter picks what its service accepts.
 *
 * @param segment     captured audio (full-audio services upload it)
 * @param fingerprint fingerprint of the segment, may be null when fingerprinting was skipped
 * @param stationName display name of the station, may be null
 * @param streamTitle in-band "Artist - Title" tag, may be null
 */
public record RecognitionInput(
        AudioSegment segment,
        AudioFingerprint fingerprint,
        String stationName,
        String streamTitle
) {
    public RecognitionInput {
        Objects.requireNonNull(segment, "segment");
    }

    public long stationId() {
        return segment.stationId();
    }
}
