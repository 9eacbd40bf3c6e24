package com.phillippitts.airplay.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A fixed-duration audio segment delivered by the capture collaborator.
 *
 * @param stationId   station the audio was captured from
 * @param audio       encoded audio bytes as received from the stream
 * @param capturedAt  capture start time
 * @param duration    nominal segment duration
 * @param format      container/codec hint used as temp-file suffix (e.g. "mp3"), never null
 * @param streamTitle in-band stream title ("Artist - Title"), may be null
 */
public record AudioSegment(
        long stationId,
        byte[] audio,
        Instant capturedAt,
        Duration duration,
        String format,
        String streamTitle
) {
    public AudioSegment {
        Objects.requireNonNull(audio, "audio");
        Objects.requireNonNull(capturedAt, "capturedAt");
        Objects.requireNonNull(duration, "duration");
        format = format == null || format.isBlank() ? "mp3" : format;
    }
}
