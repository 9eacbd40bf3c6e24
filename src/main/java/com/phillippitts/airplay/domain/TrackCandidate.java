package com.phillippitts.airplay.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Track identity as reported by a recognition source, before registry resolution.
 *
 * @param title       recording title (required)
 * @param artist      main artist credit (required)
 * @param album       album or release group title, may be null
 * @param isrc        ISRC as reported by the source, unnormalized, may be null
 * @param label       record label, may be null
 * @param releaseDate release date as reported (ISO date or year), may be null
 * @param externalIds source name to external identifier
 */
public record TrackCandidate(
        String title,
        String artist,
        String album,
        String isrc,
        String label,
        String releaseDate,
        Map<String, String> externalIds
) {
    public TrackCandidate {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(artist, "artist");
        externalIds = externalIds == null ? Map.of() : Map.copyOf(externalIds);
    }

    public static TrackCandidate of(String title, String artist) {
        return new TrackCandidate(title, artist, null, null, null, null, Map.of());
    }

    public TrackCandidate withIsrc(String newIsrc) {
        return new TrackCandidate(title, artist, album, newIsrc, label, releaseDate, externalIds);
    }
}
