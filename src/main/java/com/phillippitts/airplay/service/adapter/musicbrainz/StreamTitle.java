package com.phillippitts.airplay.service.adapter.musicbrainz;

import java.util.Optional;

/**
 * "Artist - Title" tag as broadcast in a stream's metadata.
 */
record StreamTitle(String artist, String title) {

    private static final String SEPARATOR = " - ";

    /**
     * Splits on the first " - ". Tags without both parts (jingles, station names) yield empty.
     */
    static Optional<StreamTitle> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        int idx = trimmed.indexOf(SEPARATOR);
        if (idx <= 0) {
            return Optional.empty();
        }
        String artist = trimmed.substring(0, idx).trim();
        String title = trimmed.substring(idx + SEPARATOR.length()).trim();
        if (artist.isEmpty() || title.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new StreamTitle(artist, title));
    }
}
