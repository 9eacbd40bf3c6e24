package com.phillippitts.airplay.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical music work with its cumulative play statistics.
 *
 * <p>{@code identityConfidence} is the confidence of the source that last set title/artist;
 * a later source only overrides them with a strictly higher confidence. {@code mergedInto}
 * is set when this track lost an ISRC collision and now aliases the surviving track.
 */
public record Track(
        long id,
        String title,
        String artist,
        String album,
        String isrc,
        String label,
        String releaseDate,
        long playCount,
        Duration totalPlayTime,
        Instant firstPlayed,
        Instant lastPlayed,
        Map<String, String> externalIds,
        double identityConfidence,
        Long mergedInto
) {

    public Track {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(artist, "artist");
        if (playCount < 0) {
            throw new IllegalArgumentException("playCount must not be negative, got: " + playCount);
        }
        totalPlayTime = totalPlayTime == null ? Duration.ZERO : totalPlayTime;
        externalIds = externalIds == null ? Map.of() : Map.copyOf(externalIds);
    }

    /**
     * Creates a never-played track from a recognition candidate. The ISRC passed in must
     * already be normalized (or null).
     */
    public static Track fromCandidate(long id, TrackCandidate candidate, String normalizedIsrc, double confidence) {
        return new Track(id, candidate.title(), candidate.artist(), candidate.album(), normalizedIsrc,
                candidate.label(), candidate.releaseDate(), 0, Duration.ZERO, null, null,
                candidate.externalIds(), confidence, null);
    }

    public Track withId(long newId) {
        return new Track(newId, title, artist, album, isrc, label, releaseDate, playCount, totalPlayTime,
                firstPlayed, lastPlayed, externalIds, identityConfidence, mergedInto);
    }

    public boolean isMerged() {
        return mergedInto != null;
    }

    /**
     * Returns a copy that counts one more play of {@code playTime} at {@code at}.
     */
    public Track withNewPlay(Duration playTime, Instant at) {
        return toBuilder()
                .playCount(playCount + 1)
                .totalPlayTime(totalPlayTime.plus(playTime))
                .firstPlayed(firstPlayed == null ? at : firstPlayed)
                .lastPlayed(at)
                .build();
    }

    /**
     * Returns a copy whose current play was extended by {@code delta}; the play count is unchanged.
     */
    public Track withExtendedPlay(Duration delta, Instant at) {
        return toBuilder()
                .totalPlayTime(totalPlayTime.plus(delta))
                .firstPlayed(firstPlayed == null ? at : firstPlayed)
                .lastPlayed(at)
                .build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Mutable builder for copy-with-changes of the immutable record.
     */
    public static final class Builder {
        private long id;
        private String title;
        private String artist;
        private String album;
        private String isrc;
        private String label;
        private String releaseDate;
        private long playCount;
        private Duration totalPlayTime;
        private Instant firstPlayed;
        private Instant lastPlayed;
        private Map<String, String> externalIds;
        private double identityConfidence;
        private Long mergedInto;

        private Builder(Track t) {
            this.id = t.id;
            this.title = t.title;
            this.artist = t.artist;
            this.album = t.album;
            this.isrc = t.isrc;
            this.label = t.label;
            this.releaseDate = t.releaseDate;
            this.playCount = t.playCount;
            this.totalPlayTime = t.totalPlayTime;
            this.firstPlayed = t.firstPlayed;
            this.lastPlayed = t.lastPlayed;
            this.externalIds = new LinkedHashMap<>(t.externalIds);
            this.identityConfidence = t.identityConfidence;
            this.mergedInto = t.mergedInto;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder artist(String artist) {
            this.artist = artist;
            return this;
        }

        public Builder album(String album) {
            this.album = album;
            return this;
        }

        public Builder isrc(String isrc) {
            this.isrc = isrc;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder releaseDate(String releaseDate) {
            this.releaseDate = releaseDate;
            return this;
        }

        public Builder playCount(long playCount) {
            this.playCount = playCount;
            return this;
        }

        public Builder totalPlayTime(Duration totalPlayTime) {
            this.totalPlayTime = totalPlayTime;
            return this;
        }

        public Builder firstPlayed(Instant firstPlayed) {
            this.firstPlayed = firstPlayed;
            return this;
        }

        public Builder lastPlayed(Instant lastPlayed) {
            this.lastPlayed = lastPlayed;
            return this;
        }

        /** Adds external ids; existing keys are kept. */
        public Builder addExternalIds(Map<String, String> ids) {
            ids.forEach(this.externalIds::putIfAbsent);
            return this;
        }

        public Builder identityConfidence(double identityConfidence) {
            this.identityConfidence = identityConfidence;
            return this;
        }

        public Builder mergedInto(Long mergedInto) {
            this.mergedInto = mergedInto;
            return this;
        }

        public Track build() {
            return new Track(id, title, artist, album, isrc, label, releaseDate, playCount, totalPlayTime,
                    firstPlayed, lastPlayed, externalIds, identityConfidence, mergedInto);
        }
    }
}
