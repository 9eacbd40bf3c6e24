package com.phillippitts.airplay.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Association of a fingerprint digest to a track, with the confidence and source that created it.
 */
public record FingerprintEntry(
        String digest,
        int[] raw,
        long trackId,
        double confidence,
        DetectionSource source,
        Instant verifiedAt
) {
    public FingerprintEntry {
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(verifiedAt, "verifiedAt");
        raw = raw == null ? new int[0] : raw;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public FingerprintEntry withTrackId(long newTrackId) {
        return new FingerprintEntry(digest, raw, newTrackId, confidence, source, verifiedAt);
    }

    /**
     * True when this association should replace {@code current}: higher confidence wins,
     * a tie goes to the more recently verified one.
     */
    public boolean supersedes(FingerprintEntry current) {
        if (confidence != current.confidence) {
            return confidence > current.confidence;
        }
        return !verifiedAt.isBefore(current.verifiedAt);
    }
}
