package com.phillippitts.airplay.domain;

import java.util.Objects;

/**
 * Chromaprint fingerprint of one captured segment.
 *
 * @param digest          hex SHA-256 of the raw sub-fingerprint vector, the exact-match key
 * @param raw             raw 32-bit sub-fingerprints, used for similarity comparison
 * @param encoded         compressed base64 form accepted by AcoustID, may be null
 * @param durationSeconds audio duration reported by the fingerprinter
 */
public record AudioFingerprint(
        String digest,
        int[] raw,
        String encoded,
        double durationSeconds
) {
    public AudioFingerprint {
        Objects.requireNonNull(digest, "digest");
        raw = raw == null ? new int[0] : raw;
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must not be negative, got: " + durationSeconds);
        }
    }
}
