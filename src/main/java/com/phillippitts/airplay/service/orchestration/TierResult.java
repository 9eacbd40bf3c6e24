package com.phillippitts.airplay.service.orchestration;

import com.phillippitts.airplay.domain.TrackCandidate;

import java.util.Objects;

/**
 * Raw answer of a tier, before the orchestrator applies the acceptance threshold.
 *
 * <p>A match carries either a known {@code trackId} (local fingerprint hit) or a
 * {@code candidate} still to be resolved by the registry (external sources).
 */
public record TierResult(Kind kind, Long trackId, TrackCandidate candidate, double confidence, String detail) {

    public enum Kind { MATCH, NO_MATCH, ERROR }

    public TierResult {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.MATCH && trackId == null && candidate == null) {
            throw new IllegalArgumentException("A match needs a track id or a candidate");
        }
    }

    public static TierResult knownTrack(long trackId, double confidence, String detail) {
        return new TierResult(Kind.MATCH, trackId, null, confidence, detail);
    }

    public static TierResult candidate(TrackCandidate candidate, double confidence) {
        return new TierResult(Kind.MATCH, null, Objects.requireNonNull(candidate, "candidate"), confidence, null);
    }

    public static TierResult noMatch(String detail) {
        return new TierResult(Kind.NO_MATCH, null, null, 0.0, detail);
    }

    public static TierResult error(String detail) {
        return new TierResult(Kind.ERROR, null, null, 0.0, detail);
    }

    public boolean isMatch() {
        return kind == Kind.MATCH;
    }
}
