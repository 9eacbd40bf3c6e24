package com.phillippitts.airplay.service.adapter;

import com.phillippitts.airplay.domain.TrackCandidate;

import java.util.Objects;

/**
 * Typed result of one adapter call. Only {@link Kind#MATCH} carries a candidate.
 */
public record RecognitionOutcome(Kind kind, TrackCandidate candidate, double confidence, String detail) {

    public enum Kind { MATCH, NO_MATCH, TIMEOUT, QUOTA_EXCEEDED, CIRCUIT_OPEN, ERROR }

    public RecognitionOutcome {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.MATCH) {
            Objects.requireNonNull(candidate, "candidate");
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
            }
        }
    }

    public static RecognitionOutcome match(TrackCandidate candidate, double confidence) {
        return new RecognitionOutcome(Kind.MATCH, candidate, confidence, null);
    }

    public static RecognitionOutcome noMatch(String detail) {
        return new RecognitionOutcome(Kind.NO_MATCH, null, 0.0, detail);
    }

    public static RecognitionOutcome of(Kind kind, String detail) {
        if (kind == Kind.MATCH) {
            throw new IllegalArgumentException("Use match(candidate, confidence)");
        }
        return new RecognitionOutcome(kind, null, 0.0, detail);
    }

    public boolean isMatch() {
        return kind == Kind.MATCH;
    }

    /** True for outcomes caused by a failing or throttled service rather than an honest miss. */
    public boolean isFailure() {
        return kind == Kind.TIMEOUT || kind == Kind.ERROR;
    }
}
