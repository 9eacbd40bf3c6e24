package com.phillippitts.airplay.service.orchestration;

import com.phillippitts.airplay.domain.DetectionSource;

import java.util.Objects;

/**
 * One entry of the cascade trace.
 *
 * @param confidence match confidence, 0.0 unless ACCEPT or REJECT
 * @param detail     short diagnostic, may be null
 */
public record TierAttempt(
        DetectionSource source,
        TierOutcome outcome,
        double confidence,
        long elapsedMs,
        String detail
) {
    public TierAttempt {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(outcome, "outcome");
    }
}
