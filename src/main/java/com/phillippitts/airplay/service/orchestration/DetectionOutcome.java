package com.phillippitts.airplay.service.orchestration;

import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.domain.Track;

import java.util.List;
import java.util.Objects;

/**
 * Result of running the cascade on one segment.
 *
 * @param track        canonical track, null when UNRESOLVED
 * @param source       accepting tier, null when UNRESOLVED
 * @param confidence   accepted confidence, 0.0 when UNRESOLVED
 * @param trackCreated the registry created the track for this detection
 * @param trace        every attempted tier in order
 */
public record DetectionOutcome(
        DetectionState state,
        Track track,
        DetectionSource source,
        double confidence,
        boolean trackCreated,
        List<TierAttempt> trace
) {
    public DetectionOutcome {
        Objects.requireNonNull(state, "state");
        trace = trace == null ? List.of() : List.copyOf(trace);
        if (state == DetectionState.RESOLVED) {
            Objects.requireNonNull(track, "track");
            Objects.requireNonNull(source, "source");
        }
    }

    static DetectionOutcome resolved(Track track, DetectionSource source, double confidence,
                                     boolean trackCreated, List<TierAttempt> trace) {
        return new DetectionOutcome(DetectionState.RESOLVED, track, source, confidence, trackCreated, trace);
    }

    static DetectionOutcome unresolved(List<TierAttempt> trace) {
        return new DetectionOutcome(DetectionState.UNRESOLVED, null, null, 0.0, false, trace);
    }

    public boolean isResolved() {
        return state == DetectionState.RESOLVED;
    }

    /** True when at least one tier ended in ERROR. */
    public boolean hadErrors() {
        return trace.stream().anyMatch(a -> a.outcome() == TierOutcome.ERROR);
    }
}
