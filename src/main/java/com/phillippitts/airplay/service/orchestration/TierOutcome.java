package com.phillippitts.airplay.service.orchestration;

/**
 * Outcome of one tier attempt in the detection cascade. Only {@link #ACCEPT} terminates.
 */
public enum TierOutcome {
    /** Match at or above the tier's threshold. */
    ACCEPT,
    /** Match below the tier's threshold; logged as a non-event. */
    REJECT,
    NO_MATCH,
    ERROR
}
