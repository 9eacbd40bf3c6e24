package com.phillippitts.airplay.util;

import java.time.Duration;

/**
 * Bounded waits used while tearing down fpcalc runs and the poll deadline timer.
 */
public final class ProcessTimeouts {

    /** Output drain after fpcalc exits; one JSON document, even with {@code -raw}. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Output drain after fpcalc was killed; whatever is left is discarded. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}; a survivor is logged and abandoned. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(1);

    /** Pending deadline cancellations allowed to finish when the executor closes. */
    public static final Duration DEADLINE_TIMER_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    private ProcessTimeouts() {
    }
}
