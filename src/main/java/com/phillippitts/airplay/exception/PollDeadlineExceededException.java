package com.phillippitts.airplay.exception;

import java.time.Duration;

/**
 * A station pipeline execution ran past its hard deadline and was cancelled.
 */
public class PollDeadlineExceededException extends AirplayException {

    private final Duration deadline;

    public PollDeadlineExceededException(String taskName, Duration deadline) {
        super(taskName + " exceeded deadline of " + deadline.toMillis() + "ms");
        this.deadline = deadline;
    }

    /**
     * Raised by the cancelled work itself once it notices the interrupt.
     */
    public PollDeadlineExceededException(String taskName) {
        super(taskName + " cancelled at its deadline");
        this.deadline = null;
    }

    /** Null when raised by the cancelled work rather than the executor. */
    public Duration getDeadline() {
        return deadline;
    }
}
