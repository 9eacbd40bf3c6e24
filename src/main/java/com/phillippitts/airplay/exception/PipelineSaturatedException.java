package com.phillippitts.airplay.exception;

/**
 * The bounded pipeline pool and its queue are full; the work was refused.
 */
public class PipelineSaturatedException extends AirplayException {

    public PipelineSaturatedException(String taskName, Throwable cause) {
        super("Pipeline pool saturated, refused " + taskName, cause);
    }
}
