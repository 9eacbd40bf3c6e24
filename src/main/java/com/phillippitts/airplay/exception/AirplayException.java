package com.phillippitts.airplay.exception;

/**
 * Base exception for all airplay-monitor application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AirplayException extends RuntimeException {

    public AirplayException(String message) {
        super(message);
    }

    public AirplayException(String message, Throwable cause) {
        super(message, cause);
    }

    public AirplayException(Throwable cause) {
        super(cause);
    }
}
