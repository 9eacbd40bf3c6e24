package com.phillippitts.airplay.exception;

/**
 * Thrown when the external fingerprint tool fails (missing binary, codec error,
 * timeout, malformed output). The poll is skipped.
 */
public class FingerprintException extends AirplayException {

    private final int exitCode;

    public FingerprintException(String message) {
        super(message);
        this.exitCode = -1;
    }

    public FingerprintException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public FingerprintException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public FingerprintException(String message, int exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
