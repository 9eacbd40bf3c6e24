package com.phillippitts.airplay.exception;

/**
 * Thrown when an external recognition call exceeds its per-call timeout.
 */
public class AdapterTimeoutException extends AdapterException {

    private final long timeoutMs;

    public AdapterTimeoutException(String adapterName, long timeoutMs, Throwable cause) {
        super("Call timed out after " + timeoutMs + "ms", adapterName, cause);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
