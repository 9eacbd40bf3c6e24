package com.phillippitts.airplay.exception;

/**
 * Thrown when no audio segment could be captured for a station (stream unreachable,
 * empty body, read timeout). The poll is skipped; it is not fatal.
 */
public class CaptureException extends AirplayException {

    private final long stationId;

    public CaptureException(long stationId, String message) {
        super("Capture failed for station " + stationId + ": " + message);
        this.stationId = stationId;
    }

    public CaptureException(long stationId, String message, Throwable cause) {
        super("Capture failed for station " + stationId + ": " + message, cause);
        this.stationId = stationId;
    }

    public long getStationId() {
        return stationId;
    }
}
