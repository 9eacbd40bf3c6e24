package com.phillippitts.airplay.exception;

/**
 * Thrown when the atomic detection write (detection row, track counters, station-track
 * stats) fails. Nothing of the unit has been applied; the detection is discarded.
 */
public class RecorderWriteException extends AirplayException {

    private final long stationId;
    private final long trackId;

    public RecorderWriteException(long stationId, long trackId, Throwable cause) {
        super("Failed to record detection for station " + stationId + ", track " + trackId, cause);
        this.stationId = stationId;
        this.trackId = trackId;
    }

    public long getStationId() {
        return stationId;
    }

    public long getTrackId() {
        return trackId;
    }
}
