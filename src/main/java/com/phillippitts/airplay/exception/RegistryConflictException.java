package com.phillippitts.airplay.exception;

/**
 * Raised by the track store when an insert or update would violate the unique ISRC
 * constraint. The registry resolves it by re-reading; callers never see it.
 */
public class RegistryConflictException extends AirplayException {

    private final String isrc;

    public RegistryConflictException(String isrc) {
        super("Track with ISRC " + isrc + " already exists");
        this.isrc = isrc;
    }

    public String getIsrc() {
        return isrc;
    }
}
