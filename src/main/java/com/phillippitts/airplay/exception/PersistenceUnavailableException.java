package com.phillippitts.airplay.exception;

/**
 * The persistence collaborator is unreachable or corrupt. Fatal: no tier can proceed
 * without the fingerprint store and the track registry.
 */
public class PersistenceUnavailableException extends AirplayException {

    public PersistenceUnavailableException(String message) {
        super(message);
    }

    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
