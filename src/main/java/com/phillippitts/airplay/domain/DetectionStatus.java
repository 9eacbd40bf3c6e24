package com.phillippitts.airplay.domain;

/** Outcome of a single {@code detect} call as seen by the API boundary. */
public enum DetectionStatus {
    SUCCESS,
    UNRESOLVED,
    ERROR
}
