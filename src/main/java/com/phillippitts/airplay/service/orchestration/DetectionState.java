package com.phillippitts.airplay.service.orchestration;

/** Terminal state of the detection cascade. */
public enum DetectionState {
    RESOLVED,
    UNRESOLVED
}
