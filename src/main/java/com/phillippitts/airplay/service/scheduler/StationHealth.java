package com.phillippitts.airplay.service.scheduler;

/** Poll health of a station. UNHEALTHY stations are polled with a back-off. */
public enum StationHealth {
    HEALTHY,
    UNHEALTHY
}
