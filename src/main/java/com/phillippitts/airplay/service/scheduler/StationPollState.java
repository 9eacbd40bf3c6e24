package com.phillippitts.airplay.service.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduling and health bookkeeping for one station.
 *
 * <p>The in-flight flag keeps a station from being polled twice at once. Counters are
 * guarded by the instance monitor.
 */
public final class StationPollState {

    private final long stationId;
    private final AtomicBoolean inFlight = new AtomicBoolean();
    private final Instant registeredAt;
    private int consecutiveFailures;
    private StationHealth health = StationHealth.HEALTHY;
    private String lastFailure;
    private Instant lastPolled;

    /** Immutable view for health reporting. */
    public record Snapshot(long stationId, StationHealth health, int consecutiveFailures, String lastFailure,
                           Instant lastPolled, boolean inFlight) {}

    StationPollState(long stationId, Instant registeredAt) {
        this.stationId = stationId;
        this.registeredAt = registeredAt;
    }

    boolean tryStart() {
        return inFlight.compareAndSet(false, true);
    }

    void finish() {
        inFlight.set(false);
    }

    boolean isInFlight() {
        return inFlight.get();
    }

    /**
     * Due time derived from the last poll and the current health, so a failure settled after
     * the worker finished still stretches the next interval. Never-polled stations are due at
     * registration.
     */
    synchronized Instant dueAt(Duration interval, Duration backoffInterval) {
        if (lastPolled == null) {
            return registeredAt;
        }
        return lastPolled.plus(health == StationHealth.UNHEALTHY ? backoffInterval : interval);
    }

    synchronized void polled(Instant at) {
        this.lastPolled = at;
    }

    /**
     * @return the previous health when this success restored the station, otherwise null
     */
    synchronized StationHealth recordSuccess() {
        consecutiveFailures = 0;
        if (health == StationHealth.UNHEALTHY) {
            health = StationHealth.HEALTHY;
            return StationHealth.UNHEALTHY;
        }
        return null;
    }

    /**
     * @return the previous health when this failure crossed the threshold, otherwise null
     */
    synchronized StationHealth recordFailure(String reason, int threshold) {
        consecutiveFailures++;
        lastFailure = reason;
        if (health == StationHealth.HEALTHY && consecutiveFailures >= threshold) {
            health = StationHealth.UNHEALTHY;
            return StationHealth.HEALTHY;
        }
        return null;
    }

    public synchronized StationHealth health() {
        return health;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(stationId, health, consecutiveFailures, lastFailure, lastPolled, inFlight.get());
    }
}
