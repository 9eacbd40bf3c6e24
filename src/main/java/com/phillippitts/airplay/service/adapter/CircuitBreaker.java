package com.phillippitts.airplay.service.adapter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Per-adapter circuit breaker.
 *
 * <p>State model:
 * <ul>
 *   <li>CLOSED: calls pass. Consecutive failures are kept in a sliding window; reaching the
 *       threshold inside the window opens the circuit. Any success clears the window.</li>
 *   <li>OPEN: calls are refused until the cool-down elapses.</li>
 *   <li>HALF_OPEN: exactly one trial call passes; its success closes the circuit, its failure
 *       re-opens it for another cool-down.</li>
 * </ul>
 */
public final class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    public enum State { CLOSED, OPEN, HALF_OPEN }

    private final String name;
    private final int failureThreshold;
    private final Duration window;
    private final Duration cooldown;
    private final Clock clock;

    private final Deque<Instant> failures = new ArrayDeque<>();
    private State state = State.CLOSED;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration window, Duration cooldown, Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.failureThreshold = failureThreshold;
        this.window = Objects.requireNonNull(window, "window");
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Asks permission for one call. In HALF_OPEN the single trial is handed out here.
     */
    public synchronized boolean tryAcquire() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (clock.instant().isBefore(openedAt.plus(cooldown))) {
                    return false;
                }
                state = State.HALF_OPEN;
                LOG.info("Circuit {} half-open after {} cool-down", name, cooldown);
                trialInFlight = true;
                return true;
            case HALF_OPEN:
            default:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
        }
    }

    /**
     * Returns a permit that ended without a verdict (quota refusal, interruption).
     */
    public synchronized void release() {
        trialInFlight = false;
    }

    public synchronized void onSuccess() {
        if (state != State.CLOSED) {
            LOG.info("Circuit {} closed after successful trial call", name);
        }
        state = State.CLOSED;
        trialInFlight = false;
        failures.clear();
        openedAt = null;
    }

    public synchronized void onFailure() {
        Instant now = clock.instant();
        trialInFlight = false;
        if (state == State.HALF_OPEN) {
            open(now);
            return;
        }
        if (state == State.OPEN) {
            return;
        }
        failures.addLast(now);
        pruneOld(now);
        if (failures.size() >= failureThreshold) {
            open(now);
        }
    }

    public synchronized State state() {
        if (state == State.OPEN && !clock.instant().isBefore(openedAt.plus(cooldown))) {
            // cool-down over; the next tryAcquire() turns this into the trial
            return State.HALF_OPEN;
        }
        return state;
    }

    private void open(Instant now) {
        state = State.OPEN;
        openedAt = now;
        failures.clear();
        LOG.warn("Circuit {} opened; refusing calls until {}", name, now.plus(cooldown));
    }

    private void pruneOld(Instant now) {
        Instant cutoff = now.minus(window);
        while (!failures.isEmpty() && failures.peekFirst().isBefore(cutoff)) {
            failures.removeFirst();
        }
    }
}
