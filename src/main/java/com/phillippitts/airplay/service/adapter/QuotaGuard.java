package com.phillippitts.airplay.service.adapter;

import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed-window call quota of one adapter. Calls over the limit are refused locally before any
 * network traffic; the refusal is published as an {@link AdapterFailureEvent}.
 *
 * <p><b>Thread Safety:</b> all state changes are synchronized on the guard.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * QuotaGuard quota = new QuotaGuard("acoustid", 3, Duration.ofSeconds(1), publisher, Clock.systemUTC());
 * if (!quota.tryAcquire()) {
 *     return RecognitionOutcome.of(Kind.QUOTA_EXCEEDED, "local quota");
 * }
 * }</pre>
 */
public final class QuotaGuard {

    private final String adapterName;
    private final int limit;
    private final Duration window;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private Instant windowStart;
    private int used;

    /**
     * @param adapterName adapter name for events
     * @param limit       calls permitted per window
     * @param window      window length
     * @param publisher   event publisher for refusals (nullable)
     * @param clock       time source
     */
    public QuotaGuard(String adapterName, int limit, Duration window,
                      ApplicationEventPublisher publisher, Clock clock) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.adapterName = Objects.requireNonNull(adapterName, "adapterName");
        this.limit = limit;
        this.window = window;
        this.publisher = publisher;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.windowStart = clock.instant();
    }

    /**
     * Takes one call from the current window.
     *
     * @return false when the window's quota is used up
     */
    public boolean tryAcquire() {
        boolean granted;
        synchronized (this) {
            rollWindow();
            granted = used < limit;
            if (granted) {
                used++;
            }
        }
        if (!granted) {
            publishQuotaEvent();
        }
        return granted;
    }

    /** Calls left in the current window. */
    public synchronized int remaining() {
        rollWindow();
        return limit - used;
    }

    public int limit() {
        return limit;
    }

    private void rollWindow() {
        Instant now = clock.instant();
        if (!now.isBefore(windowStart.plus(window))) {
            windowStart = now;
            used = 0;
        }
    }

    private void publishQuotaEvent() {
        if (publisher != null) {
            publisher.publishEvent(new AdapterFailureEvent(
                    adapterName,
                    RecognitionOutcome.Kind.QUOTA_EXCEEDED,
                    clock.instant(),
                    "local quota of " + limit + " per " + window + " exhausted",
                    null,
                    Map.of("reason", "quota", "limit", String.valueOf(limit))
            ));
        }
    }
}
