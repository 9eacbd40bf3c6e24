package com.phillippitts.airplay.service.adapter;

import com.phillippitts.airplay.domain.DetectionSource;

/**
 * Capability interface of an external recognition service.
 *
 * <p>Implementations own their quota and circuit breaker state, never retry internally and
 * never throw from {@link #identify}: every failure is reported as a typed outcome.
 */
public interface RecognitionAdapter {

    /** Stable lower-case name used in logs, metrics and events. */
    String name();

    /** Cascade tier this adapter serves. */
    DetectionSource source();

    /** False when the adapter is switched off or lacks credentials; the cascade skips it. */
    boolean isEnabled();

    RecognitionOutcome identify(RecognitionInput input);

    CircuitBreaker.State circuitState();
}
