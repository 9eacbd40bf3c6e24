package com.phillippitts.airplay.service.adapter;

import java.time.Instant;
import java.util.Map;

/**
 * Published when an adapter call fails, times out, or is refused by its quota.
 *
 * <p>Context holds technical diagnostics only (status, reason); never API keys or audio.
 */
public record AdapterFailureEvent(
        String adapter,
        RecognitionOutcome.Kind kind,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public AdapterFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
