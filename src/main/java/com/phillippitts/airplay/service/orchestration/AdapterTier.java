package com.phillippitts.airplay.service.orchestration;

import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.service.adapter.RecognitionAdapter;
import com.phillippitts.airplay.service.adapter.RecognitionInput;
import com.phillippitts.airplay.service.adapter.RecognitionOutcome;

import java.util.Objects;

/**
 * Cascade tier backed by an external {@link RecognitionAdapter}.
 *
 * <p>An open circuit and a spent quota are reported as misses so the cascade moves on;
 * timeouts and service errors are reported as errors.
 */
public class AdapterTier implements DetectionTier {

    private final RecognitionAdapter adapter;

    public AdapterTier(RecognitionAdapter adapter) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
    }

    @Override
    public DetectionSource source() {
        return adapter.source();
    }

    @Override
    public boolean isAvailable() {
        return adapter.isEnabled();
    }

    @Override
    public TierResult attempt(RecognitionInput input) {
        RecognitionOutcome outcome = adapter.identify(input);
        String detail = adapter.name() + ": " + outcome.kind()
                + (outcome.detail() == null ? "" : " (" + outcome.detail() + ")");
        return switch (outcome.kind()) {
            case MATCH -> TierResult.candidate(outcome.candidate(), outcome.confidence());
            case NO_MATCH, CIRCUIT_OPEN, QUOTA_EXCEEDED -> TierResult.noMatch(detail);
            case TIMEOUT, ERROR -> TierResult.error(detail);
        };
    }

    public RecognitionAdapter adapter() {
        return adapter;
    }
}
