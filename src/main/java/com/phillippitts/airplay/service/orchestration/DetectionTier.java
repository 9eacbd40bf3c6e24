package com.phillippitts.airplay.service.orchestration;

import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.service.adapter.RecognitionInput;

/**
 * One step of the detection cascade. Tiers are tried in {@link DetectionSource} order.
 */
public interface DetectionTier {

    DetectionSource source();

    /**
     * False when the tier is disabled (e.g. missing credentials); the cascade skips it without
     * recording an attempt.
     */
    boolean isAvailable();

    /**
     * Attempts recognition. Implementations report failures as {@link TierResult.Kind#ERROR}
     * rather than throwing.
     */
    TierResult attempt(RecognitionInput input);
}
