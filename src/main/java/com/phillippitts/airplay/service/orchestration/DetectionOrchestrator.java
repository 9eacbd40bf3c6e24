package com.phillippitts.airplay.service.orchestration;

import com.phillippitts.airplay.service.adapter.RecognitionInput;

/**
 * Runs the tiered detection cascade on one captured segment.
 */
public interface DetectionOrchestrator {

    /**
     * Tries the tiers in order until one accepts. A resolution from an external tier creates or
     * merges the track in the registry and caches the fingerprint for the LOCAL tier.
     *
     * @return RESOLVED with the canonical track, or UNRESOLVED when no tier accepted
     * @throws com.phillippitts.airplay.exception.PersistenceUnavailableException if the
     *         registry's backing store is down
     */
    DetectionOutcome resolve(RecognitionInput input);
}
