package com.phillippitts.airplay.service.orchestration;

import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.service.adapter.RecognitionInput;
import com.phillippitts.airplay.service.fingerprint.FingerprintMatch;
import com.phillippitts.airplay.service.fingerprint.FingerprintStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * LOCAL tier: looks the fingerprint up in the {@link FingerprintStore}. Costs no quota.
 *
 * <p>A failing store degrades to a miss so the cascade can still reach the external tiers.
 */
public class LocalTier implements DetectionTier {

    private static final Logger LOG = LogManager.getLogger(LocalTier.class);

    private final FingerprintStore store;

    public LocalTier(FingerprintStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public DetectionSource source() {
        return DetectionSource.LOCAL;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public TierResult attempt(RecognitionInput input) {
        AudioFingerprint fingerprint = input.fingerprint();
        if (fingerprint == null) {
            return TierResult.noMatch("no fingerprint");
        }
        Optional<FingerprintMatch> match;
        try {
            match = store.lookup(fingerprint);
        } catch (RuntimeException e) {
            LOG.warn("Fingerprint store lookup failed for station {}; treating as miss: {}",
                    input.stationId(), e.getMessage());
            return TierResult.noMatch("store unavailable");
        }
        return match
                .map(m -> TierResult.knownTrack(m.trackId(), m.confidence(),
                        m.matchType().name().toLowerCase() + " match"))
                .orElseGet(() -> TierResult.noMatch("unknown fingerprint"));
    }
}
