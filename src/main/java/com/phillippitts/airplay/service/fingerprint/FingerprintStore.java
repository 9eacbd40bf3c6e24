package com.phillippitts.airplay.service.fingerprint;

import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.FingerprintEntry;

import java.util.Optional;

/**
 * Local cache of fingerprints already resolved to a track.
 *
 * <p>A digest maps to exactly one track at a time. Implementations serialize writes per digest
 * and make {@link #repoint(long, long)} atomic with respect to lookups.
 */
public interface FingerprintStore {

    /**
     * Exact digest lookup, then (if enabled) a near-duplicate search.
     */
    Optional<FingerprintMatch> lookup(AudioFingerprint fingerprint);

    /**
     * Stores the association unless the current one for the digest has a higher confidence
     * (or the same confidence and a later verification time).
     *
     * @return the association held for the digest after the call
     */
    FingerprintEntry upsert(FingerprintEntry entry);

    /**
     * Moves every entry of {@code oldTrackId} to {@code newTrackId}.
     *
     * @return number of entries moved
     */
    int repoint(long oldTrackId, long newTrackId);

    Optional<FingerprintEntry> findByDigest(String digest);

    int size();
}
