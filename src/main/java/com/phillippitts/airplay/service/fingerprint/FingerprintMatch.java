package com.phillippitts.airplay.service.fingerprint;

import com.phillippitts.airplay.domain.DetectionSource;

/**
 * Result of a local fingerprint lookup.
 *
 * @param digest     digest of the matching stored entry
 * @param trackId    track the entry points to (may be a merged alias; canonicalize before use)
 * @param confidence entry confidence scaled by similarity
 * @param source     source that originally verified the entry
 * @param matchType  exact digest hit or near-duplicate
 * @param similarity 1.0 for exact matches, otherwise 1 - bit error rate at the best alignment
 */
public record FingerprintMatch(
        String digest,
        long trackId,
        double confidence,
        DetectionSource source,
        MatchType matchType,
        double similarity
) {
    public enum MatchType { EXACT, SIMILAR }
}
