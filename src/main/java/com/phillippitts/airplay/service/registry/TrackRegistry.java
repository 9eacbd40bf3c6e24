package com.phillippitts.airplay.service.registry;

import com.phillippitts.airplay.domain.Track;
import com.phillippitts.airplay.domain.TrackCandidate;

import java.util.Optional;

/**
 * Canonical track identity: creates tracks on first recognition and merges identities
 * reported by different sources.
 */
public interface TrackRegistry {

    /**
     * Resolves a recognized candidate to a canonical track, creating it when unknown.
     * ISRC collisions are resolved internally and never surface to the caller.
     *
     * @param confidence confidence of the source that produced the candidate
     */
    TrackResolution resolveOrCreate(TrackCandidate candidate, double confidence);

    /**
     * Follows merge links to the surviving track.
     *
     * @throws IllegalArgumentException if the id is unknown
     */
    Track canonical(long trackId);

    Optional<Track> findById(long trackId);
}
