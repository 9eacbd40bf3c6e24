package com.phillippitts.airplay.service.registry;

import com.phillippitts.airplay.domain.Track;

/**
 * Outcome of {@link TrackRegistry#resolveOrCreate}.
 *
 * @param track   canonical track after resolution
 * @param created true when a new track row was inserted
 * @param merged  true when the candidate was merged into an existing track
 */
public record TrackResolution(Track track, boolean created, boolean merged) {

    static TrackResolution created(Track track) {
        return new TrackResolution(track, true, false);
    }

    static TrackResolution merged(Track track) {
        return new TrackResolution(track, false, true);
    }
}
