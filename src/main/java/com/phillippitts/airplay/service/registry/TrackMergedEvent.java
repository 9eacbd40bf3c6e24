package com.phillippitts.airplay.service.registry;

import java.time.Instant;

/**
 * Published when an ISRC-less duplicate is merged into the track owning the ISRC.
 *
 * @param mergedTrackId      track that now aliases the survivor
 * @param survivorTrackId    track that kept the identity
 * @param isrc               ISRC of the survivor
 * @param fingerprintsMoved  fingerprint entries re-pointed to the survivor
 */
public record TrackMergedEvent(
        long mergedTrackId,
        long survivorTrackId,
        String isrc,
        int fingerprintsMoved,
        Instant at
) {
    public TrackMergedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
