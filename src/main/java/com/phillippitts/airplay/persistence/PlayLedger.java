package com.phillippitts.airplay.persistence;

import com.phillippitts.airplay.domain.Detection;
import com.phillippitts.airplay.domain.StationTrackStats;
import com.phillippitts.airplay.domain.Track;

import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator for detections and per-station play statistics.
 */
public interface PlayLedger {

    /**
     * Applies the detection row, the track counters and the station-track stats as one unit.
     * On any failure nothing is applied.
     *
     * @return the stored detection (with its assigned id on insert)
     */
    Detection commit(LedgerEntry entry);

    /**
     * Marks {@code loserTrackId} as merged into {@code survivorTrackId} and folds its play counters
     * and station-track stats into the survivor, atomically with respect to {@link #commit}.
     * Later commits naming the loser are applied to the survivor.
     *
     * @return the survivor after folding
     */
    Track foldInto(long loserTrackId, long survivorTrackId);

    Optional<Detection> latestForStation(long stationId);

    List<Detection> detectionsForStation(long stationId);

    Optional<StationTrackStats> stats(long stationId, long trackId);

    long detectionCount();
}
