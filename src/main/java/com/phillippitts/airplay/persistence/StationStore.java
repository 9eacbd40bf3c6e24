package com.phillippitts.airplay.persistence;

import com.phillippitts.airplay.domain.Station;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator for monitored stations.
 */
public interface StationStore {

    List<Station> findActive();

    Optional<Station> findById(long id);

    Station save(Station station);

    void markChecked(long stationId, Instant at);
}
