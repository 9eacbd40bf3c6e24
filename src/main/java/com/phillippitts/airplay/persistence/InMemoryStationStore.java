package com.phillippitts.airplay.persistence;

import com.phillippitts.airplay.domain.Station;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed {@link StationStore}, seeded from configuration.
 */
public class InMemoryStationStore implements StationStore {

    private final Map<Long, Station> stations = new ConcurrentHashMap<>();

    public InMemoryStationStore(Collection<Station> initial) {
        initial.forEach(this::save);
    }

    @Override
    public List<Station> findActive() {
        return stations.values().stream()
                .filter(Station::active)
                .sorted(Comparator.comparingLong(Station::id))
                .toList();
    }

    @Override
    public Optional<Station> findById(long id) {
        return Optional.ofNullable(stations.get(id));
    }

    @Override
    public Station save(Station station) {
        stations.put(station.id(), station);
        return station;
    }

    @Override
    public void markChecked(long stationId, Instant at) {
        stations.computeIfPresent(stationId, (id, s) -> s.withLastChecked(at));
    }
}
