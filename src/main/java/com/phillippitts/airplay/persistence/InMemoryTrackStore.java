package com.phillippitts.airplay.persistence;

import com.phillippitts.airplay.domain.Track;
import com.phillippitts.airplay.exception.RegistryConflictException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Heap-backed {@link TrackStore}. The ISRC index is the unique constraint: claims go through
 * {@link ConcurrentHashMap#putIfAbsent}, so two racing inserts of one ISRC cannot both succeed.
 *
 * <p>Recency is kept ordered by touch sequence, so {@link #findRecent} reads only the head it
 * returns. Merged tracks leave the recency order for good.
 */
public class InMemoryTrackStore implements TrackStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryTrackStore.class);

    private final Map<Long, Track> tracks = new ConcurrentHashMap<>();
    private final Map<String, Long> isrcIndex = new ConcurrentHashMap<>();
    private final Map<Long, Long> lastTouch = new ConcurrentHashMap<>();
    private final NavigableMap<Long, Long> byTouch = new ConcurrentSkipListMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final AtomicLong touches = new AtomicLong();

    @Override
    public Track insert(Track draft) {
        Objects.requireNonNull(draft, "draft");
        long id = ids.incrementAndGet();
        Track track = draft.withId(id);
        if (track.isrc() != null) {
            Long owner = isrcIndex.putIfAbsent(track.isrc(), id);
            if (owner != null) {
                throw new RegistryConflictException(track.isrc());
            }
        }
        tracks.put(id, track);
        touch(track);
        LOG.debug("Inserted track id={} isrc={}", id, track.isrc());
        return track;
    }

    @Override
    public Optional<Track> findById(long id) {
        return Optional.ofNullable(tracks.get(id));
    }

    @Override
    public Optional<Track> findByIsrc(String isrc) {
        if (isrc == null) {
            return Optional.empty();
        }
        Long id = isrcIndex.get(isrc);
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public List<Track> findRecent(int limit) {
        return byTouch.descendingMap().values().stream()
                .map(tracks::get)
                .filter(t -> t != null && !t.isMerged())
                .limit(limit)
                .toList();
    }

    @Override
    public Track update(long id, UnaryOperator<Track> change) {
        Track updated = tracks.compute(id, (key, current) -> {
            if (current == null) {
                throw new IllegalArgumentException("Unknown track id: " + id);
            }
            Track next = Objects.requireNonNull(change.apply(current), "change result");
            if (next.id() != id) {
                throw new IllegalArgumentException("Track id must not change: " + id + " -> " + next.id());
            }
            reindexIsrc(id, current.isrc(), next.isrc());
            return next;
        });
        touch(updated);
        return updated;
    }

    @Override
    public long count() {
        return tracks.size();
    }

    private void reindexIsrc(long id, String previous, String next) {
        if (Objects.equals(previous, next)) {
            return;
        }
        if (next != null) {
            Long owner = isrcIndex.putIfAbsent(next, id);
            if (owner != null && owner != id) {
                throw new RegistryConflictException(next);
            }
        }
        if (previous != null) {
            isrcIndex.remove(previous, id);
        }
    }

    private void touch(Track track) {
        long id = track.id();
        lastTouch.compute(id, (key, previous) -> {
            if (previous != null) {
                byTouch.remove(previous);
            }
            if (track.isMerged()) {
                return null;
            }
            long seq = touches.incrementAndGet();
            byTouch.put(seq, id);
            return seq;
        });
    }
}
