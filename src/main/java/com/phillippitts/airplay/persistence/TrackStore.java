package com.phillippitts.airplay.persistence;

import com.phillippitts.airplay.domain.Track;
import com.phillippitts.airplay.exception.RegistryConflictException;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence collaborator for canonical tracks.
 *
 * <p>Implementations must enforce a unique index on non-null ISRC across live tracks and apply
 * {@link #update(long, UnaryOperator)} atomically per track.
 */
public interface TrackStore {

    /**
     * Inserts a new track and assigns its id; the id of {@code draft} is ignored.
     *
     * @throws RegistryConflictException if another track already owns the draft's ISRC
     */
    Track insert(Track draft);

    Optional<Track> findById(long id);

    Optional<Track> findByIsrc(String isrc);

    /**
     * Most recently created or played live (non-merged) tracks, newest first.
     */
    List<Track> findRecent(int limit);

    /**
     * Atomically replaces a track with {@code change.apply(current)}.
     *
     * @return the stored track
     * @throws RegistryConflictException if the change assigns an ISRC owned by another track
     * @throws IllegalArgumentException if no track has this id
     */
    Track update(long id, UnaryOperator<Track> change);

    long count();
}
