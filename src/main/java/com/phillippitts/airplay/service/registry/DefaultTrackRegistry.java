package com.phillippitts.airplay.service.registry;

import com.phillippitts.airplay.config.properties.RegistryProperties;
import com.phillippitts.airplay.domain.Track;
import com.phillippitts.airplay.domain.TrackCandidate;
import com.phillippitts.airplay.exception.RegistryConflictException;
import com.phillippitts.airplay.persistence.PlayLedger;
import com.phillippitts.airplay.persistence.TrackStore;
import com.phillippitts.airplay.service.fingerprint.FingerprintStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.IntStream;

/**
 * Default {@link TrackRegistry}.
 *
 * <p>Resolution order for a candidate:
 * <ol>
 *   <li>Known ISRC: merge metadata into the owner and absorb ISRC-less text duplicates.</li>
 *   <li>Normalized (title, artist) match among recent tracks, unless both carry different ISRCs.</li>
 *   <li>Create. A unique-ISRC conflict raised by the store is resolved by re-reading and merging.</li>
 * </ol>
 *
 * <p>Work for one identity runs under striped locks covering both its ISRC key and its text key,
 * acquired in stripe order.
 */
public class DefaultTrackRegistry implements TrackRegistry {

    private static final Logger LOG = LogManager.getLogger(DefaultTrackRegistry.class);

    private static final int STRIPES = 64;
    private static final int MAX_MERGE_HOPS = 16;

    private final TrackStore trackStore;
    private final PlayLedger playLedger;
    private final FingerprintStore fingerprintStore;
    private final int recentWindow;
    private final ApplicationEventPublisher publisher;
    private final ReentrantLock[] stripes = new ReentrantLock[STRIPES];

    public DefaultTrackRegistry(TrackStore trackStore,
                                PlayLedger playLedger,
                                FingerprintStore fingerprintStore,
                                RegistryProperties props,
                                ApplicationEventPublisher publisher) {
        this.trackStore = Objects.requireNonNull(trackStore, "trackStore");
        this.playLedger = Objects.requireNonNull(playLedger, "playLedger");
        this.fingerprintStore = Objects.requireNonNull(fingerprintStore, "fingerprintStore");
        this.recentWindow = Objects.requireNonNull(props, "props").recentWindow();
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @Override
    public TrackResolution resolveOrCreate(TrackCandidate candidate, double confidence) {
        Objects.requireNonNull(candidate, "candidate");
        String isrc = IsrcCodes.normalize(candidate.isrc());
        if (candidate.isrc() != null && isrc == null) {
            LOG.debug("Dropping invalid ISRC '{}' for '{}'", candidate.isrc(), candidate.title());
        }
        String textKey = TitleNormalizer.key(candidate.title(), candidate.artist());

        List<String> lockKeys = new ArrayList<>(2);
        lockKeys.add("text:" + textKey);
        if (isrc != null) {
            lockKeys.add("isrc:" + isrc);
        }
        return withLocks(lockKeys, () -> resolveLocked(candidate, isrc, textKey, confidence));
    }

    @Override
    public Track canonical(long trackId) {
        Track track = trackStore.findById(trackId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown track id: " + trackId));
        int hops = 0;
        while (track.isMerged()) {
            if (++hops > MAX_MERGE_HOPS) {
                throw new IllegalStateException("Merge chain too long from track " + trackId);
            }
            long next = track.mergedInto();
            track = trackStore.findById(next)
                    .orElseThrow(() -> new IllegalStateException("Dangling merge link to track " + next));
        }
        return track;
    }

    @Override
    public Optional<Track> findById(long trackId) {
        return trackStore.findById(trackId);
    }

    private TrackResolution resolveLocked(TrackCandidate candidate, String isrc, String textKey, double confidence) {
        if (isrc != null) {
            Optional<Track> owner = trackStore.findByIsrc(isrc);
            if (owner.isPresent()) {
                Track merged = mergeMetadata(owner.get(), candidate, isrc, confidence);
                merged = absorbTextDuplicates(merged, textKey);
                LOG.debug("Resolved '{}' by ISRC {} to track {}", candidate.title(), isrc, merged.id());
                return TrackResolution.merged(merged);
            }
        }

        Optional<Track> textMatch = findByText(textKey, isrc);
        if (textMatch.isPresent()) {
            Track matched = textMatch.get();
            try {
                Track merged = mergeMetadata(matched, candidate, isrc, confidence);
                LOG.debug("Resolved '{}' by title/artist to track {}", candidate.title(), merged.id());
                return TrackResolution.merged(merged);
            } catch (RegistryConflictException e) {
                return mergeIntoOwner(e, candidate, confidence);
            }
        }

        try {
            Track created = trackStore.insert(Track.fromCandidate(0, candidate, isrc, confidence));
            LOG.info("Created track id={} title='{}' artist='{}' isrc={}",
                    created.id(), created.title(), created.artist(), created.isrc());
            return TrackResolution.created(created);
        } catch (RegistryConflictException e) {
            return mergeIntoOwner(e, candidate, confidence);
        }
    }

    private TrackResolution mergeIntoOwner(RegistryConflictException conflict, TrackCandidate candidate,
                                           double confidence) {
        Track owner = trackStore.findByIsrc(conflict.getIsrc()).orElseThrow(() -> conflict);
        LOG.info("ISRC {} already owned by track {}; merging '{}'", conflict.getIsrc(), owner.id(), candidate.title());
        return TrackResolution.merged(mergeMetadata(owner, candidate, conflict.getIsrc(), confidence));
    }

    private Optional<Track> findByText(String textKey, String isrc) {
        return trackStore.findRecent(recentWindow).stream()
                .filter(t -> TitleNormalizer.key(t.title(), t.artist()).equals(textKey))
                .filter(t -> isrc == null || t.isrc() == null || t.isrc().equals(isrc))
                .findFirst();
    }

    /**
     * Fills missing fields from the candidate; title and artist are only replaced by a source with
     * strictly higher confidence. The track adopts the ISRC when it has none.
     */
    private Track mergeMetadata(Track track, TrackCandidate candidate, String isrc, double confidence) {
        return trackStore.update(track.id(), current -> {
            Track.Builder b = current.toBuilder().addExternalIds(candidate.externalIds());
            if (confidence > current.identityConfidence()) {
                b.title(candidate.title()).artist(candidate.artist()).identityConfidence(confidence);
            }
            if (current.album() == null) {
                b.album(candidate.album());
            }
            if (current.label() == null) {
                b.label(candidate.label());
            }
            if (current.releaseDate() == null) {
                b.releaseDate(candidate.releaseDate());
            }
            if (current.isrc() == null && isrc != null) {
                b.isrc(isrc);
            }
            return b.build();
        });
    }

    /**
     * Merges live ISRC-less tracks with the same normalized title/artist into the ISRC owner:
     * counters fold, fingerprints are re-pointed and the loser keeps a merge link.
     */
    private Track absorbTextDuplicates(Track owner, String textKey) {
        List<Track> duplicates = trackStore.findRecent(recentWindow).stream()
                .filter(t -> t.id() != owner.id() && t.isrc() == null)
                .filter(t -> TitleNormalizer.key(t.title(), t.artist()).equals(textKey))
                .toList();
        Track survivor = owner;
        for (Track loser : duplicates) {
            survivor = playLedger.foldInto(loser.id(), owner.id());
            Track current = survivor;
            survivor = trackStore.update(owner.id(), t -> t.toBuilder()
                    .addExternalIds(loser.externalIds())
                    .album(t.album() != null ? t.album() : loser.album())
                    .label(t.label() != null ? t.label() : loser.label())
                    .releaseDate(t.releaseDate() != null ? t.releaseDate() : loser.releaseDate())
                    .build());
            int moved = fingerprintStore.repoint(loser.id(), owner.id());
            LOG.info("Merged track {} into {} (isrc={}, plays +{}, fingerprints moved={})",
                    loser.id(), owner.id(), current.isrc(), loser.playCount(), moved);
            publisher.publishEvent(new TrackMergedEvent(loser.id(), owner.id(), current.isrc(), moved, Instant.now()));
        }
        return survivor;
    }

    private <T> T withLocks(List<String> keys, Supplier<T> action) {
        int[] order = keys.stream().mapToInt(this::stripe).distinct().sorted().toArray();
        for (int idx : order) {
            stripes[idx].lock();
        }
        try {
            return action.get();
        } finally {
            IntStream.range(0, order.length).map(i -> order[order.length - 1 - i])
                    .forEach(idx -> stripes[idx].unlock());
        }
    }

    private int stripe(String key) {
        return Math.floorMod(key.hashCode(), STRIPES);
    }
}
