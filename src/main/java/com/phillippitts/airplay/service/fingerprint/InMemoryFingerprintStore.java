package com.phillippitts.airplay.service.fingerprint;

import com.phillippitts.airplay.config.properties.FingerprintProperties;
import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.FingerprintEntry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed {@link FingerprintStore} with an inverted index for near-duplicate search.
 *
 * <p>Concurrency model:
 * <ul>
 *   <li>Lookups and upserts hold the read lock and run in parallel; writes to one digest are
 *       serialized by {@link ConcurrentHashMap#compute}.</li>
 *   <li>{@link #repoint(long, long)} holds the write lock, so no reader sees a track half-moved.</li>
 * </ul>
 */
public class InMemoryFingerprintStore implements FingerprintStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryFingerprintStore.class);

    private final FingerprintProperties.Similarity similarity;

    private final ConcurrentMap<String, FingerprintEntry> byDigest = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, Set<String>> byTrack = new ConcurrentHashMap<>();
    private final ConcurrentMap<Integer, Set<String>> postings = new ConcurrentHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryFingerprintStore(FingerprintProperties props) {
        this.similarity = Objects.requireNonNull(props, "props").getSimilarity();
    }

    @Override
    public Optional<FingerprintMatch> lookup(AudioFingerprint fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        lock.readLock().lock();
        try {
            FingerprintEntry exact = byDigest.get(fingerprint.digest());
            if (exact != null) {
                return Optional.of(new FingerprintMatch(exact.digest(), exact.trackId(), exact.confidence(),
                        exact.source(), FingerprintMatch.MatchType.EXACT, 1.0));
            }
            if (!similarity.isEnabled() || fingerprint.raw().length == 0) {
                return Optional.empty();
            }
            return findSimilar(fingerprint.raw());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public FingerprintEntry upsert(FingerprintEntry entry) {
        Objects.requireNonNull(entry, "entry");
        lock.readLock().lock();
        try {
            boolean[] inserted = {false};
            FingerprintEntry held = byDigest.compute(entry.digest(), (digest, current) -> {
                if (current == null) {
                    inserted[0] = true;
                    trackSet(entry.trackId()).add(digest);
                    return entry;
                }
                if (!entry.supersedes(current)) {
                    return current;
                }
                if (current.trackId() != entry.trackId()) {
                    trackSet(current.trackId()).remove(digest);
                    trackSet(entry.trackId()).add(digest);
                }
                return entry;
            });
            if (inserted[0]) {
                index(entry);
            }
            if (held != entry) {
                LOG.debug("Kept existing association for digest={} (track={}, confidence={})",
                        held.digest(), held.trackId(), held.confidence());
            }
            return held;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int repoint(long oldTrackId, long newTrackId) {
        if (oldTrackId == newTrackId) {
            return 0;
        }
        lock.writeLock().lock();
        try {
            Set<String> digests = byTrack.remove(oldTrackId);
            if (digests == null || digests.isEmpty()) {
                return 0;
            }
            Set<String> target = trackSet(newTrackId);
            int moved = 0;
            for (String digest : digests) {
                FingerprintEntry updated = byDigest.computeIfPresent(digest, (d, e) -> e.withTrackId(newTrackId));
                if (updated != null) {
                    target.add(digest);
                    moved++;
                }
            }
            LOG.info("Repointed {} fingerprint(s) from track {} to track {}", moved, oldTrackId, newTrackId);
            return moved;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<FingerprintEntry> findByDigest(String digest) {
        return Optional.ofNullable(byDigest.get(digest));
    }

    @Override
    public int size() {
        return byDigest.size();
    }

    private Optional<FingerprintMatch> findSimilar(int[] raw) {
        Map<String, Integer> hits = new HashMap<>();
        for (int key : prefixKeys(raw)) {
            Set<String> posting = postings.get(key);
            if (posting != null) {
                for (String digest : posting) {
                    hits.merge(digest, 1, Integer::sum);
                }
            }
        }
        if (hits.isEmpty()) {
            return Optional.empty();
        }
        List<String> candidates = hits.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(similarity.getMaxCandidates())
                .map(Map.Entry::getKey)
                .toList();

        FingerprintEntry bestEntry = null;
        double bestScore = 0.0;
        for (String digest : candidates) {
            FingerprintEntry candidate = byDigest.get(digest);
            if (candidate == null) {
                continue;
            }
            double score = FingerprintSimilarity.similarity(raw, candidate.raw(), similarity.getMaxOffset());
            if (score > bestScore) {
                bestScore = score;
                bestEntry = candidate;
            }
        }
        if (bestEntry == null || bestScore < similarity.getFloor()) {
            LOG.debug("No near-duplicate above floor {} (best={})", similarity.getFloor(), bestScore);
            return Optional.empty();
        }
        return Optional.of(new FingerprintMatch(bestEntry.digest(), bestEntry.trackId(),
                bestEntry.confidence() * bestScore, bestEntry.source(),
                FingerprintMatch.MatchType.SIMILAR, bestScore));
    }

    private void index(FingerprintEntry entry) {
        for (int key : prefixKeys(entry.raw())) {
            Set<String> posting = postings.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet());
            if (posting.size() < similarity.getMaxPostingsPerKey()) {
                posting.add(entry.digest());
            }
        }
    }

    private Set<Integer> prefixKeys(int[] raw) {
        int n = Math.min(raw.length, similarity.getIndexedPrefix());
        Set<Integer> keys = new HashSet<>(n * 2);
        for (int i = 0; i < n; i++) {
            keys.add(FingerprintSimilarity.indexKey(raw[i]));
        }
        return keys;
    }

    private Set<String> trackSet(long trackId) {
        return byTrack.computeIfAbsent(trackId, k -> ConcurrentHashMap.newKeySet());
    }
}
