package com.phillippitts.airplay.persistence;

import com.phillippitts.airplay.domain.Detection;
import com.phillippitts.airplay.domain.StationTrackStats;
import com.phillippitts.airplay.domain.Track;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed {@link PlayLedger}. Commits validate everything first and only then mutate, under
 * the ledger write lock; track counters are applied through {@link TrackStore#update}.
 */
public class InMemoryPlayLedger implements PlayLedger {

    private record StatsKey(long stationId, long trackId) {}

    private static final int MAX_MERGE_HOPS = 16;

    private final TrackStore trackStore;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Long, Detection> detections = new HashMap<>();
    private final Map<Long, List<Long>> byStation = new HashMap<>();
    private final Map<StatsKey, StationTrackStats> stats = new HashMap<>();
    private final AtomicLong ids = new AtomicLong();

    public InMemoryPlayLedger(TrackStore trackStore) {
        this.trackStore = Objects.requireNonNull(trackStore, "trackStore");
    }

    @Override
    public Detection commit(LedgerEntry entry) {
        Objects.requireNonNull(entry, "entry");
        lock.writeLock().lock();
        try {
            Track track = liveTrack(entry.detection().trackId());
            Detection incoming = redirect(entry.detection(), track.id());
            StatsKey key = new StatsKey(incoming.stationId(), incoming.trackId());
            StationTrackStats currentStats = stats.get(key);

            Detection stored;
            if (entry.continuation()) {
                Detection existing = detections.get(incoming.id());
                if (existing == null || existing.stationId() != incoming.stationId()) {
                    throw new IllegalArgumentException("Continuation of unknown detection id: " + incoming.id());
                }
                if (currentStats == null) {
                    throw new IllegalStateException("Missing stats for continued detection " + incoming.id());
                }
                stored = existing.withPlayDuration(incoming.playDuration());
            } else {
                long id = ids.incrementAndGet();
                stored = new Detection(id, incoming.stationId(), incoming.trackId(), incoming.confidence(),
                        incoming.source(), incoming.detectedAt(), incoming.playDuration());
            }

            // all checks passed; apply
            trackStore.update(track.id(), t -> entry.continuation()
                    ? t.withExtendedPlay(entry.playTimeDelta(), entry.playedAt())
                    : t.withNewPlay(entry.playTimeDelta(), entry.playedAt()));
            detections.put(stored.id(), stored);
            if (!entry.continuation()) {
                byStation.computeIfAbsent(stored.stationId(), k -> new ArrayList<>()).add(stored.id());
            }
            StationTrackStats nextStats;
            if (currentStats == null) {
                nextStats = StationTrackStats.first(stored.stationId(), stored.trackId(),
                        entry.playTimeDelta(), entry.playedAt());
            } else if (entry.continuation()) {
                nextStats = currentStats.withExtendedPlay(entry.playTimeDelta(), entry.playedAt());
            } else {
                nextStats = currentStats.withNewPlay(entry.playTimeDelta(), entry.playedAt());
            }
            stats.put(key, nextStats);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Track foldInto(long loserTrackId, long survivorTrackId) {
        if (loserTrackId == survivorTrackId) {
            throw new IllegalArgumentException("Cannot fold track " + loserTrackId + " into itself");
        }
        lock.writeLock().lock();
        try {
            Track survivor = liveTrack(survivorTrackId);
            Track loser = trackStore.findById(loserTrackId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown track id: " + loserTrackId));
            if (loser.isMerged()) {
                return survivor;
            }
            trackStore.update(loserTrackId, t -> t.toBuilder().mergedInto(survivor.id()).build());
            Track folded = trackStore.update(survivor.id(), t -> t.toBuilder()
                    .playCount(t.playCount() + loser.playCount())
                    .totalPlayTime(t.totalPlayTime().plus(loser.totalPlayTime()))
                    .firstPlayed(earliest(t.firstPlayed(), loser.firstPlayed()))
                    .lastPlayed(latest(t.lastPlayed(), loser.lastPlayed()))
                    .build());

            List<StatsKey> loserKeys = stats.keySet().stream().filter(k -> k.trackId() == loserTrackId).toList();
            for (StatsKey key : loserKeys) {
                StationTrackStats moved = stats.remove(key);
                StatsKey target = new StatsKey(key.stationId(), survivor.id());
                stats.merge(target, new StationTrackStats(key.stationId(), survivor.id(), moved.playCount(),
                        moved.totalPlayTime(), moved.firstPlayed(), moved.lastPlayed()), InMemoryPlayLedger::sum);
            }
            return folded;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Detection> latestForStation(long stationId) {
        lock.readLock().lock();
        try {
            List<Long> ids = byStation.get(stationId);
            if (ids == null || ids.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(detections.get(ids.get(ids.size() - 1)));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Detection> detectionsForStation(long stationId) {
        lock.readLock().lock();
        try {
            return byStation.getOrDefault(stationId, List.of()).stream().map(detections::get).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<StationTrackStats> stats(long stationId, long trackId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(stats.get(new StatsKey(stationId, trackId)));
        } finally {
            lock.readLock().unlock();
        }
    }

    private Track liveTrack(long trackId) {
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

    private static Detection redirect(Detection detection, long trackId) {
        if (detection.trackId() == trackId) {
            return detection;
        }
        return new Detection(detection.id(), detection.stationId(), trackId, detection.confidence(),
                detection.source(), detection.detectedAt(), detection.playDuration());
    }

    private static StationTrackStats sum(StationTrackStats a, StationTrackStats b) {
        return new StationTrackStats(a.stationId(), a.trackId(), a.playCount() + b.playCount(),
                a.totalPlayTime().plus(b.totalPlayTime()), earliest(a.firstPlayed(), b.firstPlayed()),
                latest(a.lastPlayed(), b.lastPlayed()));
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isBefore(b) ? a : b;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isAfter(b) ? a : b;
    }

    @Override
    public long detectionCount() {
        lock.readLock().lock();
        try {
            return detections.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
