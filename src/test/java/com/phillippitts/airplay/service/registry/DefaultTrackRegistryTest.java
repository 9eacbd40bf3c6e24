package com.phillippitts.airplay.service.registry;

import com.phillippitts.airplay.config.properties.FingerprintProperties;
import com.phillippitts.airplay.config.properties.RegistryProperties;
import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.Detection;
import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.domain.FingerprintEntry;
import com.phillippitts.airplay.domain.Track;
import com.phillippitts.airplay.domain.TrackCandidate;
import com.phillippitts.airplay.persistence.InMemoryPlayLedger;
import com.phillippitts.airplay.persistence.InMemoryTrackStore;
import com.phillippitts.airplay.persistence.LedgerEntry;
import com.phillippitts.airplay.service.fingerprint.InMemoryFingerprintStore;
import com.phillippitts.airplay.testutil.EventCapturingPublisher;
import com.phillippitts.airplay.testutil.TestFingerprints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultTrackRegistryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryTrackStore trackStore;
    private InMemoryPlayLedger ledger;
    private InMemoryFingerprintStore fingerprints;
    private EventCapturingPublisher publisher;
    private DefaultTrackRegistry registry;

    @BeforeEach
    void setUp() {
        trackStore = new InMemoryTrackStore();
        ledger = new InMemoryPlayLedger(trackStore);
        fingerprints = new InMemoryFingerprintStore(new FingerprintProperties());
        publisher = new EventCapturingPublisher();
        registry = new DefaultTrackRegistry(trackStore, ledger, fingerprints, new RegistryProperties(100), publisher);
    }

    @Test
    void createsTrackWithNormalizedIsrc() {
        TrackResolution resolution = registry.resolveOrCreate(candidate("Halo", "Beyonce", "us-sm1-08-03370"), 0.9);

        assertThat(resolution.created()).isTrue();
        assertThat(resolution.track().isrc()).isEqualTo("USSM10803370");
        assertThat(resolution.track().playCount()).isZero();
        assertThat(trackStore.count()).isEqualTo(1);
    }

    @Test
    void invalidIsrcIsDropped() {
        Track track = registry.resolveOrCreate(candidate("Halo", "Beyonce", "not-an-isrc"), 0.9).track();

        assertThat(track.isrc()).isNull();
    }

    @Test
    void sameIsrcFromAnotherSourceMergesAndFillsGaps() {
        Track first = registry.resolveOrCreate(candidate("halo", "beyonce", "USSM10803370"), 0.6).track();
        TrackCandidate richer = new TrackCandidate("Halo", "Beyoncé", "I Am... Sasha Fierce", "USSM10803370",
                "Columbia", "2008-11-12", Map.of("spotify", "sp-halo"));

        TrackResolution second = registry.resolveOrCreate(richer, 0.95);

        assertThat(second.created()).isFalse();
        assertThat(second.merged()).isTrue();
        assertThat(second.track().id()).isEqualTo(first.id());
        assertThat(second.track().title()).isEqualTo("Halo");
        assertThat(second.track().artist()).isEqualTo("Beyoncé");
        assertThat(second.track().album()).isEqualTo("I Am... Sasha Fierce");
        assertThat(second.track().label()).isEqualTo("Columbia");
        assertThat(second.track().externalIds()).containsEntry("spotify", "sp-halo");
        assertThat(trackStore.count()).isEqualTo(1);
    }

    @Test
    void lowerConfidenceSourceDoesNotOverrideIdentity() {
        registry.resolveOrCreate(candidate("Halo", "Beyonce", "USSM10803370"), 0.95);

        Track after = registry.resolveOrCreate(candidate("HALO (live)", "Beyonce", "USSM10803370"), 0.7).track();

        assertThat(after.title()).isEqualTo("Halo");
    }

    @Test
    void textMatchWithoutIsrcReusesTrackAndAdoptsIsrcLater() {
        Track fromMetadata = registry.resolveOrCreate(candidate("Halo (Radio Edit)", "Beyoncé", null), 0.8).track();

        TrackResolution fromFingerprint = registry.resolveOrCreate(candidate("Halo", "Beyonce", "USSM10803370"), 0.9);

        assertThat(fromFingerprint.track().id()).isEqualTo(fromMetadata.id());
        assertThat(fromFingerprint.track().isrc()).isEqualTo("USSM10803370");
        assertThat(trackStore.count()).isEqualTo(1);
    }

    @Test
    void differentIsrcsWithSameTextStaySeparate() {
        Track studio = registry.resolveOrCreate(candidate("Halo", "Beyonce", "USSM10803370"), 0.9).track();

        TrackResolution remaster = registry.resolveOrCreate(candidate("Halo", "Beyonce", "USSM12000001"), 0.9);

        assertThat(remaster.created()).isTrue();
        assertThat(remaster.track().id()).isNotEqualTo(studio.id());
    }

    @Test
    void isrcOwnerAbsorbsIsrclessDuplicate() {
        // Arrange: an ISRC-less track with a play and a fingerprint, and a separate ISRC owner
        Track duplicate = registry.resolveOrCreate(candidate("Halo", "Beyonce", null), 0.8).track();
        ledger.commit(LedgerEntry.newPlay(new Detection(0, 1L, duplicate.id(), 0.8, DetectionSource.METADATA,
                T0, Duration.ofSeconds(10))));
        AudioFingerprint fp = TestFingerprints.random(5);
        fingerprints.upsert(new FingerprintEntry(fp.digest(), fp.raw(), duplicate.id(), 0.8,
                DetectionSource.METADATA, T0));
        Track owner = registry.resolveOrCreate(candidate("Halo - Single Version", "Beyonce", "USSM10803370"), 0.9)
                .track();
        assertThat(owner.id()).isNotEqualTo(duplicate.id());

        // Act: the ISRC arrives with the duplicate's title
        Track survivor = registry.resolveOrCreate(candidate("Halo", "Beyonce", "USSM10803370"), 0.9).track();

        // Assert
        assertThat(survivor.id()).isEqualTo(owner.id());
        assertThat(survivor.playCount()).isEqualTo(1);
        assertThat(survivor.totalPlayTime()).isEqualTo(Duration.ofSeconds(10));
        assertThat(registry.canonical(duplicate.id()).id()).isEqualTo(owner.id());
        assertThat(fingerprints.lookup(fp)).hasValueSatisfying(m -> assertThat(m.trackId()).isEqualTo(owner.id()));
        assertThat(ledger.stats(1L, owner.id())).hasValueSatisfying(s -> assertThat(s.playCount()).isEqualTo(1));
        assertThat(publisher.eventsOf(TrackMergedEvent.class)).singleElement().satisfies(e -> {
            assertThat(e.mergedTrackId()).isEqualTo(duplicate.id());
            assertThat(e.survivorTrackId()).isEqualTo(owner.id());
            assertThat(e.fingerprintsMoved()).isEqualTo(1);
        });
    }

    @Test
    void concurrentCreationOfOneIsrcYieldsSingleTrack() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Long> ids = new CopyOnWriteArrayList<>();
        try {
            for (int i = 0; i < 16; i++) {
                String title = i % 2 == 0 ? "Halo" : "Halo (Live " + i + ")";
                pool.submit(() -> {
                    start.await();
                    ids.add(registry.resolveOrCreate(candidate(title, "Beyonce", "USSM10803370"), 0.9).track().id());
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(ids).hasSize(16);
        assertThat(ids.stream().distinct()).hasSize(1);
        assertThat(trackStore.count()).isEqualTo(1);
    }

    @Test
    void concurrentCreationWithoutIsrcYieldsSingleTrack() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Long> ids = new CopyOnWriteArrayList<>();
        try {
            for (int i = 0; i < 16; i++) {
                String title = i % 2 == 0 ? "Halo" : "HALO (Radio Edit)";
                pool.submit(() -> {
                    start.await();
                    ids.add(registry.resolveOrCreate(candidate(title, "Beyonce", null), 0.9).track().id());
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(ids).hasSize(16);
        assertThat(ids.stream().distinct()).hasSize(1);
        assertThat(trackStore.count()).isEqualTo(1);
        assertThat(trackStore.findById(ids.get(0))).hasValueSatisfying(t -> assertThat(t.isrc()).isNull());
    }

    @Test
    void decorationOnlyTitlesStayDistinctTracks() {
        Track video = registry.resolveOrCreate(candidate("Video", "India Arie", null), 0.9).track();
        Track audio = registry.resolveOrCreate(candidate("Audio", "India Arie", null), 0.9).track();

        assertThat(audio.id()).isNotEqualTo(video.id());
        assertThat(trackStore.count()).isEqualTo(2);
    }

    @Test
    void canonicalOfUnknownIdThrows() {
        assertThatThrownBy(() -> registry.canonical(404L)).isInstanceOf(IllegalArgumentException.class);
    }

    private static TrackCandidate candidate(String title, String artist, String isrc) {
        return new TrackCandidate(title, artist, null, isrc, null, null, Map.of());
    }
}
