package com.phillippitts.airplay.config;

import com.phillippitts.airplay.config.properties.AdapterProperties;
import com.phillippitts.airplay.config.properties.CaptureProperties;
import com.phillippitts.airplay.config.properties.DetectionProperties;
import com.phillippitts.airplay.config.properties.FingerprintProperties;
import com.phillippitts.airplay.config.properties.RecorderProperties;
import com.phillippitts.airplay.config.properties.RegistryProperties;
import com.phillippitts.airplay.config.properties.SchedulerProperties;
import com.phillippitts.airplay.config.properties.StationProperties;
import com.phillippitts.airplay.persistence.InMemoryPlayLedger;
import com.phillippitts.airplay.persistence.InMemoryStationStore;
import com.phillippitts.airplay.persistence.InMemoryTrackStore;
import com.phillippitts.airplay.persistence.PlayLedger;
import com.phillippitts.airplay.persistence.StationStore;
import com.phillippitts.airplay.persistence.TrackStore;
import com.phillippitts.airplay.service.adapter.RecognitionAdapter;
import com.phillippitts.airplay.service.adapter.acoustid.AcoustIdFingerprintAdapter;
import com.phillippitts.airplay.service.adapter.audd.AuddFullAudioAdapter;
import com.phillippitts.airplay.service.adapter.http.HttpTransport;
import com.phillippitts.airplay.service.adapter.http.JdkHttpTransport;
import com.phillippitts.airplay.service.adapter.musicbrainz.MusicBrainzMetadataAdapter;
import com.phillippitts.airplay.service.capture.AudioCaptureService;
import com.phillippitts.airplay.service.capture.HttpStreamCaptureService;
import com.phillippitts.airplay.service.fingerprint.FingerprintGenerator;
import com.phillippitts.airplay.service.fingerprint.FingerprintStore;
import com.phillippitts.airplay.service.fingerprint.InMemoryFingerprintStore;
import com.phillippitts.airplay.service.fingerprint.chromaprint.ChromaprintFingerprintGenerator;
import com.phillippitts.airplay.service.fingerprint.chromaprint.FpcalcProcessManager;
import com.phillippitts.airplay.service.health.AdapterHealthIndicator;
import com.phillippitts.airplay.service.health.HealthSummaryReporter;
import com.phillippitts.airplay.service.health.StationHealthIndicator;
import com.phillippitts.airplay.service.metrics.DetectionMetrics;
import com.phillippitts.airplay.service.orchestration.AdapterTier;
import com.phillippitts.airplay.service.orchestration.DefaultDetectionOrchestrator;
import com.phillippitts.airplay.service.orchestration.DefaultDetectionService;
import com.phillippitts.airplay.service.orchestration.DetectionOrchestrator;
import com.phillippitts.airplay.service.orchestration.DetectionPipeline;
import com.phillippitts.airplay.service.orchestration.DetectionService;
import com.phillippitts.airplay.service.orchestration.DetectionTier;
import com.phillippitts.airplay.service.orchestration.LocalTier;
import com.phillippitts.airplay.service.recorder.DefaultDetectionRecorder;
import com.phillippitts.airplay.service.recorder.DetectionRecorder;
import com.phillippitts.airplay.service.registry.DefaultTrackRegistry;
import com.phillippitts.airplay.service.registry.TrackRegistry;
import com.phillippitts.airplay.service.scheduler.DeadlineExecutor;
import com.phillippitts.airplay.service.scheduler.StationScheduler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the detection pipeline: persistence collaborators, fingerprinting, registry,
 * recognition adapters, the tier cascade, the recorder and the station scheduler.
 */
@Configuration
public class PipelineConfig {

    private static final Logger LOG = LogManager.getLogger(PipelineConfig.class);

    private static final Duration HTTP_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TrackStore trackStore() {
        return new InMemoryTrackStore();
    }

    @Bean
    public PlayLedger playLedger(TrackStore trackStore) {
        return new InMemoryPlayLedger(trackStore);
    }

    @Bean
    public StationStore stationStore(StationProperties stationProperties) {
        InMemoryStationStore store = new InMemoryStationStore(stationProperties.toStations());
        LOG.info("Loaded {} active station(s)", store.findActive().size());
        return store;
    }

    @Bean
    public FingerprintStore fingerprintStore(FingerprintProperties props) {
        return new InMemoryFingerprintStore(props);
    }

    @Bean
    public FingerprintGenerator fingerprintGenerator(FingerprintProperties props) {
        return new ChromaprintFingerprintGenerator(new FpcalcProcessManager(props));
    }

    @Bean
    public TrackRegistry trackRegistry(TrackStore trackStore, PlayLedger playLedger, FingerprintStore fingerprintStore,
                                       RegistryProperties props, ApplicationEventPublisher publisher) {
        return new DefaultTrackRegistry(trackStore, playLedger, fingerprintStore, props, publisher);
    }

    @Bean
    public HttpTransport httpTransport() {
        return new JdkHttpTransport(HTTP_CONNECT_TIMEOUT);
    }

    @Bean
    public MusicBrainzMetadataAdapter musicBrainzMetadataAdapter(AdapterProperties props, HttpTransport transport,
                                                                 ApplicationEventPublisher publisher, Clock clock) {
        return new MusicBrainzMetadataAdapter(props.getMusicbrainz(), transport, publisher, clock);
    }

    @Bean
    public AcoustIdFingerprintAdapter acoustIdFingerprintAdapter(AdapterProperties props, HttpTransport transport,
                                                                 ApplicationEventPublisher publisher, Clock clock) {
        return new AcoustIdFingerprintAdapter(props.getAcoustid(), transport, publisher, clock);
    }

    @Bean
    public AuddFullAudioAdapter auddFullAudioAdapter(AdapterProperties props, HttpTransport transport,
                                                     ApplicationEventPublisher publisher, Clock clock) {
        return new AuddFullAudioAdapter(props.getAudd(), transport, publisher, clock);
    }

    @Bean
    public DetectionOrchestrator detectionOrchestrator(List<RecognitionAdapter> adapters,
                                                       FingerprintStore fingerprintStore,
                                                       TrackRegistry registry,
                                                       DetectionProperties props,
                                                       DetectionMetrics metrics,
                                                       Clock clock) {
        List<DetectionTier> tiers = new ArrayList<>();
        tiers.add(new LocalTier(fingerprintStore));
        for (RecognitionAdapter adapter : adapters) {
            tiers.add(new AdapterTier(adapter));
            LOG.info("Recognition adapter {} ({}) {}", adapter.name(), adapter.source().label(),
                    adapter.isEnabled() ? "enabled" : "disabled (missing credentials or switched off)");
        }
        return new DefaultDetectionOrchestrator(tiers, registry, fingerprintStore, props, metrics, clock);
    }

    @Bean
    public DetectionRecorder detectionRecorder(PlayLedger playLedger, TrackRegistry registry,
                                               RecorderProperties props, ApplicationEventPublisher publisher) {
        return new DefaultDetectionRecorder(playLedger, registry, props, publisher);
    }

    @Bean
    public DetectionPipeline detectionPipeline(FingerprintGenerator generator, DetectionOrchestrator orchestrator,
                                               DetectionRecorder recorder, TrackRegistry registry,
                                               DetectionMetrics metrics) {
        return new DetectionPipeline(generator, orchestrator, recorder, registry, metrics);
    }

    @Bean
    public DeadlineExecutor deadlineExecutor(@Qualifier("pipelineExecutor") ThreadPoolTaskExecutor pipelineExecutor) {
        return new DeadlineExecutor(pipelineExecutor);
    }

    @Bean
    public AudioCaptureService audioCaptureService(CaptureProperties props, Clock clock) {
        return new HttpStreamCaptureService(props, clock);
    }

    @Bean
    public StationScheduler stationScheduler(StationStore stationStore, AudioCaptureService captureService,
                                             DetectionPipeline pipeline, DeadlineExecutor deadlineExecutor,
                                             SchedulerProperties props, DetectionMetrics metrics,
                                             ApplicationEventPublisher publisher, Clock clock) {
        return new StationScheduler(stationStore, captureService, pipeline, deadlineExecutor, props, metrics,
                publisher, clock);
    }

    @Bean
    public DetectionService detectionService(DetectionPipeline pipeline, DeadlineExecutor deadlineExecutor,
                                             SchedulerProperties schedulerProps, CaptureProperties captureProps,
                                             Clock clock) {
        return new DefaultDetectionService(pipeline, deadlineExecutor, schedulerProps, captureProps, clock);
    }

    @Bean
    public AdapterHealthIndicator adapterHealthIndicator(List<RecognitionAdapter> adapters) {
        return new AdapterHealthIndicator(adapters);
    }

    @Bean
    public StationHealthIndicator stationHealthIndicator(StationScheduler scheduler) {
        return new StationHealthIndicator(scheduler);
    }

    @Bean
    public HealthSummaryReporter healthSummaryReporter(List<RecognitionAdapter> adapters, StationScheduler scheduler) {
        return new HealthSummaryReporter(adapters, scheduler);
    }
}
