package com.phillippitts.airplay.service.orchestration;

import com.phillippitts.airplay.config.properties.CaptureProperties;
import com.phillippitts.airplay.config.properties.SchedulerProperties;
import com.phillippitts.airplay.domain.AudioSegment;
import com.phillippitts.airplay.domain.DetectionResult;
import com.phillippitts.airplay.exception.AirplayException;
import com.phillippitts.airplay.exception.FingerprintException;
import com.phillippitts.airplay.exception.PersistenceUnavailableException;
import com.phillippitts.airplay.exception.PipelineSaturatedException;
import com.phillippitts.airplay.exception.PollDeadlineExceededException;
import com.phillippitts.airplay.service.scheduler.DeadlineExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs caller-supplied audio through the {@link DetectionPipeline} on the pipeline pool,
 * bounded by the poll deadline.
 *
 * <p>The caller waits at most the deadline measured from submission, queue time included.
 * A task still queued or running at that point is cancelled.
 */
public class DefaultDetectionService implements DetectionService {

    private static final Logger LOG = LogManager.getLogger(DefaultDetectionService.class);

    private final DetectionPipeline pipeline;
    private final DeadlineExecutor executor;
    private final SchedulerProperties schedulerProps;
    private final CaptureProperties captureProps;
    private final Clock clock;

    public DefaultDetectionService(DetectionPipeline pipeline,
                                   DeadlineExecutor executor,
                                   SchedulerProperties schedulerProps,
                                   CaptureProperties captureProps,
                                   Clock clock) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.schedulerProps = Objects.requireNonNull(schedulerProps, "schedulerProps");
        this.captureProps = Objects.requireNonNull(captureProps, "captureProps");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public DetectionResult detect(long stationId, byte[] audio, String stationName, String streamTitle) {
        if (audio == null || audio.length == 0) {
            return DetectionResult.error(stationId, "empty audio");
        }
        AudioSegment segment = new AudioSegment(stationId, audio, clock.instant(), estimateDuration(audio.length),
                "mp3", streamTitle);
        Duration deadline = schedulerProps.getPollDeadline();
        String taskName = "detect-" + stationId;

        long submittedAt = System.nanoTime();
        Future<DetectionResult> future;
        try {
            future = executor.submit(taskName, () -> pipeline.process(segment, stationName, streamTitle),
                    deadline, null);
        } catch (PipelineSaturatedException e) {
            LOG.warn("Refusing detection for station {}: {}", stationId, e.getMessage());
            return DetectionResult.error(stationId, "pipeline saturated");
        }

        long remaining = deadline.toNanos() - (System.nanoTime() - submittedAt);
        try {
            return future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
        } catch (CancellationException e) {
            return DetectionResult.error(stationId, new PollDeadlineExceededException(taskName, deadline).getMessage());
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Detection for station {} not finished within {}ms; cancelled", stationId, deadline.toMillis());
            return DetectionResult.error(stationId, new PollDeadlineExceededException(taskName, deadline).getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return DetectionResult.error(stationId, "interrupted");
        } catch (ExecutionException e) {
            return mapFailure(stationId, e.getCause());
        }
    }

    private DetectionResult mapFailure(long stationId, Throwable cause) {
        if (cause instanceof PersistenceUnavailableException pue) {
            throw pue;
        }
        if (cause instanceof FingerprintException fe) {
            LOG.warn("Fingerprinting failed for station {}: {}", stationId, fe.getMessage());
            return DetectionResult.error(stationId, "fingerprint failed");
        }
        if (cause instanceof AirplayException ae) {
            LOG.warn("Detection failed for station {}: {}", stationId, ae.getMessage());
            return DetectionResult.error(stationId, ae.getMessage());
        }
        LOG.error("Unexpected detection failure for station {}", stationId, cause);
        return DetectionResult.error(stationId, "unexpected error");
    }

    /** Duration implied by the configured stream bitrate. */
    private Duration estimateDuration(int bytes) {
        long millis = (long) bytes * 8L / captureProps.bitrateKbps();
        return Duration.ofMillis(Math.max(1L, millis));
    }
}
