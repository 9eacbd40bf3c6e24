package com.phillippitts.airplay.service.capture;

import com.phillippitts.airplay.config.properties.CaptureProperties;
import com.phillippitts.airplay.domain.AudioSegment;
import com.phillippitts.airplay.domain.Station;
import com.phillippitts.airplay.exception.CaptureException;
import com.phillippitts.airplay.util.LogSanitizer;
import com.phillippitts.airplay.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Captures a segment by reading a fixed byte budget from the station's HTTP stream.
 *
 * <p>The budget is {@code bitrate x segment seconds}; the segment duration is scaled down when
 * the stream ends early. No ICY metadata is requested.
 */
public class HttpStreamCaptureService implements AudioCaptureService {

    private static final Logger LOG = LogManager.getLogger(HttpStreamCaptureService.class);

    private static final int CHUNK = 8192;

    private final CaptureProperties props;
    private final HttpClient client;
    private final Clock clock;

    public HttpStreamCaptureService(CaptureProperties props, Clock clock) {
        this(props, HttpClient.newBuilder()
                .connectTimeout(props.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), clock);
    }

    HttpStreamCaptureService(CaptureProperties props, HttpClient client, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.client = Objects.requireNonNull(client, "client");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public AudioSegment capture(Station station) {
        Objects.requireNonNull(station, "station");
        if (station.streamUrl() == null || station.streamUrl().isBlank()) {
            throw new CaptureException(station.id(), "no stream URL");
        }
        URI uri;
        try {
            uri = URI.create(station.streamUrl());
        } catch (IllegalArgumentException e) {
            throw new CaptureException(station.id(), "invalid stream URL", e);
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(props.readTimeout())
                .header("User-Agent", props.userAgent())
                .header("Icy-MetaData", "0")
                .GET()
                .build();

        Instant capturedAt = clock.instant();
        long start = System.nanoTime();
        HttpResponse<InputStream> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new CaptureException(station.id(), "stream unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CaptureException(station.id(), "interrupted while connecting", e);
        }

        if (response.statusCode() / 100 != 2) {
            closeQuietly(response.body(), station.id());
            throw new CaptureException(station.id(), "HTTP " + response.statusCode());
        }

        byte[] audio = readBudget(response.body(), station.id(), start);
        if (audio.length == 0) {
            throw new CaptureException(station.id(), "stream delivered no audio");
        }
        String format = formatOf(response.headers().firstValue("Content-Type").orElse(""));
        Duration duration = scaledDuration(audio.length);
        LOG.debug("Captured {} bytes ({}s, {}) from {} in {}ms", audio.length, duration.toSeconds(), format,
                LogSanitizer.redactUrl(station.streamUrl()), TimeUtils.elapsedMillis(start));
        return new AudioSegment(station.id(), audio, capturedAt, duration, format, null);
    }

    private byte[] readBudget(InputStream body, long stationId, long startNanos) {
        int budget = props.byteBudget();
        long deadlineMs = props.readTimeout().toMillis();
        byte[] buf = new byte[budget];
        int filled = 0;
        try (InputStream in = body) {
            while (filled < budget) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CaptureException(stationId, "interrupted while reading");
                }
                if (TimeUtils.elapsedMillis(startNanos) > deadlineMs) {
                    if (filled == 0) {
                        throw new CaptureException(stationId, "read timeout after " + deadlineMs + "ms");
                    }
                    LOG.debug("Read timeout on station {} after {} bytes; keeping partial segment", stationId, filled);
                    break;
                }
                int n = in.read(buf, filled, Math.min(CHUNK, budget - filled));
                if (n < 0) {
                    break;
                }
                filled += n;
            }
        } catch (IOException e) {
            if (filled == 0) {
                throw new CaptureException(stationId, "read failed: " + e.getMessage(), e);
            }
            LOG.debug("Stream of station {} broke after {} bytes: {}", stationId, filled, e.getMessage());
        }
        return filled == budget ? buf : Arrays.copyOf(buf, filled);
    }

    private Duration scaledDuration(int bytes) {
        long millis = (long) bytes * 8L / props.bitrateKbps();
        return Duration.ofMillis(Math.min(millis, props.segmentSeconds() * 1000L));
    }

    static String formatOf(String contentType) {
        String ct = contentType.toLowerCase(Locale.ROOT);
        if (ct.contains("aac") || ct.contains("aacp")) {
            return "aac";
        }
        if (ct.contains("ogg")) {
            return "ogg";
        }
        if (ct.contains("wav")) {
            return "wav";
        }
        return "mp3";
    }

    private static void closeQuietly(InputStream in, long stationId) {
        try {
            in.close();
        } catch (IOException e) {
            LOG.debug("Failed to close stream of station {}: {}", stationId, e.getMessage());
        }
    }
}
