package com.phillippitts.airplay.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Stream capture settings. The byte budget of one segment is {@code bitrateKbps * 1000 / 8 * segmentSeconds}.
 *
 * @param segmentSeconds nominal duration of a captured segment
 * @param bitrateKbps    assumed stream bitrate used to size the byte budget
 * @param connectTimeout HTTP connect timeout
 * @param readTimeout    timeout of the whole segment read
 * @param userAgent      User-Agent sent to stream servers
 */
@ConfigurationProperties(prefix = "airplay.capture")
@Validated
public record CaptureProperties(
        Integer segmentSeconds,
        Integer bitrateKbps,
        Duration connectTimeout,
        Duration readTimeout,
        String userAgent
) {
    public CaptureProperties {
        segmentSeconds = segmentSeconds == null ? 10 : segmentSeconds;
        bitrateKbps = bitrateKbps == null ? 128 : bitrateKbps;
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
        readTimeout = readTimeout == null ? Duration.ofSeconds(20) : readTimeout;
        userAgent = userAgent == null || userAgent.isBlank() ? "airplay-monitor/0.1" : userAgent;
        if (segmentSeconds <= 0 || bitrateKbps <= 0) {
            throw new IllegalArgumentException("segmentSeconds and bitrateKbps must be positive");
        }
    }

    /** Number of bytes read from the stream for one segment. */
    public int byteBudget() {
        return bitrateKbps * 1000 / 8 * segmentSeconds;
    }
}
