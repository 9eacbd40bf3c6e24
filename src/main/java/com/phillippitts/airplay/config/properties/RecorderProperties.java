package com.phillippitts.airplay.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Detection recorder settings.
 *
 * @param continuationGap largest gap between the end of the station's latest detection and a new
 *                        detection of the same track for the two to be treated as one play
 */
@ConfigurationProperties(prefix = "airplay.recorder")
@Validated
public record RecorderProperties(Duration continuationGap) {

    public RecorderProperties {
        if (continuationGap == null) {
            continuationGap = Duration.ofSeconds(90);
        }
        if (continuationGap.isNegative()) {
            throw new IllegalArgumentException("continuationGap must not be negative: " + continuationGap);
        }
    }
}
