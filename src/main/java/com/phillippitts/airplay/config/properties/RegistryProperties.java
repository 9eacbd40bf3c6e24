package com.phillippitts.airplay.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Track registry settings.
 *
 * @param recentWindow number of most recently created or played tracks searched when a candidate
 *                     without a known ISRC is matched by normalized title and artist
 */
@ConfigurationProperties(prefix = "airplay.registry")
@Validated
public record RegistryProperties(Integer recentWindow) {

    public RegistryProperties {
        if (recentWindow == null) {
            recentWindow = 500;
        }
        if (recentWindow <= 0) {
            throw new IllegalArgumentException("recentWindow must be positive: " + recentWindow);
        }
    }
}
