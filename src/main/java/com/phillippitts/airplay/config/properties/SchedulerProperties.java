package com.phillippitts.airplay.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the station scheduler.
 */
@ConfigurationProperties(prefix = "airplay.scheduler")
@Validated
public class SchedulerProperties {

    /** Enable/disable periodic polling globally. */
    private boolean enabled = true;

    /** Delay between scheduler ticks, in milliseconds. */
    @Positive
    private long tickMs = 1000;

    /** Hard deadline of one station poll (capture, fingerprint, cascade, record). */
    private Duration pollDeadline = Duration.ofSeconds(45);

    /** Consecutive failures after which a station is marked unhealthy. */
    @Positive(message = "Unhealthy threshold must be positive")
    private int unhealthyThreshold = 3;

    /** Poll interval multiplier applied while a station is unhealthy. */
    @Positive
    private int unhealthyBackoffMultiplier = 5;

    /** Upper bound of the backed-off poll interval. */
    private Duration maxBackoff = Duration.ofMinutes(30);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getTickMs() {
        return tickMs;
    }

    public void setTickMs(long tickMs) {
        this.tickMs = tickMs;
    }

    public Duration getPollDeadline() {
        return pollDeadline;
    }

    public void setPollDeadline(Duration pollDeadline) {
        this.pollDeadline = pollDeadline;
    }

    public int getUnhealthyThreshold() {
        return unhealthyThreshold;
    }

    public void setUnhealthyThreshold(int unhealthyThreshold) {
        this.unhealthyThreshold = unhealthyThreshold;
    }

    public int getUnhealthyBackoffMultiplier() {
        return unhealthyBackoffMultiplier;
    }

    public void setUnhealthyBackoffMultiplier(int unhealthyBackoffMultiplier) {
        this.unhealthyBackoffMultiplier = unhealthyBackoffMultiplier;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }
}
