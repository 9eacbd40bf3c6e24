package com.phillippitts.airplay.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration of the external recognition adapters.
 *
 * <p>Each adapter owns its timeout, quota window and circuit breaker settings. An adapter whose
 * API key (or User-Agent, for MusicBrainz) is missing is disabled and skipped by the cascade.
 *
 * <p>Example application.properties:
 * <pre>
 * airplay.adapters.acoustid.api-key=${ACOUSTID_API_KEY:}
 * airplay.adapters.acoustid.quota-limit=3
 * airplay.adapters.acoustid.quota-window=1s
 * airplay.adapters.audd.api-key=${AUDD_API_KEY:}
 * airplay.adapters.audd.circuit.failure-threshold=5
 * </pre>
 */
@ConfigurationProperties(prefix = "airplay.adapters")
@Validated
public class AdapterProperties {

    @Valid
    private MusicBrainz musicbrainz = new MusicBrainz();
    @Valid
    private AcoustId acoustid = new AcoustId();
    @Valid
    private Audd audd = new Audd();

    public MusicBrainz getMusicbrainz() {
        return musicbrainz;
    }

    public void setMusicbrainz(MusicBrainz musicbrainz) {
        this.musicbrainz = musicbrainz;
    }

    public AcoustId getAcoustid() {
        return acoustid;
    }

    public void setAcoustid(AcoustId acoustid) {
        this.acoustid = acoustid;
    }

    public Audd getAudd() {
        return audd;
    }

    public void setAudd(Audd audd) {
        this.audd = audd;
    }

    /**
     * Settings shared by every adapter.
     */
    public static class Endpoint {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;

        /** Per-call timeout (HTTP request timeout). */
        private Duration timeout = Duration.ofSeconds(10);

        /** Calls permitted per quota window. */
        @Positive
        private int quotaLimit = 60;

        private Duration quotaWindow = Duration.ofMinutes(1);

        @Valid
        private Circuit circuit = new Circuit();

        protected Endpoint(String baseUrl, int quotaLimit, Duration quotaWindow) {
            this.baseUrl = baseUrl;
            this.quotaLimit = quotaLimit;
            this.quotaWindow = quotaWindow;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getQuotaLimit() {
            return quotaLimit;
        }

        public void setQuotaLimit(int quotaLimit) {
            this.quotaLimit = quotaLimit;
        }

        public Duration getQuotaWindow() {
            return quotaWindow;
        }

        public void setQuotaWindow(Duration quotaWindow) {
            this.quotaWindow = quotaWindow;
        }

        public Circuit getCircuit() {
            return circuit;
        }

        public void setCircuit(Circuit circuit) {
            this.circuit = circuit;
        }
    }

    /**
     * Circuit breaker settings.
     */
    public static class Circuit {
        /** Consecutive failures (inside {@code window}) that open the circuit. */
        @Positive(message = "Failure threshold must be positive")
        private int failureThreshold = 5;

        /** Failures older than this no longer count toward the threshold. */
        private Duration window = Duration.ofMinutes(2);

        /** Time the circuit stays open before a single trial call is allowed. */
        private Duration cooldown = Duration.ofSeconds(60);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }
    }

    /** MusicBrainz has no key; it requires an identifying User-Agent and 1 request/second. */
    public static class MusicBrainz extends Endpoint {
        private String userAgent = "airplay-monitor/0.1 ( ops@example.org )";

        public MusicBrainz() {
            super("https://musicbrainz.org/ws/2", 1, Duration.ofSeconds(1));
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }
    }

    public static class AcoustId extends Endpoint {
        public AcoustId() {
            super("https://api.acoustid.org/v2", 3, Duration.ofSeconds(1));
        }
    }

    public static class Audd extends Endpoint {
        /** Confidence used when AudD returns a match without a score. */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double defaultConfidence = 0.8;

        public Audd() {
            super("https://api.audd.io", 60, Duration.ofMinutes(1));
        }

        public double getDefaultConfidence() {
            return defaultConfidence;
        }

        public void setDefaultConfidence(double defaultConfidence) {
            this.defaultConfidence = defaultConfidence;
        }
    }
}
