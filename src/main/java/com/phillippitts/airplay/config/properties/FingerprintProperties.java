package com.phillippitts.airplay.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for fingerprint generation (fpcalc) and the local fingerprint store.
 *
 * <p>Example application.properties:
 * <pre>
 * airplay.fingerprint.fpcalc-path=fpcalc
 * airplay.fingerprint.timeout-seconds=30
 * airplay.fingerprint.similarity.enabled=true
 * airplay.fingerprint.similarity.floor=0.85
 * airplay.fingerprint.similarity.max-candidates=10
 * </pre>
 */
@ConfigurationProperties(prefix = "airplay.fingerprint")
@Validated
public class FingerprintProperties {

    /** Path to the Chromaprint fpcalc executable. */
    @NotBlank(message = "fpcalc path must not be blank")
    private String fpcalcPath = "fpcalc";

    /** Maximum time fpcalc may run per invocation. */
    @Positive(message = "Timeout must be positive")
    private int timeoutSeconds = 30;

    /** Maximum seconds of audio fpcalc analyses (-length). */
    @Positive
    private int maxAudioSeconds = 120;

    /** Stdout cap per invocation; raw fingerprints of 2 minutes of audio are about 20KB. */
    @Positive
    private int maxStdoutBytes = 1_048_576;

    private Similarity similarity = new Similarity();

    public String getFpcalcPath() {
        return fpcalcPath;
    }

    public void setFpcalcPath(String fpcalcPath) {
        this.fpcalcPath = fpcalcPath;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxAudioSeconds() {
        return maxAudioSeconds;
    }

    public void setMaxAudioSeconds(int maxAudioSeconds) {
        this.maxAudioSeconds = maxAudioSeconds;
    }

    public int getMaxStdoutBytes() {
        return maxStdoutBytes;
    }

    public void setMaxStdoutBytes(int maxStdoutBytes) {
        this.maxStdoutBytes = maxStdoutBytes;
    }

    public Similarity getSimilarity() {
        return similarity;
    }

    public void setSimilarity(Similarity similarity) {
        this.similarity = similarity;
    }

    /**
     * Near-duplicate matching on exact-digest miss.
     */
    public static class Similarity {
        private boolean enabled = true;

        /** Minimum similarity (1 - bit error rate) for a near match. */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double floor = 0.85;

        /** Candidates scored per lookup, ranked by shared index keys. */
        @Positive
        private int maxCandidates = 10;

        /** Postings kept per index key; very common keys carry no signal. */
        @Positive
        private int maxPostingsPerKey = 64;

        /** Leading sub-fingerprints of each entry that are indexed. */
        @Positive
        private int indexedPrefix = 120;

        /** Largest alignment shift, in sub-fingerprints, tried in either direction. */
        @Positive
        private int maxOffset = 80;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getFloor() {
            return floor;
        }

        public void setFloor(double floor) {
            this.floor = floor;
        }

        public int getMaxCandidates() {
            return maxCandidates;
        }

        public void setMaxCandidates(int maxCandidates) {
            this.maxCandidates = maxCandidates;
        }

        public int getMaxPostingsPerKey() {
            return maxPostingsPerKey;
        }

        public void setMaxPostingsPerKey(int maxPostingsPerKey) {
            this.maxPostingsPerKey = maxPostingsPerKey;
        }

        public int getIndexedPrefix() {
            return indexedPrefix;
        }

        public void setIndexedPrefix(int indexedPrefix) {
            this.indexedPrefix = indexedPrefix;
        }

        public int getMaxOffset() {
            return maxOffset;
        }

        public void setMaxOffset(int maxOffset) {
            this.maxOffset = maxOffset;
        }
    }
}
