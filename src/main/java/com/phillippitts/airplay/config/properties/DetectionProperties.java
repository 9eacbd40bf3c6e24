package com.phillippitts.airplay.config.properties;

import com.phillippitts.airplay.domain.DetectionSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Acceptance thresholds of the detection cascade, one per tier.
 *
 * <p>Example application.properties:
 * <pre>
 * airplay.detection.thresholds.local=0.7
 * airplay.detection.thresholds.metadata=0.8
 * airplay.detection.thresholds.fingerprint=0.7
 * airplay.detection.thresholds.full-audio=0.5
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "airplay.detection")
public class DetectionProperties {

    @Valid
    private Thresholds thresholds = new Thresholds();

    public Thresholds getThresholds() {
        return thresholds;
    }

    public void setThresholds(Thresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Minimum confidence for a tier result to be accepted.
     */
    public double thresholdFor(DetectionSource source) {
        return switch (source) {
            case LOCAL -> thresholds.getLocal();
            case METADATA -> thresholds.getMetadata();
            case FINGERPRINT_EXTERNAL -> thresholds.getFingerprint();
            case FULL_AUDIO_EXTERNAL -> thresholds.getFullAudio();
        };
    }

    public static class Thresholds {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double local = 0.7;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double metadata = 0.8;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double fingerprint = 0.7;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double fullAudio = 0.5;

        public double getLocal() {
            return local;
        }

        public void setLocal(double local) {
            this.local = local;
        }

        public double getMetadata() {
            return metadata;
        }

        public void setMetadata(double metadata) {
            this.metadata = metadata;
        }

        public double getFingerprint() {
            return fingerprint;
        }

        public void setFingerprint(double fingerprint) {
            this.fingerprint = fingerprint;
        }

        public double getFullAudio() {
            return fullAudio;
        }

        public void setFullAudio(double fullAudio) {
            this.fullAudio = fullAudio;
        }
    }
}
