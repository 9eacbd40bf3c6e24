package com.phillippitts.airplay.domain;

/**
 * Recognition source of a detection. Declaration order is the cascade priority order.
 */
public enum DetectionSource {
    LOCAL("local"),
    METADATA("metadata"),
    FINGERPRINT_EXTERNAL("fingerprint-external"),
    FULL_AUDIO_EXTERNAL("full-audio-external");

    private final String label;

    DetectionSource(String label) {
        this.label = label;
    }

    /** Stable lower-case name used in logs, metrics tags and results. */
    public String label() {
        return label;
    }
}
