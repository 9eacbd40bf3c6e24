package com.phillippitts.airplay.service.recorder;

import com.phillippitts.airplay.domain.Detection;

/**
 * @param detection    the stored detection (new, or the extended one on continuation)
 * @param continuation the request extended an ongoing play instead of creating a detection
 */
public record RecordingOutcome(Detection detection, boolean continuation) {
}
