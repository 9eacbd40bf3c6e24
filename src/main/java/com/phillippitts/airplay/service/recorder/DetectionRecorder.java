package com.phillippitts.airplay.service.recorder;

/**
 * Writes accepted detections and their play statistics.
 */
public interface DetectionRecorder {

    /**
     * Records a detection, or extends the station's latest one when it is the same track and
     * the new segment falls within the continuation gap. Detection row, track counters and
     * station-track stats are written as one unit.
     *
     * @throws com.phillippitts.airplay.exception.RecorderWriteException if the write fails;
     *         nothing has been applied in that case
     * @throws com.phillippitts.airplay.exception.PollDeadlineExceededException if the calling
     *         worker was cancelled before the commit
     */
    RecordingOutcome record(RecordingRequest request);
}
