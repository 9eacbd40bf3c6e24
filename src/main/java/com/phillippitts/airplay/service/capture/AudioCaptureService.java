package com.phillippitts.airplay.service.capture;

import com.phillippitts.airplay.domain.AudioSegment;
import com.phillippitts.airplay.domain.Station;

/**
 * Stream capture service.
 *
 * Contract:
 * - Returns one segment of the station's stream, encoded as broadcast (no decoding)
 * - Blocks at most for the configured read timeout; honors thread interruption
 */
public interface AudioCaptureService {

    /**
     * @throws com.phillippitts.airplay.exception.CaptureException if the stream is unreachable,
     *         answers with an error or delivers no audio
     */
    AudioSegment capture(Station station);
}
