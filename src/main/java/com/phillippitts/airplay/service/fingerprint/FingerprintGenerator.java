package com.phillippitts.airplay.service.fingerprint;

import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.AudioSegment;
import com.phillippitts.airplay.exception.FingerprintException;

/**
 * Computes the acoustic fingerprint of a captured segment.
 */
public interface FingerprintGenerator {

    /**
     * @throws FingerprintException on tool failure, timeout or malformed output
     */
    AudioFingerprint fingerprint(AudioSegment segment);
}
