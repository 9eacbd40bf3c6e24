package com.phillippitts.airplay.testutil;

import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.AudioSegment;
import com.phillippitts.airplay.exception.FingerprintException;
import com.phillippitts.airplay.service.fingerprint.FingerprintGenerator;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fingerprints a segment deterministically from its bytes: equal audio gives an equal digest.
 * Audio starting with "FAIL" raises a {@link FingerprintException}.
 */
public class FakeFingerprintGenerator implements FingerprintGenerator {

    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public AudioFingerprint fingerprint(AudioSegment segment) {
        calls.incrementAndGet();
        byte[] audio = segment.audio();
        if (audio.length >= 4 && new String(audio, 0, 4).equals("FAIL")) {
            throw new FingerprintException("fpcalc Non-zero exit: 3", 3);
        }
        return TestFingerprints.of(TestFingerprints.randomRaw(Arrays.hashCode(audio), 200));
    }

    public int calls() {
        return calls.get();
    }
}
