package com.phillippitts.airplay.service.fingerprint.chromaprint;

import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.AudioSegment;
import com.phillippitts.airplay.exception.FingerprintException;
import com.phillippitts.airplay.service.fingerprint.FingerprintDigest;
import com.phillippitts.airplay.service.fingerprint.FingerprintGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link FingerprintGenerator} backed by the Chromaprint {@code fpcalc} tool.
 *
 * <p>The segment is written to a temp file and fingerprinted twice: once with {@code -raw} for the
 * integer vector (digest and similarity) and once without for the compressed form AcoustID accepts.
 */
public class ChromaprintFingerprintGenerator implements FingerprintGenerator {

    private static final Logger LOG = LogManager.getLogger(ChromaprintFingerprintGenerator.class);

    private final FpcalcProcessManager processManager;

    public ChromaprintFingerprintGenerator(FpcalcProcessManager processManager) {
        this.processManager = Objects.requireNonNull(processManager, "processManager");
    }

    @Override
    public AudioFingerprint fingerprint(AudioSegment segment) {
        Objects.requireNonNull(segment, "segment");
        if (segment.audio().length == 0) {
            throw new FingerprintException("Empty audio segment for station " + segment.stationId());
        }
        Path audioFile = null;
        try {
            audioFile = Files.createTempFile("airplay-" + segment.stationId() + "-", "." + segment.format());
            Files.write(audioFile, segment.audio());

            FpcalcJsonParser.RawOutput raw = FpcalcJsonParser.parseRaw(processManager.run(audioFile, true));
            FpcalcJsonParser.EncodedOutput encoded =
                    FpcalcJsonParser.parseEncoded(processManager.run(audioFile, false));

            String digest = FingerprintDigest.of(raw.fingerprint());
            LOG.debug("Fingerprinted station={} values={} duration={}s digest={}",
                    segment.stationId(), raw.fingerprint().length, raw.durationSeconds(), digest.substring(0, 12));
            return new AudioFingerprint(digest, raw.fingerprint(), encoded.fingerprint(),
                    Math.max(raw.durationSeconds(), encoded.durationSeconds()));
        } catch (IOException e) {
            throw new FingerprintException("Failed to stage audio for fpcalc: " + e.getMessage(), e);
        } finally {
            deleteQuietly(audioFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete temp audio {}: {}", file, e.toString());
        }
    }
}
