package com.phillippitts.airplay.service.fingerprint.chromaprint;

import com.phillippitts.airplay.config.properties.FingerprintProperties;
import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.AudioSegment;
import com.phillippitts.airplay.exception.FingerprintException;
import com.phillippitts.airplay.service.fingerprint.FingerprintDigest;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.phillippitts.airplay.service.fingerprint.chromaprint.FpcalcTestDoubles.ProcessBehavior;
import static com.phillippitts.airplay.service.fingerprint.chromaprint.FpcalcTestDoubles.ScriptedProcessFactory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChromaprintFingerprintGeneratorTest {

    private static final String RAW = "{\"duration\": 10.0, \"fingerprint\": [1, 2, 3, 4]}";
    private static final String ENCODED = "{\"duration\": 10.0, \"fingerprint\": \"AQADtEmk\"}";

    private final FingerprintProperties props = new FingerprintProperties();

    @Test
    void combinesRawAndEncodedRuns() {
        // Arrange
        ScriptedProcessFactory factory = ScriptedProcessFactory.byMode(
                ProcessBehavior.succeeding(RAW), ProcessBehavior.succeeding(ENCODED));
        ChromaprintFingerprintGenerator generator =
                new ChromaprintFingerprintGenerator(new FpcalcProcessManager(factory, props));

        // Act
        AudioFingerprint fp = generator.fingerprint(segment(new byte[]{9, 9, 9}, "aac"));

        // Assert
        assertThat(fp.raw()).containsExactly(1, 2, 3, 4);
        assertThat(fp.digest()).isEqualTo(FingerprintDigest.of(new int[]{1, 2, 3, 4}));
        assertThat(fp.encoded()).isEqualTo("AQADtEmk");
        assertThat(fp.durationSeconds()).isEqualTo(10.0);
        assertThat(factory.commands()).hasSize(2);
        assertThat(factory.commands().get(0)).contains("-raw");
        assertThat(factory.commands().get(1)).doesNotContain("-raw");
    }

    @Test
    void stagesAudioInTempFileWithFormatSuffixAndDeletesIt() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.byMode(
                ProcessBehavior.succeeding(RAW), ProcessBehavior.succeeding(ENCODED));
        ChromaprintFingerprintGenerator generator =
                new ChromaprintFingerprintGenerator(new FpcalcProcessManager(factory, props));

        generator.fingerprint(segment(new byte[]{1}, "ogg"));

        List<String> command = factory.commands().get(0);
        Path staged = Path.of(command.get(command.size() - 1));
        assertThat(staged.getFileName().toString()).startsWith("airplay-42-").endsWith(".ogg");
        assertThat(Files.exists(staged)).isFalse();
    }

    @Test
    void toolFailurePropagatesAsFingerprintException() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.byMode(
                new ProcessBehavior("", "decode error", 3, 0), ProcessBehavior.succeeding(ENCODED));
        ChromaprintFingerprintGenerator generator =
                new ChromaprintFingerprintGenerator(new FpcalcProcessManager(factory, props));

        assertThatThrownBy(() -> generator.fingerprint(segment(new byte[]{1}, "mp3")))
                .isInstanceOf(FingerprintException.class)
                .hasMessageContaining("Non-zero exit: 3");
    }

    @Test
    void emptyAudioIsRejectedWithoutRunningTool() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.byMode(
                ProcessBehavior.succeeding(RAW), ProcessBehavior.succeeding(ENCODED));
        ChromaprintFingerprintGenerator generator =
                new ChromaprintFingerprintGenerator(new FpcalcProcessManager(factory, props));

        assertThatThrownBy(() -> generator.fingerprint(segment(new byte[0], "mp3")))
                .isInstanceOf(FingerprintException.class);
        assertThat(factory.commands()).isEmpty();
    }

    private static AudioSegment segment(byte[] audio, String format) {
        return new AudioSegment(42L, audio, Instant.parse("2024-05-01T10:00:00Z"), Duration.ofSeconds(10), format, null);
    }
}
