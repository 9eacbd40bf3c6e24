package com.phillippitts.airplay.service.adapter.acoustid;

import com.phillippitts.airplay.config.properties.AdapterProperties;
import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.exception.AdapterTimeoutException;
import com.phillippitts.airplay.service.adapter.RecognitionInput;
import com.phillippitts.airplay.service.adapter.RecognitionOutcome;
import com.phillippitts.airplay.testutil.EventCapturingPublisher;
import com.phillippitts.airplay.testutil.MutableClock;
import com.phillippitts.airplay.testutil.StubHttpTransport;
import com.phillippitts.airplay.testutil.TestFingerprints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AcoustIdFingerprintAdapterTest {

    private static final String MATCH = """
            {"status":"ok","results":[{"id":"aid","score":0.91,"recordings":[{"id":"rec",
              "title":"Paranoid Android","artists":[{"name":"Radiohead"}]}]}]}
            """;

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private AdapterProperties.AcoustId props;
    private StubHttpTransport transport;
    private AcoustIdFingerprintAdapter adapter;

    @BeforeEach
    void setUp() {
        props = new AdapterProperties.AcoustId();
        props.setApiKey("client-key");
        props.setBaseUrl("http://acoustid.test/v2");
        transport = new StubHttpTransport();
        adapter = new AcoustIdFingerprintAdapter(props, transport, publisher, clock);
    }

    @Test
    void postsFingerprintAndReturnsScoredMatch() {
        transport.reply(200, MATCH);

        RecognitionOutcome outcome = adapter.identify(input(TestFingerprints.random(7)));

        assertThat(outcome.isMatch()).isTrue();
        assertThat(outcome.confidence()).isEqualTo(0.91);
        assertThat(outcome.candidate().artist()).isEqualTo("Radiohead");
        assertThat(adapter.source()).isEqualTo(DetectionSource.FINGERPRINT_EXTERNAL);
        assertThat(transport.requests()).singleElement().satisfies(r -> {
            assertThat(r.method()).isEqualTo("POST");
            assertThat(r.uri().toString()).isEqualTo("http://acoustid.test/v2/lookup");
            assertThat(r.headers().firstValue("Content-Type")).contains("application/x-www-form-urlencoded");
        });
    }

    @Test
    void fingerprintWithoutEncodedFormIsNotSent() {
        int[] raw = TestFingerprints.randomRaw(3, 50);
        AudioFingerprint bare = new AudioFingerprint(TestFingerprints.of(raw).digest(), raw, null, 10.0);

        RecognitionOutcome outcome = adapter.identify(input(bare));

        assertThat(outcome.kind()).isEqualTo(RecognitionOutcome.Kind.NO_MATCH);
        assertThat(transport.requests()).isEmpty();
    }

    @Test
    void disabledWithoutClientKey() {
        props.setApiKey(null);

        assertThat(adapter.isEnabled()).isFalse();
    }

    @Test
    void badRequestBodyIsParsedAsApiError() {
        transport.reply(400, "{\"status\":\"error\",\"error\":{\"code\":3,\"message\":\"invalid fingerprint\"}}");

        RecognitionOutcome outcome = adapter.identify(input(TestFingerprints.random(1)));

        assertThat(outcome.kind()).isEqualTo(RecognitionOutcome.Kind.ERROR);
        assertThat(outcome.detail()).contains("invalid fingerprint");
    }

    @Test
    void tooManyRequestsIsQuotaExceeded() {
        transport.reply(429, "");

        assertThat(adapter.identify(input(TestFingerprints.random(1))).kind())
                .isEqualTo(RecognitionOutcome.Kind.QUOTA_EXCEEDED);
    }

    @Test
    void transportTimeoutIsTimeout() {
        transport.fail(new AdapterTimeoutException(AcoustIdFingerprintAdapter.NAME, 10_000, null));

        assertThat(adapter.identify(input(TestFingerprints.random(1))).kind())
                .isEqualTo(RecognitionOutcome.Kind.TIMEOUT);
    }

    private static RecognitionInput input(AudioFingerprint fp) {
        return new RecognitionInput(
                TestFingerprints.segment(1L, "audio", Instant.parse("2024-05-01T10:00:00Z")), fp, "Radio One", null);
    }
}
