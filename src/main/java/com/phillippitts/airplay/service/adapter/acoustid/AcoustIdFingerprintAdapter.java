package com.phillippitts.airplay.service.adapter.acoustid;

import com.phillippitts.airplay.config.properties.AdapterProperties;
import com.phillippitts.airplay.domain.AudioFingerprint;
import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.exception.AdapterExceptionBuilder;
import com.phillippitts.airplay.exception.AdapterQuotaExceededException;
import com.phillippitts.airplay.service.adapter.AbstractRecognitionAdapter;
import com.phillippitts.airplay.service.adapter.RecognitionInput;
import com.phillippitts.airplay.service.adapter.RecognitionOutcome;
import com.phillippitts.airplay.service.adapter.http.HttpReply;
import com.phillippitts.airplay.service.adapter.http.HttpTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * FINGERPRINT_EXTERNAL tier: submits the compressed Chromaprint fingerprint to AcoustID.
 */
public class AcoustIdFingerprintAdapter extends AbstractRecognitionAdapter {

    private static final Logger LOG = LogManager.getLogger(AcoustIdFingerprintAdapter.class);

    public static final String NAME = "acoustid";

    static final String META = "recordings releasegroups releases tracks compress";

    private final HttpTransport transport;

    public AcoustIdFingerprintAdapter(AdapterProperties.AcoustId props,
                                      HttpTransport transport,
                                      ApplicationEventPublisher publisher,
                                      Clock clock) {
        super(NAME, props, publisher, clock);
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DetectionSource source() {
        return DetectionSource.FINGERPRINT_EXTERNAL;
    }

    @Override
    protected boolean supports(RecognitionInput input) {
        AudioFingerprint fp = input.fingerprint();
        return fp != null && fp.encoded() != null && !fp.encoded().isBlank() && fp.durationSeconds() > 0;
    }

    @Override
    protected RecognitionOutcome doIdentify(RecognitionInput input) {
        AudioFingerprint fp = input.fingerprint();
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client", endpoint().getApiKey());
        form.put("meta", META);
        form.put("duration", String.valueOf((int) fp.durationSeconds()));
        form.put("fingerprint", fp.encoded());

        HttpRequest request = HttpRequest.newBuilder(URI.create(endpoint().getBaseUrl() + "/lookup"))
                .timeout(endpoint().getTimeout())
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(encode(form)))
                .build();
        HttpReply reply = transport.send(request, NAME);
        if (reply.status() == 429) {
            throw new AdapterQuotaExceededException(NAME, endpoint().getQuotaLimit());
        }
        // AcoustID reports API errors with a 400 and a JSON error body
        if (!reply.isSuccess() && reply.status() != 400) {
            throw AdapterExceptionBuilder.create("Unexpected HTTP status")
                    .adapter(NAME)
                    .status(reply.status())
                    .build();
        }

        Optional<AcoustIdJsonParser.Lookup> lookup = AcoustIdJsonParser.parse(reply.body(), endpoint().getQuotaLimit());
        if (lookup.isEmpty()) {
            return RecognitionOutcome.noMatch("no AcoustID result with recordings");
        }
        LOG.debug("AcoustID matched '{}' by '{}' (score={})",
                lookup.get().candidate().title(), lookup.get().candidate().artist(), lookup.get().score());
        return RecognitionOutcome.match(lookup.get().candidate(), lookup.get().score());
    }

    private static String encode(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
