package com.phillippitts.airplay.service.adapter.audd;

import com.phillippitts.airplay.config.properties.AdapterProperties;
import com.phillippitts.airplay.domain.AudioSegment;
import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.exception.AdapterExceptionBuilder;
import com.phillippitts.airplay.exception.AdapterQuotaExceededException;
import com.phillippitts.airplay.service.adapter.AbstractRecognitionAdapter;
import com.phillippitts.airplay.service.adapter.RecognitionInput;
import com.phillippitts.airplay.service.adapter.RecognitionOutcome;
import com.phillippitts.airplay.service.adapter.http.HttpReply;
import com.phillippitts.airplay.service.adapter.http.HttpTransport;
import com.phillippitts.airplay.service.adapter.http.MultipartBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * FULL_AUDIO_EXTERNAL tier: uploads the captured segment to AudD.
 *
 * <p>The most expensive tier and the last one tried. Matches without a score get the configured
 * default confidence.
 */
public class AuddFullAudioAdapter extends AbstractRecognitionAdapter {

    private static final Logger LOG = LogManager.getLogger(AuddFullAudioAdapter.class);

    public static final String NAME = "audd";

    static final String RETURN_FIELDS = "musicbrainz,spotify";

    private final AdapterProperties.Audd props;
    private final HttpTransport transport;

    public AuddFullAudioAdapter(AdapterProperties.Audd props,
                                HttpTransport transport,
                                ApplicationEventPublisher publisher,
                                Clock clock) {
        super(NAME, props, publisher, clock);
        this.props = props;
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DetectionSource source() {
        return DetectionSource.FULL_AUDIO_EXTERNAL;
    }

    @Override
    protected boolean supports(RecognitionInput input) {
        return input.segment().audio().length > 0;
    }

    @Override
    protected RecognitionOutcome doIdentify(RecognitionInput input) {
        AudioSegment segment = input.segment();
        String format = segment.format();
        MultipartBody body = new MultipartBody()
                .field("api_token", props.getApiKey())
                .field("return", RETURN_FIELDS)
                .file("file", "audio." + format, contentType(format), segment.audio());

        HttpRequest request = HttpRequest.newBuilder(URI.create(props.getBaseUrl()))
                .timeout(props.getTimeout())
                .header("Content-Type", body.contentType())
                .POST(body.publisher())
                .build();
        HttpReply reply = transport.send(request, NAME);
        if (reply.status() == 429) {
            throw new AdapterQuotaExceededException(NAME, props.getQuotaLimit());
        }
        if (!reply.isSuccess()) {
            throw AdapterExceptionBuilder.create("Unexpected HTTP status")
                    .adapter(NAME)
                    .status(reply.status())
                    .metadata("bytes", segment.audio().length)
                    .build();
        }

        Optional<AuddJsonParser.Recognition> recognition = AuddJsonParser.parse(reply.body(), props.getQuotaLimit());
        if (recognition.isEmpty()) {
            return RecognitionOutcome.noMatch("AudD found no match");
        }
        AuddJsonParser.Recognition r = recognition.get();
        double confidence = r.score() != null ? r.score() : props.getDefaultConfidence();
        LOG.debug("AudD matched '{}' by '{}' (confidence={})", r.candidate().title(), r.candidate().artist(), confidence);
        return RecognitionOutcome.match(r.candidate(), confidence);
    }

    private static String contentType(String format) {
        return switch (format) {
            case "aac" -> "audio/aac";
            case "ogg" -> "audio/ogg";
            case "wav" -> "audio/wav";
            default -> "audio/mpeg";
        };
    }
}
