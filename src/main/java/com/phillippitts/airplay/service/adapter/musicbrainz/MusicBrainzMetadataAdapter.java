package com.phillippitts.airplay.service.adapter.musicbrainz;

import com.phillippitts.airplay.config.properties.AdapterProperties;
import com.phillippitts.airplay.domain.DetectionSource;
import com.phillippitts.airplay.domain.TrackCandidate;
import com.phillippitts.airplay.exception.AdapterExceptionBuilder;
import com.phillippitts.airplay.exception.AdapterQuotaExceededException;
import com.phillippitts.airplay.service.adapter.AbstractRecognitionAdapter;
import com.phillippitts.airplay.service.adapter.RecognitionInput;
import com.phillippitts.airplay.service.adapter.RecognitionOutcome;
import com.phillippitts.airplay.service.adapter.http.HttpReply;
import com.phillippitts.airplay.service.adapter.http.HttpTransport;
import com.phillippitts.airplay.service.registry.TitleNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * METADATA tier: looks up the stream's "Artist - Title" tag in the MusicBrainz recording index.
 *
 * <p>Confidence is the mean of the normalized title and artist similarity between the tag and
 * the top recording. When the search reply carries no ISRC, the recording is fetched with
 * {@code inc=isrcs}. MusicBrainz requires an identifying User-Agent and has no API key.
 */
public class MusicBrainzMetadataAdapter extends AbstractRecognitionAdapter {

    private static final Logger LOG = LogManager.getLogger(MusicBrainzMetadataAdapter.class);

    public static final String NAME = "musicbrainz";

    private final AdapterProperties.MusicBrainz props;
    private final HttpTransport transport;

    public MusicBrainzMetadataAdapter(AdapterProperties.MusicBrainz props,
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
        return DetectionSource.METADATA;
    }

    @Override
    protected boolean hasCredentials() {
        return props.getUserAgent() != null && !props.getUserAgent().isBlank();
    }

    @Override
    protected boolean supports(RecognitionInput input) {
        return StreamTitle.parse(input.streamTitle()).isPresent();
    }

    @Override
    protected RecognitionOutcome doIdentify(RecognitionInput input) {
        StreamTitle tag = StreamTitle.parse(input.streamTitle()).orElseThrow();
        String query = "recording:\"" + escape(tag.title()) + "\" AND artist:\"" + escape(tag.artist()) + "\"";
        URI search = URI.create(props.getBaseUrl() + "/recording?query="
                + URLEncoder.encode(query, StandardCharsets.UTF_8) + "&limit=1&fmt=json");

        Optional<TrackCandidate> found = MusicBrainzJsonParser.firstRecording(get(search));
        if (found.isEmpty()) {
            return RecognitionOutcome.noMatch("no recording for tag");
        }
        TrackCandidate candidate = found.get();
        double confidence = (TitleNormalizer.similarity(tag.title(), candidate.title())
                + TitleNormalizer.similarity(tag.artist(), candidate.artist())) / 2.0;

        String mbid = candidate.externalIds().get("musicbrainz");
        if (candidate.isrc() == null && mbid != null) {
            URI lookup = URI.create(props.getBaseUrl() + "/recording/" + mbid + "?inc=isrcs&fmt=json");
            List<String> isrcs = MusicBrainzJsonParser.isrcs(get(lookup));
            if (!isrcs.isEmpty()) {
                candidate = candidate.withIsrc(isrcs.get(0));
            }
        }
        LOG.debug("MusicBrainz matched '{}' by '{}' (confidence={})", candidate.title(), candidate.artist(), confidence);
        return RecognitionOutcome.match(candidate, Math.max(0.0, Math.min(1.0, confidence)));
    }

    private String get(URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(props.getTimeout())
                .header("User-Agent", props.getUserAgent())
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpReply reply = transport.send(request, NAME);
        if (reply.status() == 503) {
            // MusicBrainz answers 503 when the client exceeds its rate limit
            throw new AdapterQuotaExceededException(NAME, props.getQuotaLimit());
        }
        if (!reply.isSuccess()) {
            throw AdapterExceptionBuilder.create("Unexpected HTTP status")
                    .adapter(NAME)
                    .status(reply.status())
                    .metadata("endpoint", uri.getPath())
                    .build();
        }
        return reply.body();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
