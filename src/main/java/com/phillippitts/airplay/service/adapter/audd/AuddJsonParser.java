package com.phillippitts.airplay.service.adapter.audd;

import com.phillippitts.airplay.domain.TrackCandidate;
import com.phillippitts.airplay.exception.AdapterException;
import com.phillippitts.airplay.exception.AdapterExceptionBuilder;
import com.phillippitts.airplay.exception.AdapterQuotaExceededException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parses AudD recognition replies.
 */
final class AuddJsonParser {

    /** AudD error codes meaning the account's request limit is spent. */
    static final Set<Integer> QUOTA_ERRORS = Set.of(901, 902);

    record Recognition(TrackCandidate candidate, Double score) {}

    private AuddJsonParser() {}

    /**
     * Returns the recognized track, or empty when AudD found nothing ({@code result: null}).
     *
     * @throws AdapterQuotaExceededException when AudD reports an exhausted request limit
     * @throws AdapterException for any other error reply or malformed body
     */
    static Optional<Recognition> parse(String json, int quotaLimit) {
        JSONObject root = parseRoot(json);
        if ("error".equals(root.optString("status", ""))) {
            JSONObject error = root.optJSONObject("error");
            int code = error == null ? -1 : error.optInt("error_code", -1);
            String message = error == null ? "unknown error" : error.optString("error_message", "unknown error");
            if (QUOTA_ERRORS.contains(code)) {
                throw new AdapterQuotaExceededException(AuddFullAudioAdapter.NAME, quotaLimit);
            }
            throw AdapterExceptionBuilder.create("AudD error: " + message)
                    .adapter(AuddFullAudioAdapter.NAME)
                    .metadata("code", code)
                    .build();
        }

        JSONObject result = root.optJSONObject("result");
        if (result == null) {
            return Optional.empty();
        }
        String title = result.optString("title", "");
        String artist = result.optString("artist", "");
        if (title.isBlank() || artist.isBlank()) {
            return Optional.empty();
        }

        Map<String, String> ids = new LinkedHashMap<>();
        String isrc = blankToNull(result.optString("isrc", null));

        JSONObject spotify = result.optJSONObject("spotify");
        if (spotify != null) {
            putIfPresent(ids, "spotify", spotify.optString("id", null));
            JSONObject external = spotify.optJSONObject("external_ids");
            if (isrc == null && external != null) {
                isrc = blankToNull(external.optString("isrc", null));
            }
        }
        JSONArray musicbrainz = result.optJSONArray("musicbrainz");
        if (musicbrainz != null && !musicbrainz.isEmpty() && musicbrainz.optJSONObject(0) != null) {
            JSONObject recording = musicbrainz.optJSONObject(0);
            putIfPresent(ids, "musicbrainz", recording.optString("id", null));
            JSONArray isrcs = recording.optJSONArray("isrcs");
            if (isrc == null && isrcs != null && !isrcs.isEmpty()) {
                isrc = blankToNull(isrcs.optString(0, null));
            }
        }
        JSONObject deezer = result.optJSONObject("deezer");
        if (deezer != null) {
            putIfPresent(ids, "deezer", deezer.optString("id", null));
        }

        Double score = null;
        if (result.has("score")) {
            double raw = result.optDouble("score", Double.NaN);
            if (!Double.isNaN(raw)) {
                score = Math.max(0.0, Math.min(1.0, raw / 100.0));
            }
        }
        TrackCandidate candidate = new TrackCandidate(title, artist,
                blankToNull(result.optString("album", null)),
                isrc,
                blankToNull(result.optString("label", null)),
                blankToNull(result.optString("release_date", null)),
                ids);
        return Optional.of(new Recognition(candidate, score));
    }

    private static void putIfPresent(Map<String, String> ids, String key, String value) {
        if (value != null && !value.isBlank()) {
            ids.put(key, value);
        }
    }

    private static JSONObject parseRoot(String json) {
        if (json == null || json.isBlank()) {
            throw new AdapterException("Empty AudD reply", AuddFullAudioAdapter.NAME);
        }
        try {
            return new JSONObject(json);
        } catch (JSONException e) {
            throw new AdapterException("Malformed AudD reply", AuddFullAudioAdapter.NAME, e);
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
