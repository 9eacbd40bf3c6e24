package com.phillippitts.airplay.service.adapter.acoustid;

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

/**
 * Parses AcoustID {@code /v2/lookup} replies.
 *
 * <p>The best-scored result that carries at least one recording wins; its score becomes the
 * match confidence.
 */
final class AcoustIdJsonParser {

    /** AcoustID error code for "too many requests". */
    static final int RATE_LIMIT_ERROR = 14;

    record Lookup(TrackCandidate candidate, double score) {}

    private AcoustIdJsonParser() {}

    static Optional<Lookup> parse(String json, int quotaLimit) {
        JSONObject root = parseRoot(json);
        String status = root.optString("status", "");
        if (!"ok".equals(status)) {
            JSONObject error = root.optJSONObject("error");
            int code = error == null ? -1 : error.optInt("code", -1);
            String message = error == null ? "unknown error" : error.optString("message", "unknown error");
            if (code == RATE_LIMIT_ERROR) {
                throw new AdapterQuotaExceededException(AcoustIdFingerprintAdapter.NAME, quotaLimit);
            }
            throw AdapterExceptionBuilder.create("AcoustID error: " + message)
                    .adapter(AcoustIdFingerprintAdapter.NAME)
                    .metadata("code", code)
                    .build();
        }

        JSONArray results = root.optJSONArray("results");
        if (results == null || results.isEmpty()) {
            return Optional.empty();
        }
        JSONObject best = null;
        double bestScore = -1.0;
        for (int i = 0; i < results.length(); i++) {
            JSONObject result = results.optJSONObject(i);
            if (result == null) {
                continue;
            }
            JSONArray recordings = result.optJSONArray("recordings");
            double score = result.optDouble("score", 0.0);
            if (recordings != null && !recordings.isEmpty() && score > bestScore) {
                best = result;
                bestScore = score;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        JSONObject recording = best.getJSONArray("recordings").optJSONObject(0);
        if (recording == null) {
            return Optional.empty();
        }
        String title = recording.optString("title", "");
        String artist = firstName(recording.optJSONArray("artists"));
        if (title.isBlank() || artist == null) {
            return Optional.empty();
        }

        String album = null;
        JSONArray groups = recording.optJSONArray("releasegroups");
        if (groups != null && !groups.isEmpty() && groups.optJSONObject(0) != null) {
            album = blankToNull(groups.optJSONObject(0).optString("title", null));
        }

        String isrc = null;
        String label = null;
        String date = null;
        JSONArray releases = recording.optJSONArray("releases");
        if (releases != null && !releases.isEmpty() && releases.optJSONObject(0) != null) {
            JSONObject release = releases.optJSONObject(0);
            JSONArray isrcs = release.optJSONArray("isrcs");
            if (isrcs != null && !isrcs.isEmpty()) {
                isrc = blankToNull(isrcs.optString(0, null));
            }
            JSONArray labelInfo = release.optJSONArray("label-info");
            if (labelInfo != null && !labelInfo.isEmpty() && labelInfo.optJSONObject(0) != null) {
                JSONObject lbl = labelInfo.optJSONObject(0).optJSONObject("label");
                label = lbl == null ? null : blankToNull(lbl.optString("name", null));
            }
            date = releaseDate(release.opt("date"));
        }
        if (isrc == null) {
            JSONArray isrcs = recording.optJSONArray("isrcs");
            if (isrcs != null && !isrcs.isEmpty()) {
                isrc = blankToNull(isrcs.optString(0, null));
            }
        }

        Map<String, String> ids = new LinkedHashMap<>();
        String mbid = blankToNull(recording.optString("id", null));
        if (mbid != null) {
            ids.put("musicbrainz", mbid);
        }
        String acoustId = blankToNull(best.optString("id", null));
        if (acoustId != null) {
            ids.put("acoustid", acoustId);
        }
        double score = Math.max(0.0, Math.min(1.0, bestScore));
        return Optional.of(new Lookup(new TrackCandidate(title, artist, album, isrc, label, date, ids), score));
    }

    /** AcoustID returns dates either as a string or as {@code {year, month, day}}. */
    private static String releaseDate(Object raw) {
        if (raw instanceof String s) {
            return blankToNull(s);
        }
        if (raw instanceof JSONObject d && d.has("year")) {
            int year = d.optInt("year");
            int month = d.optInt("month", 0);
            int day = d.optInt("day", 0);
            if (month > 0 && day > 0) {
                return String.format("%04d-%02d-%02d", year, month, day);
            }
            return month > 0 ? String.format("%04d-%02d", year, month) : String.valueOf(year);
        }
        return null;
    }

    private static String firstName(JSONArray artists) {
        if (artists == null || artists.isEmpty() || artists.optJSONObject(0) == null) {
            return null;
        }
        return blankToNull(artists.optJSONObject(0).optString("name", null));
    }

    private static JSONObject parseRoot(String json) {
        if (json == null || json.isBlank()) {
            throw new AdapterException("Empty AcoustID reply", AcoustIdFingerprintAdapter.NAME);
        }
        try {
            return new JSONObject(json);
        } catch (JSONException e) {
            throw new AdapterException("Malformed AcoustID reply", AcoustIdFingerprintAdapter.NAME, e);
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
