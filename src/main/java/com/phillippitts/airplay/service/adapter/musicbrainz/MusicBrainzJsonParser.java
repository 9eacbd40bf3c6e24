package com.phillippitts.airplay.service.adapter.musicbrainz;

import com.phillippitts.airplay.domain.TrackCandidate;
import com.phillippitts.airplay.exception.AdapterException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses MusicBrainz web service JSON ({@code fmt=json}).
 */
final class MusicBrainzJsonParser {

    private MusicBrainzJsonParser() {}

    /**
     * First recording of a search reply, or empty when the search found nothing.
     */
    static Optional<TrackCandidate> firstRecording(String json) {
        JSONObject root = parse(json);
        JSONArray recordings = root.optJSONArray("recordings");
        if (recordings == null || recordings.isEmpty()) {
            return Optional.empty();
        }
        JSONObject recording = recordings.optJSONObject(0);
        if (recording == null || recording.optString("title", "").isBlank()) {
            return Optional.empty();
        }
        String artist = artistCredit(recording.optJSONArray("artist-credit"));
        if (artist.isBlank()) {
            return Optional.empty();
        }

        String album = null;
        String releaseDate = null;
        String label = null;
        JSONArray releases = recording.optJSONArray("releases");
        if (releases != null && !releases.isEmpty()) {
            JSONObject release = releases.optJSONObject(0);
            if (release != null) {
                album = blankToNull(release.optString("title", null));
                releaseDate = blankToNull(release.optString("date", null));
                label = firstLabel(release.optJSONArray("label-info"));
            }
        }
        List<String> isrcs = isrcs(recording);
        Map<String, String> ids = new LinkedHashMap<>();
        String mbid = blankToNull(recording.optString("id", null));
        if (mbid != null) {
            ids.put("musicbrainz", mbid);
        }
        return Optional.of(new TrackCandidate(recording.getString("title"), artist, album,
                isrcs.isEmpty() ? null : isrcs.get(0), label, releaseDate, ids));
    }

    /**
     * ISRC list of a recording lookup ({@code inc=isrcs}).
     */
    static List<String> isrcs(String json) {
        return isrcs(parse(json));
    }

    private static List<String> isrcs(JSONObject recording) {
        JSONArray arr = recording.optJSONArray("isrcs");
        List<String> out = new ArrayList<>();
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                String isrc = arr.optString(i, "");
                if (!isrc.isBlank()) {
                    out.add(isrc);
                }
            }
        }
        return out;
    }

    private static String artistCredit(JSONArray credits) {
        if (credits == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < credits.length(); i++) {
            JSONObject credit = credits.optJSONObject(i);
            if (credit == null) {
                continue;
            }
            String name = credit.optString("name", "");
            if (name.isBlank()) {
                JSONObject artist = credit.optJSONObject("artist");
                name = artist == null ? "" : artist.optString("name", "");
            }
            sb.append(name).append(credit.optString("joinphrase", ""));
        }
        return sb.toString().trim();
    }

    private static String firstLabel(JSONArray labelInfo) {
        if (labelInfo == null || labelInfo.isEmpty()) {
            return null;
        }
        JSONObject info = labelInfo.optJSONObject(0);
        JSONObject label = info == null ? null : info.optJSONObject("label");
        return label == null ? null : blankToNull(label.optString("name", null));
    }

    private static JSONObject parse(String json) {
        if (json == null || json.isBlank()) {
            throw new AdapterException("Empty MusicBrainz reply", "musicbrainz");
        }
        try {
            return new JSONObject(json);
        } catch (JSONException e) {
            throw new AdapterException("Malformed MusicBrainz reply", "musicbrainz", e);
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
