package com.phillippitts.airplay.service.fingerprint.chromaprint;

import com.phillippitts.airplay.exception.FingerprintException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses fpcalc {@code -json} output. Both modes print one object:
 * <pre>
 * {"duration": 10.03, "fingerprint": "AQADtEmk..."}      (default)
 * {"duration": 10.03, "fingerprint": [39837726, ...]}     (-raw)
 * </pre>
 * Malformed output is an error: a blank fingerprint must never reach the store.
 */
final class FpcalcJsonParser {

    private FpcalcJsonParser() {}

    record RawOutput(int[] fingerprint, double durationSeconds) {}

    record EncodedOutput(String fingerprint, double durationSeconds) {}

    static RawOutput parseRaw(String json) {
        JSONObject obj = parseObject(json);
        JSONArray values = obj.optJSONArray("fingerprint");
        if (values == null || values.isEmpty()) {
            throw new FingerprintException("fpcalc output has no raw fingerprint");
        }
        int[] raw = new int[values.length()];
        for (int i = 0; i < values.length(); i++) {
            // fpcalc prints unsigned 32-bit values; keep the bit pattern
            raw[i] = (int) values.optLong(i);
        }
        return new RawOutput(raw, obj.optDouble("duration", 0.0));
    }

    static EncodedOutput parseEncoded(String json) {
        JSONObject obj = parseObject(json);
        String fingerprint = obj.optString("fingerprint", "");
        if (fingerprint.isBlank()) {
            throw new FingerprintException("fpcalc output has no fingerprint");
        }
        return new EncodedOutput(fingerprint, obj.optDouble("duration", 0.0));
    }

    private static JSONObject parseObject(String json) {
        if (json == null || json.isBlank()) {
            throw new FingerprintException("fpcalc produced no output");
        }
        try {
            return new JSONObject(json);
        } catch (JSONException e) {
            throw new FingerprintException("fpcalc output is not valid JSON", e);
        }
    }
}
