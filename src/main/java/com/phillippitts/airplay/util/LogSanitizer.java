package com.phillippitts.airplay.util;

/** Utility for safe logging of stream titles, URLs and service payloads. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Drops the query string and user-info of a URL so API keys and tokens never reach the logs.
     * Returns "" for null.
     */
    public static String redactUrl(String url) {
        if (url == null) {
            return "";
        }
        String out = url;
        int q = out.indexOf('?');
        if (q >= 0) {
            out = out.substring(0, q) + "?***";
        }
        int scheme = out.indexOf("://");
        int at = out.indexOf('@');
        int pathStart = scheme < 0 ? -1 : out.indexOf('/', scheme + 3);
        if (scheme >= 0 && at > scheme && (pathStart < 0 || at < pathStart)) {
            out = out.substring(0, scheme + 3) + "***@" + out.substring(at + 1);
        }
        return out;
    }
}
