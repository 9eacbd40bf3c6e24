package com.phillippitts.airplay.service.registry;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * ISRC normalization and validation.
 *
 * <p>An ISRC is 12 characters: country (2 letters), registrant (3 alphanumerics),
 * year (2 digits) and designation (5 digits). Sources report it with or without dashes
 * and spaces, in either case.
 */
public final class IsrcCodes {

    private static final Pattern ISRC = Pattern.compile("^[A-Z]{2}[A-Z0-9]{3}\\d{7}$");

    private IsrcCodes() {}

    /**
     * Returns the canonical form (no separators, upper case) or null when absent or invalid.
     */
    public static String normalize(String isrc) {
        if (isrc == null) {
            return null;
        }
        String compact = isrc.replace("-", "").replace(" ", "").trim().toUpperCase(Locale.ROOT);
        return isValid(compact) ? compact : null;
    }

    public static boolean isValid(String isrc) {
        return isrc != null && ISRC.matcher(isrc).matches();
    }
}
