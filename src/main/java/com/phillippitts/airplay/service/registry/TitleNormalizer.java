package com.phillippitts.airplay.service.registry;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes titles and artist credits for best-effort deduplication of tracks without ISRC.
 *
 * <p>Lower-cases, strips accents and punctuation, drops release decorations ("feat", "radio edit",
 * "official audio", ...) and collapses whitespace. Noisy metadata can still leave duplicates.
 */
public final class TitleNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    // multi-word decorations first so "radio edit" is removed before "edit"
    private static final List<Pattern> DECORATIONS = List.of(
            word("radio edit"), word("original mix"), word("extended mix"),
            word("official music video"), word("official video"), word("official audio"),
            word("lyric video"), word("lyrics video"),
            word("featuring"), word("feat"), word("ft"), word("prod"),
            word("remix"), word("edit"), word("version"), word("extended"),
            word("official"), word("video"), word("lyrics"), word("lyric"), word("audio"));

    private TitleNormalizer() {}

    /**
     * Returns the normalized form; "" for null. A text made only of decorations ("Video",
     * "Radio Edit") keeps its words, since dropping them would leave nothing to compare.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String s = Normalizer.normalize(text, Normalizer.Form.NFD);
        s = DIACRITICS.matcher(s).replaceAll("");
        s = s.toLowerCase(Locale.ROOT);
        String words = NON_WORD.matcher(s).replaceAll(" ");
        String stripped = words;
        for (Pattern decoration : DECORATIONS) {
            stripped = decoration.matcher(stripped).replaceAll(" ");
        }
        stripped = SPACES.matcher(stripped).replaceAll(" ").trim();
        if (!stripped.isEmpty()) {
            return stripped;
        }
        String plain = SPACES.matcher(words).replaceAll(" ").trim();
        return plain.isEmpty() ? text.trim().toLowerCase(Locale.ROOT) : plain;
    }

    /**
     * Deduplication key of a (title, artist) pair.
     */
    public static String key(String title, String artist) {
        return normalize(title) + '|' + normalize(artist);
    }

    /**
     * Similarity of two strings after normalization: {@code 1 - levenshtein / maxLength}.
     *
     * @return value in [0, 1]; 1.0 when both normalize to the same text
     */
    public static double similarity(String a, String b) {
        String x = normalize(a);
        String y = normalize(b);
        if (x.equals(y)) {
            return 1.0;
        }
        int max = Math.max(x.length(), y.length());
        if (max == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(x, y) / max;
    }

    private static int levenshtein(String x, String y) {
        int[] prev = new int[y.length() + 1];
        int[] curr = new int[y.length() + 1];
        for (int j = 0; j <= y.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= x.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= y.length(); j++) {
                int cost = x.charAt(i - 1) == y.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[y.length()];
    }

    private static Pattern word(String phrase) {
        return Pattern.compile("\\b" + phrase.replace(" ", "\\s+") + "\\b");
    }
}
