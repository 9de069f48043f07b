package com.example.coverage.service;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Canonical form of free text for cross-language comparison.
 * <p>
 * Lower-cases, folds umlauts and accents through a fixed table (ä→a, ß→ss, œ→oe, ...),
 * strips any remaining combining marks, keeps {@code - . /} only between two
 * alphanumerics, turns every other non-alphanumeric into a space and collapses
 * whitespace. {@code normalize(normalize(x)).equals(normalize(x))} for every input.
 */
public final class TextNormalizer {

    private static final Map<Character, String> SUBSTITUTIONS = Map.ofEntries(
            Map.entry('ä', "a"), Map.entry('à', "a"), Map.entry('â', "a"), Map.entry('á', "a"),
            Map.entry('ö', "o"), Map.entry('ô', "o"), Map.entry('ó', "o"),
            Map.entry('ü', "u"), Map.entry('ù', "u"), Map.entry('û', "u"), Map.entry('ú', "u"),
            Map.entry('é', "e"), Map.entry('è', "e"), Map.entry('ê', "e"), Map.entry('ë', "e"),
            Map.entry('î', "i"), Map.entry('ï', "i"), Map.entry('í', "i"),
            Map.entry('ç', "c"),
            Map.entry('ß', "ss"),
            Map.entry('œ', "oe"),
            Map.entry('æ', "ae"),
            Map.entry('ÿ', "y"),
            Map.entry('ñ', "n")
    );

    private static final String JOINERS = "-./";
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";

        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder folded = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            String substitute = SUBSTITUTIONS.get(c);
            folded.append(substitute != null ? substitute : String.valueOf(c));
        }
        String stripped = COMBINING_MARKS.matcher(Normalizer.normalize(folded, Normalizer.Form.NFD)).replaceAll("");

        StringBuilder out = new StringBuilder(stripped.length());
        for (int i = 0; i < stripped.length(); i++) {
            char c = stripped.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                out.append(c);
            } else if (JOINERS.indexOf(c) >= 0 && isJoined(stripped, i)) {
                out.append(c);
            } else {
                out.append(' ');
            }
        }
        return WHITESPACE.matcher(out).replaceAll(" ").trim();
    }

    /** Tokens of the normalized text, split on spaces and joiners. */
    public static String[] tokens(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) return new String[0];
        return normalized.split("[\\s\\-./]+");
    }

    private static boolean isJoined(String s, int i) {
        return i > 0 && i < s.length() - 1
                && Character.isLetterOrDigit(s.charAt(i - 1))
                && Character.isLetterOrDigit(s.charAt(i + 1));
    }
}
