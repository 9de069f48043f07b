package com.example.coverage.service;

/**
 * Term comparison with the short-token guard: a term that normalizes to
 * {@value #SHORT_TOKEN_LENGTH} characters or fewer only ever matches by exact equality,
 * never as a substring. Without it "asr" (anti-slip regulation) would be found inside
 * "abgasrueckfuehrung" (exhaust gas recirculation).
 * <p>
 * Every comparison between a vocabulary term and a policy term goes through this class.
 */
public final class TermMatcher {

    public static final int SHORT_TOKEN_LENGTH = 3;

    private TermMatcher() {
    }

    /**
     * Symmetric match of two terms: equality when either side is short,
     * otherwise containment in either direction.
     */
    public static boolean isMatch(String a, String b) {
        String na = TextNormalizer.normalize(a);
        String nb = TextNormalizer.normalize(b);
        if (na.isEmpty() || nb.isEmpty()) return false;
        if (isShort(na) || isShort(nb)) {
            return na.equals(nb);
        }
        return na.contains(nb) || nb.contains(na);
    }

    /**
     * Whether {@code term} occurs in {@code text}. A short term must equal one of the
     * text's tokens; a longer term may occur anywhere.
     */
    public static boolean containsTerm(String text, String term) {
        String nt = TextNormalizer.normalize(term);
        if (nt.isEmpty()) return false;
        if (isShort(nt)) {
            for (String token : TextNormalizer.tokens(text)) {
                if (token.equals(nt)) return true;
            }
            return false;
        }
        return TextNormalizer.normalize(text).contains(nt);
    }

    public static boolean isShort(String normalized) {
        return normalized.length() <= SHORT_TOKEN_LENGTH;
    }
}
