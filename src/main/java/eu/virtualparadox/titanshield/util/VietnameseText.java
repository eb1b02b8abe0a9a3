package eu.virtualparadox.titanshield.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text helpers for Vietnamese input.
 * <p>
 * Vietnamese diacritics can arrive precomposed ({@code ế}) or decomposed ({@code e + ̂ + ́}) depending on the
 * producer. Everything that matches phrases against user text goes through {@link #normalize(String)} first, so
 * the two encodings compare equal while {@code cấm} and {@code cam} stay distinct.
 */
public final class VietnameseText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private VietnameseText() {
        // prevent instantiation
    }

    /**
     * NFC-normalises and collapses whitespace. Case is preserved.
     *
     * @param text raw text, may be {@code null}
     * @return normalised text, never {@code null}
     */
    public static String normalize(final String text) {
        if (text == null) {
            return "";
        }
        final String composed = Normalizer.normalize(text, Normalizer.Form.NFC);
        return WHITESPACE.matcher(composed).replaceAll(" ").trim();
    }

    /**
     * {@link #normalize(String)} followed by locale-neutral lower-casing.
     */
    public static String fold(final String text) {
        return normalize(text).toLowerCase(Locale.ROOT);
    }

    /**
     * Compiles a phrase into a case-insensitive pattern anchored on syllable boundaries, so {@code "cấm"} matches
     * {@code "bị Cấm"} but not a longer word that merely starts with the same letters.
     */
    public static Pattern phrasePattern(final String phrase) {
        final String folded = fold(phrase);
        return Pattern.compile(
                "(?<![\\p{L}\\p{N}])" + Pattern.quote(folded) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
