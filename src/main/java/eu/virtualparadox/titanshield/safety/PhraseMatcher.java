package eu.virtualparadox.titanshield.safety;

import eu.virtualparadox.titanshield.util.VietnameseText;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Literal phrase lookup, case-insensitive and insensitive to how Vietnamese diacritics were encoded.
 * Phrases match on word boundaries and are tried in configuration order.
 */
public final class PhraseMatcher {

    private final List<String> phrases;
    private final List<Pattern> patterns;

    public PhraseMatcher(final List<String> phrases) {
        this.phrases = new ArrayList<>();
        this.patterns = new ArrayList<>();
        for (final String phrase : phrases) {
            if (phrase == null || phrase.isBlank()) {
                continue;
            }
            this.phrases.add(VietnameseText.normalize(phrase));
            this.patterns.add(VietnameseText.phrasePattern(phrase));
        }
    }

    /**
     * @return the first configured phrase occurring in {@code text}
     */
    public Optional<String> firstMatch(final String text) {
        final String normalized = VietnameseText.normalize(text);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i).matcher(normalized).find()) {
                return Optional.of(phrases.get(i));
            }
        }
        return Optional.empty();
    }

    public boolean matches(final String text) {
        return firstMatch(text).isPresent();
    }

    public int size() {
        return patterns.size();
    }
}
