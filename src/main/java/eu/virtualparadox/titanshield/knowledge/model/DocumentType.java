package eu.virtualparadox.titanshield.knowledge.model;

import java.util.Locale;

/**
 * Subject classification of a knowledge chunk, assigned during offline enrichment.
 */
public enum DocumentType {
    LAW,
    HISTORY,
    GEOGRAPHY,
    CULTURE,
    POLITICS,
    MATH,
    GENERAL;

    /**
     * Lenient parse used when reading enrichment artifacts; unknown or missing labels become {@link #GENERAL}.
     */
    public static DocumentType fromLabel(final String label) {
        if (label == null || label.isBlank()) {
            return GENERAL;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            return GENERAL;
        }
    }
}
