package eu.virtualparadox.titanshield.knowledge.model;

import java.util.Objects;

/**
 * Immutable unit of retrievable knowledge.
 * <p>Validity years are inclusive on both ends. {@link #NO_EXPIRY} marks knowledge that has not been superseded.</p>
 *
 * @param id         unique chunk identifier
 * @param text       body text
 * @param source     source label (document or crawl origin)
 * @param type       subject classification
 * @param validFrom  first year the content is valid (inclusive)
 * @param validUntil last year the content is valid (inclusive)
 * @param region     region/scope tag, {@link #REGION_ALL} when unscoped
 */
public record Chunk(String id,
                    String text,
                    String source,
                    DocumentType type,
                    int validFrom,
                    int validUntil,
                    String region) {

    public static final int EARLIEST_YEAR = 1900;
    public static final int NO_EXPIRY = 9999;
    public static final String REGION_ALL = "ALL";

    public Chunk {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(text, "text");
        source = source == null ? "UNKNOWN" : source;
        type = type == null ? DocumentType.GENERAL : type;
        region = region == null || region.isBlank() ? REGION_ALL : region;
    }

    /**
     * Chunk with default metadata: valid from {@link #EARLIEST_YEAR}, never expiring, unscoped.
     */
    public static Chunk of(final String id, final String text, final String source, final DocumentType type) {
        return new Chunk(id, text, source, type, EARLIEST_YEAR, NO_EXPIRY, REGION_ALL);
    }

    /**
     * False when enrichment produced an inverted window ({@code validFrom > validUntil}).
     */
    public boolean hasConsistentValidity() {
        return validFrom <= validUntil;
    }
}
