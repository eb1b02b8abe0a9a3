package eu.virtualparadox.titanshield.util;

public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_SOURCE = "source";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_VALID_FROM = "validFrom";
    public static final String FIELD_VALID_UNTIL = "validUntil";
    public static final String FIELD_REGION = "region";

    private LuceneConstants() {
        // prevent instantiation
    }
}
