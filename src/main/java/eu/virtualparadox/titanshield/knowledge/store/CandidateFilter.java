package eu.virtualparadox.titanshield.knowledge.store;

import eu.virtualparadox.titanshield.knowledge.model.DocumentType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Restriction of the search universe applied inside both legs.
 * <p>
 * An empty type set means every type. A non-empty set always admits {@link DocumentType#GENERAL} as well, since
 * unclassified chunks are GENERAL and must not disappear behind a category hint. A {@code null} region means every
 * region; otherwise chunks tagged with that region or {@code ALL} qualify.
 *
 * @param types  admitted document types
 * @param region admitted region, or {@code null}
 */
public record CandidateFilter(Set<DocumentType> types, String region) {

    public static final CandidateFilter NONE = new CandidateFilter(Set.of(), null);

    public CandidateFilter {
        if (types == null || types.isEmpty()) {
            types = Set.of();
        } else {
            final EnumSet<DocumentType> admitted = EnumSet.copyOf(types);
            admitted.add(DocumentType.GENERAL);
            types = Set.copyOf(admitted);
        }
        region = region == null || region.isBlank() ? null : region;
    }

    public static CandidateFilter ofTypes(final Set<DocumentType> types) {
        return new CandidateFilter(types, null);
    }

    public boolean isUnrestricted() {
        return types.isEmpty() && region == null;
    }
}
