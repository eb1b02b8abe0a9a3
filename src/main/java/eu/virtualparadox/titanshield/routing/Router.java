package eu.virtualparadox.titanshield.routing;

import eu.virtualparadox.titanshield.knowledge.model.DocumentType;
import eu.virtualparadox.titanshield.query.model.Question;
import eu.virtualparadox.titanshield.util.VietnameseText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based classification of a question into READING, STEM or RAG, with no model involved.
 * <p>
 * READING rules are evaluated first, then STEM rules; anything else is RAG. For RAG questions the router also
 * extracts the year the question refers to, salient entity phrases and a category hint for retrieval.
 * The result depends on the input text and the static rule tables only.
 */
@Component
public class Router {

    /**
     * Routes on the stem and its options together, the way a reader sees the question. Year, entities and category
     * hint come from the stem alone, since options of a "which year" question are years themselves.
     */
    public RouteDecision route(final Question question) {
        return route(question.textWithOptions(), question.text());
    }

    public RouteDecision route(final String queryText) {
        return route(queryText, queryText);
    }

    private RouteDecision route(final String routingText, final String stem) {
        final String text = VietnameseText.normalize(routingText);
        if (text.isEmpty()) {
            return RouteDecision.of(RouteMode.RAG, null);
        }

        for (final RoutingRules.Rule rule : RoutingRules.READING) {
            if (rule.matches(text)) {
                return RouteDecision.of(RouteMode.READING, rule.label());
            }
        }
        for (final RoutingRules.Rule rule : RoutingRules.STEM) {
            if (rule.matches(text)) {
                return RouteDecision.of(RouteMode.STEM, rule.label());
            }
        }

        final String normalizedStem = VietnameseText.normalize(stem);
        return new RouteDecision(
                RouteMode.RAG,
                null,
                extractYear(normalizedStem),
                extractEntities(normalizedStem),
                categoryHint(normalizedStem));
    }

    /**
     * {@code năm YYYY} wins over a bare four-digit number; only years in {@code [1900, 2100]} count.
     */
    static Integer extractYear(final String text) {
        final Integer marked = firstYear(RoutingRules.YEAR_AFTER_MARKER.matcher(text));
        return marked != null ? marked : firstYear(RoutingRules.ANY_YEAR.matcher(text));
    }

    private static Integer firstYear(final Matcher matcher) {
        while (matcher.find()) {
            final int year = Integer.parseInt(matcher.group(1));
            if (year >= RoutingRules.MIN_YEAR && year <= RoutingRules.MAX_YEAR) {
                return year;
            }
        }
        return null;
    }

    /**
     * Domain markers and capitalised runs in order of appearance, without duplicates, at most
     * {@link RoutingRules#MAX_ENTITIES}. A single capitalised word opening a sentence is ordinary capitalisation and
     * is skipped.
     */
    static List<String> extractEntities(final String text) {
        final TreeMap<Integer, String> byPosition = new TreeMap<>();

        for (final Pattern marker : RoutingRules.DOMAIN_MARKERS) {
            final Matcher m = marker.matcher(text);
            while (m.find()) {
                byPosition.putIfAbsent(m.start(), m.group().trim());
            }
        }

        final Matcher runs = RoutingRules.CAPITALIZED_RUN.matcher(text);
        while (runs.find()) {
            final String run = runs.group();
            if (!run.contains(" ") && isSentenceStart(text, runs.start())) {
                continue;
            }
            if (!coveredByEarlier(byPosition, runs.start(), run)) {
                byPosition.putIfAbsent(runs.start(), run);
            }
        }

        final List<String> entities = new ArrayList<>();
        for (final Map.Entry<Integer, String> entry : byPosition.entrySet()) {
            final boolean duplicate = entities.stream().anyMatch(e -> e.equalsIgnoreCase(entry.getValue()));
            if (!duplicate) {
                entities.add(entry.getValue());
            }
            if (entities.size() == RoutingRules.MAX_ENTITIES) {
                break;
            }
        }
        return entities;
    }

    static Set<DocumentType> categoryHint(final String text) {
        final Set<DocumentType> hint = EnumSet.noneOf(DocumentType.class);
        for (final Map.Entry<DocumentType, List<Pattern>> entry : RoutingRules.CATEGORY_KEYWORDS.entrySet()) {
            for (final Pattern keyword : entry.getValue()) {
                if (keyword.matcher(text).find()) {
                    hint.add(entry.getKey());
                    break;
                }
            }
        }
        return hint;
    }

    private static boolean isSentenceStart(final String text, final int index) {
        for (int i = index - 1; i >= 0; i--) {
            final char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == '"' || c == '\'' || c == '(' || c == '“') {
                continue;
            }
            return c == '.' || c == '?' || c == '!' || c == ':';
        }
        return true;
    }

    private static boolean coveredByEarlier(final TreeMap<Integer, String> byPosition, final int start, final String run) {
        final Map.Entry<Integer, String> floor = byPosition.floorEntry(start);
        if (floor != null && floor.getKey() + floor.getValue().length() > start) {
            return true;
        }
        final Map.Entry<Integer, String> ceiling = byPosition.ceilingEntry(start);
        return ceiling != null && ceiling.getKey() < start + run.length();
    }
}
