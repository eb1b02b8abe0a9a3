package eu.virtualparadox.titanshield.rag.llm;

import eu.virtualparadox.titanshield.util.VietnameseText;

import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the chosen option from a free-form model reply.
 * <p>
 * Tried in order: an explicit marker ({@code Đáp án: B}, {@code Answer: B}, {@code Lựa chọn: B}), a letter that
 * opens the reply ({@code B.}, {@code (B)}), then the first standalone letter anywhere. Only letters within the
 * option range count.
 */
public final class AnswerLetterParser {

    /** Options beyond Z cannot be named by a letter. */
    public static final int MAX_OPTIONS = 26;

    private static final Pattern MARKER = Pattern.compile(
            "(?:ĐÁP\\s*ÁN|ANSWER|LỰA\\s*CHỌN)(?:\\s+(?:ĐÚNG|CUỐI CÙNG|LÀ|IS))*\\s*[:：\\-]?\\s*[*(\\[\"']*\\s*([A-Z])(?![\\p{L}\\p{N}])");
    private static final Pattern LEADING = Pattern.compile("^[\\s*(\\[\"']*([A-Z])(?![\\p{L}\\p{N}])");
    private static final Pattern STANDALONE = Pattern.compile("(?<![\\p{L}\\p{N}])([A-Z])(?![\\p{L}\\p{N}])");

    private AnswerLetterParser() {
        // prevent instantiation
    }

    /**
     * @param reply       model output, may be {@code null}
     * @param optionCount number of options of the question
     * @return zero-based option index, or empty if no valid letter was found
     */
    public static OptionalInt parse(final String reply, final int optionCount) {
        if (reply == null || optionCount <= 0) {
            return OptionalInt.empty();
        }
        final String text = VietnameseText.normalize(reply).toUpperCase(Locale.ROOT);

        OptionalInt found = firstInRange(MARKER.matcher(text), optionCount);
        if (found.isPresent()) {
            return found;
        }
        found = firstInRange(LEADING.matcher(text), optionCount);
        if (found.isPresent()) {
            return found;
        }
        return firstInRange(STANDALONE.matcher(text), optionCount);
    }

    /**
     * @return {@code 'A' + index}
     */
    public static String letterOf(final int index) {
        if (index < 0 || index >= MAX_OPTIONS) {
            throw new IllegalArgumentException("No letter for option index " + index);
        }
        return String.valueOf((char) ('A' + index));
    }

    /**
     * @return {@code "A, B, C"} for three options
     */
    public static String lettersUpTo(final int optionCount) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(optionCount, MAX_OPTIONS); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(letterOf(i));
        }
        return sb.toString();
    }

    private static OptionalInt firstInRange(final Matcher matcher, final int optionCount) {
        while (matcher.find()) {
            final int index = matcher.group(1).charAt(0) - 'A';
            if (index < optionCount && index < MAX_OPTIONS) {
                return OptionalInt.of(index);
            }
        }
        return OptionalInt.empty();
    }
}
