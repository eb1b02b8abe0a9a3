package eu.virtualparadox.titanshield.query.model;

import java.util.List;
import java.util.Objects;

/**
 * A multiple-choice question. Options are labelled A, B, C, ... in order; any number of options is allowed.
 *
 * @param id      question identifier ({@code qid} in the input files)
 * @param text    question stem, possibly including a reading passage
 * @param options option texts in display order
 * @param answer  gold answer letter when known, otherwise {@code null}
 */
public record Question(String id, String text, List<String> options, String answer) {

    public Question {
        Objects.requireNonNull(id, "id");
        text = text == null ? "" : text;
        options = options == null ? List.of() : List.copyOf(options);
    }

    public Question(final String id, final String text, final List<String> options) {
        this(id, text, options, null);
    }

    public int optionCount() {
        return options.size();
    }

    /**
     * Stem followed by every option, the text rules are evaluated on.
     */
    public String textWithOptions() {
        if (options.isEmpty()) {
            return text;
        }
        return text + " " + String.join(" ", options);
    }
}
