package org.tabular.lite.engine.fixup;

import org.tabular.lite.model.ModelNode;

import java.util.Comparator;
import java.util.List;

/**
 * The planned rewrite of one dependent formula.
 *
 * @param dependent    The formula-bearing node to rewrite
 * @param originalText The formula text the replacements were computed against
 * @param replacements Span replacements, in source order, never overlapping
 */
public record Rewrite(ModelNode dependent, String originalText, List<Replacement> replacements) {

    public Rewrite {
        replacements = List.copyOf(replacements);
    }

    /**
     * Splices the replacements into the original text, last span first so that earlier
     * offsets stay valid. Text outside the spans, including white space, is preserved.
     *
     * @return The rewritten formula
     * @throws IllegalStateException if a span no longer holds the text it was planned for
     */
    public String apply() {
        StringBuilder text = new StringBuilder(originalText);
        List<Replacement> lastFirst = replacements.stream()
                .sorted(Comparator.comparingInt(Replacement::start).reversed())
                .toList();
        for (Replacement r : lastFirst) {
            String actual = text.substring(r.start(), r.end());
            if (!actual.equals(r.expected())) {
                throw new IllegalStateException("Stale reference span in " + dependent
                        + ": expected '" + r.expected() + "' but found '" + actual + "'");
            }
            text.replace(r.start(), r.end(), r.replacement());
        }
        return text.toString();
    }
}
