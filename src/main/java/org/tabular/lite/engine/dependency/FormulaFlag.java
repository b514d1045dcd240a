package org.tabular.lite.engine.dependency;

import java.util.Objects;

/**
 * A note left on a formula that an automatic rewrite could not update.
 *
 * The note belongs to the exact text it was written against: it is shown only while the
 * formula still has that text and still fails to tokenize.
 *
 * @param text    The formula text when it was flagged
 * @param message The message shown as the formula's error
 */
public record FormulaFlag(String text, String message) {

    public FormulaFlag {
        Objects.requireNonNull(text, "Text cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
    }
}
