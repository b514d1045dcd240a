package org.tabular.lite.dax;

import java.util.List;

/**
 * Splits formula text into classified spans.
 *
 * Implementations are pure functions without shared state. Whitespace may be omitted from
 * the result; every returned span lies within the text and spans never overlap.
 */
@FunctionalInterface
public interface ExpressionTokenizer {

    /**
     * @param text The formula text
     * @return The tokens in source order
     * @throws TokenizeException if the text cannot be split, e.g. an unterminated literal
     */
    List<Token> tokenize(String text);
}
