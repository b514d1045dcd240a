package org.tabular.lite.dax;

import java.util.List;
import java.util.Objects;

/**
 * Default {@link ExpressionTokenizer}: runs a fresh {@link DaxLexer} per call.
 */
public final class DaxTokenizer implements ExpressionTokenizer {

    @Override
    public List<Token> tokenize(String text) {
        Objects.requireNonNull(text, "Formula text cannot be null");
        return List.copyOf(new DaxLexer(text).tokenize());
    }
}
