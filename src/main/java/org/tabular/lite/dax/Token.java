package org.tabular.lite.dax;

/**
 * A classified span of formula text.
 * 
 * @param kind  The token classification
 * @param start Start offset in the source text, inclusive
 * @param end   End offset in the source text, exclusive
 * @param text  The source text of the span, including quotes or brackets
 */
public record Token(Kind kind, int start, int end, String text) {

    public enum Kind {
        IDENTIFIER, // Sales, SUM, VAR
        BRACKETED_REFERENCE, // [Amount]
        QUOTED_QUALIFIED_REFERENCE, // 'Sales Order'
        STRING_LITERAL, // "text"
        COMMENT, // -- line, // line, /* block */
        OTHER, // numbers, operators, delimiters
    }

    public Token {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        if (text.length() != end - start) {
            throw new IllegalArgumentException("Text length does not match span [" + start + ", " + end + ")");
        }
    }

    /**
     * @return The object name spelled by a reference or identifier token, with quoting
     *         removed
     */
    public String referenceName() {
        return switch (kind) {
            case BRACKETED_REFERENCE -> DaxNames.unbracket(text);
            case QUOTED_QUALIFIED_REFERENCE -> DaxNames.unquote(text);
            case IDENTIFIER -> text;
            default -> throw new IllegalStateException(kind + " does not name an object");
        };
    }

    /**
     * @param next The following token
     * @return true if the next token starts exactly where this one ends
     */
    public boolean touches(Token next) {
        return next != null && end == next.start;
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + start;
    }
}
