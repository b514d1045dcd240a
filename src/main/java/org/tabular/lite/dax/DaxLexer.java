package org.tabular.lite.dax;

import org.tabular.lite.dax.Token.Kind;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for DAX formula text.
 * Converts a formula into a list of classified tokens; whitespace is skipped.
 *
 * The lexer only classifies. It does not check that the formula is well formed, so any
 * text made of complete tokens is accepted; only unterminated literals, quoted names,
 * bracketed names and block comments are errors.
 */
public final class DaxLexer {

    private final String input;
    private int position;

    public DaxLexer(String input) {
        this.input = input;
        this.position = 0;
    }

    /**
     * Tokenizes the entire input string.
     *
     * @return List of tokens
     * @throws TokenizeException on an unterminated construct
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (position < input.length()) {
            skipWhitespace();
            if (position >= input.length())
                break;

            tokens.add(nextToken());
        }

        return tokens;
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    private Token nextToken() {
        char c = input.charAt(position);
        int start = position;

        if (input.startsWith("//", position) || input.startsWith("--", position)) {
            return readLineComment();
        }
        if (input.startsWith("/*", position)) {
            return readBlockComment();
        }

        switch (c) {
            case '"':
                return readDelimited(Kind.STRING_LITERAL, '"', "string literal");
            case '\'':
                return readDelimited(Kind.QUOTED_QUALIFIED_REFERENCE, '\'', "quoted name");
            case '[':
                return readDelimited(Kind.BRACKETED_REFERENCE, ']', "bracketed name");
            default:
                break;
        }

        if (Character.isLetter(c) || c == '_') {
            return readIdentifier();
        }

        if (Character.isDigit(c)) {
            return readNumber();
        }

        // Two-character operators
        if (position + 1 < input.length()) {
            String twoChar = input.substring(position, position + 2);
            boolean isOperator = switch (twoChar) {
                case "<=", ">=", "<>", "==", "&&", "||" -> true;
                default -> false;
            };
            if (isOperator) {
                position += 2;
                return token(Kind.OTHER, start);
            }
        }

        position++;
        return token(Kind.OTHER, start);
    }

    private Token readLineComment() {
        int start = position;
        while (position < input.length() && input.charAt(position) != '\n' && input.charAt(position) != '\r') {
            position++;
        }
        return token(Kind.COMMENT, start);
    }

    private Token readBlockComment() {
        int start = position;
        int close = input.indexOf("*/", position + 2);
        if (close < 0) {
            throw new TokenizeException("Unterminated block comment", start);
        }
        position = close + 2;
        return token(Kind.COMMENT, start);
    }

    /**
     * Reads up to the closing delimiter; a doubled closing delimiter is an escaped one.
     */
    private Token readDelimited(Kind kind, char close, String description) {
        int start = position;
        position++; // skip opening delimiter

        while (position < input.length()) {
            if (input.charAt(position) == close) {
                if (position + 1 < input.length() && input.charAt(position + 1) == close) {
                    position += 2;
                    continue;
                }
                position++; // skip closing delimiter
                return token(kind, start);
            }
            position++;
        }

        throw new TokenizeException("Unterminated " + description, start);
    }

    private Token readIdentifier() {
        int start = position;
        while (position < input.length()) {
            char c = input.charAt(position);
            if (Character.isLetterOrDigit(c) || c == '_') {
                position++;
            } else if (c == '.' && position + 1 < input.length() && Character.isLetter(input.charAt(position + 1))) {
                position++; // dotted function names such as PERCENTILE.INC
            } else {
                break;
            }
        }
        return token(Kind.IDENTIFIER, start);
    }

    private Token readNumber() {
        int start = position;
        boolean hasDecimal = false;
        while (position < input.length()) {
            char c = input.charAt(position);
            if (Character.isDigit(c)) {
                position++;
            } else if (c == '.' && !hasDecimal) {
                hasDecimal = true;
                position++;
            } else {
                break;
            }
        }
        return token(Kind.OTHER, start);
    }

    private Token token(Kind kind, int start) {
        return new Token(kind, start, position, input.substring(start, position));
    }
}
