package org.tabular.lite.dax;

/**
 * Exception thrown when formula text cannot be tokenized.
 * Carries the offset at which tokenizing stopped.
 */
public class TokenizeException extends RuntimeException {

    private final int position;

    public TokenizeException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
