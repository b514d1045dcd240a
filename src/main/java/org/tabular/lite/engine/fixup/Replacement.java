package org.tabular.lite.engine.fixup;

/**
 * Replacement of one reference span inside a formula.
 *
 * @param start       Start offset, inclusive
 * @param end         End offset, exclusive
 * @param expected    The text the span holds before the replacement
 * @param replacement The text to put in its place
 */
public record Replacement(int start, int end, String expected, String replacement) {
}
