package org.tabular.lite.engine.dependency;

import org.tabular.lite.model.NodeId;

import java.util.Objects;

/**
 * One object reference found in a formula: the span of text that names the object and the
 * node it resolved to.
 *
 * A qualified reference such as 'Sales'[Amount] yields two spans: a TABLE span for
 * 'Sales' whose {@code qualifies} is the Amount column, and an OBJECT span for [Amount].
 *
 * @param start     Start offset in the formula, inclusive
 * @param end       End offset in the formula, exclusive
 * @param part      Which part of the reference this span names
 * @param text      The formula text of the span
 * @param target    The node the span resolved to, or null if unresolved
 * @param qualifies For TABLE spans, the node of the column or measure this table
 *                  qualifies; null otherwise
 */
public record ReferenceSpan(int start, int end, Part part, String text, NodeId target, NodeId qualifies) {

    public enum Part {
        TABLE,
        OBJECT
    }

    public ReferenceSpan {
        Objects.requireNonNull(part, "Part cannot be null");
        Objects.requireNonNull(text, "Text cannot be null");
    }

    public boolean isResolved() {
        return target != null;
    }

    /**
     * @param id A node id
     * @return true if this span has to change when the node is renamed or moved
     */
    public boolean concerns(NodeId id) {
        return id.equals(target) || id.equals(qualifies);
    }
}
