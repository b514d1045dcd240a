package org.tabular.lite.model;

/**
 * Stable identity of a model node.
 * 
 * Assigned once when the node is created and never reused within a graph.
 * Edges, undo actions and the dependency index refer to nodes by id, never by name,
 * so a rename only has to touch the formula text that spells the old name.
 * 
 * @param value The sequence number within the owning graph
 */
public record NodeId(long value) implements Comparable<NodeId> {

    public NodeId {
        if (value <= 0) {
            throw new IllegalArgumentException("Node id must be positive: " + value);
        }
    }

    @Override
    public int compareTo(NodeId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
