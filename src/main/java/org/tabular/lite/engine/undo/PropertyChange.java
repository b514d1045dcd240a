package org.tabular.lite.engine.undo;

import org.tabular.lite.model.ModelGraph;
import org.tabular.lite.model.ModelNode;
import org.tabular.lite.model.NodeId;
import org.tabular.lite.model.NodeProperty;

import java.util.Objects;

/**
 * A property of a node changed from one value to another.
 *
 * @param nodeId   The node written to
 * @param property The property written
 * @param oldValue The value before the write
 * @param newValue The value after the write
 */
public record PropertyChange(NodeId nodeId, NodeProperty property, Object oldValue, Object newValue)
        implements UndoableAction {

    public PropertyChange {
        Objects.requireNonNull(nodeId, "Node id cannot be null");
        Objects.requireNonNull(property, "Property cannot be null");
    }

    @Override
    public void apply(ModelGraph graph) {
        write(graph, oldValue, newValue);
    }

    @Override
    public void revert(ModelGraph graph) {
        write(graph, newValue, oldValue);
    }

    private void write(ModelGraph graph, Object expected, Object value) {
        ModelNode node = graph.node(nodeId);
        Object current = graph.readProperty(node, property);
        if (!Objects.equals(current, expected)) {
            throw new UndoStateException(
                    "Expected " + property + " of " + nodeId + " to be '" + expected + "' but found '" + current + "'");
        }
        graph.writeProperty(node, property, value);
    }

    @Override
    public String describe() {
        return "set " + property + " of " + nodeId;
    }
}
