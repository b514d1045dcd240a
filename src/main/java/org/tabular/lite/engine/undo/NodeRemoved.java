package org.tabular.lite.engine.undo;

import org.tabular.lite.model.ModelGraph;
import org.tabular.lite.model.NodeId;

/**
 * A node, with its subtree, was removed from a parent.
 *
 * @param nodeId   The removed node
 * @param parentId The parent it was removed from
 * @param index    The position it had among the parent's children
 */
public record NodeRemoved(NodeId nodeId, NodeId parentId, int index) implements UndoableAction {

    @Override
    public void apply(ModelGraph graph) {
        Placement.remove(graph, nodeId, parentId, index);
    }

    @Override
    public void revert(ModelGraph graph) {
        Placement.insert(graph, nodeId, parentId, index);
    }

    @Override
    public String describe() {
        return "remove " + nodeId + " from " + parentId;
    }
}
