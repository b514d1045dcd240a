package org.tabular.lite.engine.undo;

import org.tabular.lite.model.ModelGraph;
import org.tabular.lite.model.NodeId;

/**
 * A node, with its subtree, was inserted under a parent.
 *
 * @param nodeId   The added node
 * @param parentId The parent it was inserted under
 * @param index    Its position among the parent's children
 */
public record NodeAdded(NodeId nodeId, NodeId parentId, int index) implements UndoableAction {

    @Override
    public void apply(ModelGraph graph) {
        Placement.insert(graph, nodeId, parentId, index);
    }

    @Override
    public void revert(ModelGraph graph) {
        Placement.remove(graph, nodeId, parentId, index);
    }

    @Override
    public String describe() {
        return "add " + nodeId + " under " + parentId;
    }
}
