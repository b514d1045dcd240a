package org.tabular.lite.engine.undo;

import org.tabular.lite.model.ModelGraph;
import org.tabular.lite.model.ModelNode;
import org.tabular.lite.model.NodeId;

/**
 * A node changed parent or position.
 *
 * @param nodeId       The moved node
 * @param fromParentId The parent before the move
 * @param fromIndex    The position before the move
 * @param toParentId   The parent after the move
 * @param toIndex      The position after the move
 */
public record NodeMoved(NodeId nodeId, NodeId fromParentId, int fromIndex, NodeId toParentId, int toIndex)
        implements UndoableAction {

    @Override
    public void apply(ModelGraph graph) {
        move(graph, fromParentId, fromIndex, toParentId, toIndex);
    }

    @Override
    public void revert(ModelGraph graph) {
        move(graph, toParentId, toIndex, fromParentId, fromIndex);
    }

    private void move(ModelGraph graph, NodeId expectedParent, int expectedIndex, NodeId parentId, int index) {
        ModelNode node = Placement.expectAt(graph, nodeId, expectedParent, expectedIndex);
        graph.relocate(node, graph.node(parentId), index);
    }

    @Override
    public String describe() {
        return "move " + nodeId + " from " + fromParentId + " to " + toParentId;
    }
}
