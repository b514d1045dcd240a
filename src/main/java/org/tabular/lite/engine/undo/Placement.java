package org.tabular.lite.engine.undo;

import org.tabular.lite.model.ModelGraph;
import org.tabular.lite.model.ModelNode;
import org.tabular.lite.model.NodeId;

/**
 * Structural replay shared by the add, remove and move actions.
 */
final class Placement {

    private Placement() {
    }

    static void insert(ModelGraph graph, NodeId nodeId, NodeId parentId, int index) {
        ModelNode node = graph.node(nodeId);
        if (node.parent().isPresent()) {
            throw new UndoStateException("Expected " + nodeId + " to be detached but it is under "
                    + node.parent().get().id());
        }
        graph.attach(node, graph.node(parentId), index);
    }

    static void remove(ModelGraph graph, NodeId nodeId, NodeId parentId, int index) {
        graph.detach(expectAt(graph, nodeId, parentId, index));
    }

    static ModelNode expectAt(ModelGraph graph, NodeId nodeId, NodeId parentId, int index) {
        ModelNode node = graph.node(nodeId);
        NodeId actualParent = node.parent().map(ModelNode::id).orElse(null);
        if (!parentId.equals(actualParent) || node.index() != index) {
            throw new UndoStateException("Expected " + nodeId + " at " + parentId + "[" + index
                    + "] but found it at " + actualParent + "[" + node.index() + "]");
        }
        return node;
    }
}
