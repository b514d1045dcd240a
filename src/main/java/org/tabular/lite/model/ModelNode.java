package org.tabular.lite.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the semantic model: the model itself, a table, column, measure,
 * relationship, hierarchy, perspective, role or annotation.
 *
 * A node has a stable {@link NodeId}, a {@link NodeKind} tag, a parent and an ordered list
 * of children. Its name and every other property live in the graph's
 * {@link PropertyStore}; the getters here read through to it.
 *
 * Nodes are created and mutated only through their {@link ModelGraph}. A node removed
 * from the tree keeps its id, its properties and its own children, so undo can put the
 * same instance back.
 */
public final class ModelNode {

    private final ModelGraph graph;
    private final NodeId id;
    private final NodeKind kind;
    private final List<ModelNode> children = new ArrayList<>();
    private ModelNode parent;

    ModelNode(ModelGraph graph, NodeId id, NodeKind kind) {
        this.graph = Objects.requireNonNull(graph, "Graph cannot be null");
        this.id = Objects.requireNonNull(id, "Id cannot be null");
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
    }

    public NodeId id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    public ModelGraph graph() {
        return graph;
    }

    public String name() {
        return (String) graph.readProperty(this, NodeProperty.NAME);
    }

    /**
     * @param property The property to read
     * @return The stored value or the property default
     */
    public Object get(NodeProperty property) {
        return graph.readProperty(this, property);
    }

    /**
     * @return The formula text, empty for nodes without a formula
     */
    public String expression() {
        return kind.isFormulaBearing() ? (String) get(NodeProperty.EXPRESSION) : "";
    }

    public Optional<ModelNode> parent() {
        return Optional.ofNullable(parent);
    }

    public List<ModelNode> children() {
        return Collections.unmodifiableList(children);
    }

    public List<ModelNode> children(NodeKind childKind) {
        return children.stream().filter(c -> c.kind == childKind).toList();
    }

    /**
     * @return The position of this node among its parent's children, -1 if detached
     */
    public int index() {
        return parent == null ? -1 : parent.children.indexOf(this);
    }

    /**
     * @return true if this node is reachable from the model root
     */
    public boolean isAttached() {
        ModelNode n = this;
        while (n.parent != null) {
            n = n.parent;
        }
        return n == graph.root();
    }

    /**
     * @param other A possible ancestor
     * @return true if other is this node or one of its ancestors
     */
    public boolean isWithin(ModelNode other) {
        for (ModelNode n = this; n != null; n = n.parent) {
            if (n == other) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return The nearest table at or above this node
     */
    public Optional<ModelNode> table() {
        for (ModelNode n = this; n != null; n = n.parent) {
            if (n.kind == NodeKind.TABLE) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The formula view of this node, empty if its kind carries no formula
     */
    public Optional<FormulaBearing> formula() {
        return kind.isFormulaBearing() ? Optional.of(new Formula(this)) : Optional.empty();
    }

    // ==================== Structure (graph only) ====================

    void insertChild(int index, ModelNode child) {
        children.add(index, child);
        child.parent = this;
    }

    int removeChild(ModelNode child) {
        int index = children.indexOf(child);
        children.remove(index);
        child.parent = null;
        return index;
    }

    @Override
    public String toString() {
        return kind.nameClass() + " '" + name() + "' " + id;
    }

    private record Formula(ModelNode node) implements FormulaBearing {

        @Override
        public String expression() {
            return node.expression();
        }

        @Override
        public Optional<ModelNode> owningTable() {
            if (node.kind == NodeKind.TABLE) {
                return Optional.empty();
            }
            return node.parent().filter(p -> p.kind == NodeKind.TABLE);
        }
    }
}
