package org.tabular.lite.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The object graph of one semantic model.
 *
 * Owns node identity (id allocation), tree structure and change notification, and
 * delegates property values to a {@link PropertyStore}. Provides:
 * - Lookups by id and by name (tables, columns, measures), case-insensitive like DAX
 * - Validation of names and placements, without side effects
 * - Raw mutators that apply one primitive change and notify listeners
 *
 * The raw mutators do not record undo history. Edits that must be undoable go through
 * the modeling session, which validates, calls the mutator and records the action;
 * undo and redo replay recorded actions through the same mutators.
 */
public final class ModelGraph {

    private final PropertyStore store;
    private final Map<NodeId, ModelNode> nodes = new HashMap<>();
    private final List<ModelChangeListener> listeners = new ArrayList<>();
    private final ModelNode root;
    private long lastId;

    public ModelGraph(String modelName) {
        this(new InMemoryPropertyStore(), modelName);
    }

    public ModelGraph(PropertyStore store, String modelName) {
        this.store = Objects.requireNonNull(store, "Property store cannot be null");
        checkNameSyntax(modelName, null);
        this.root = allocate(NodeKind.MODEL);
        store.write(root, NodeProperty.NAME, modelName);
    }

    public ModelNode root() {
        return root;
    }

    // ==================== Creation ====================

    /**
     * Creates a detached node. It becomes part of the model once attached.
     *
     * @param kind The node kind, anything but MODEL
     * @param name The initial name
     * @return The new node with a fresh id
     */
    public ModelNode createNode(NodeKind kind, String name) {
        if (kind == NodeKind.MODEL) {
            throw new IllegalArgumentException("A graph has exactly one model node");
        }
        checkNameSyntax(name, null);
        ModelNode node = allocate(kind);
        store.write(node, NodeProperty.NAME, name);
        return node;
    }

    private ModelNode allocate(NodeKind kind) {
        ModelNode node = new ModelNode(this, new NodeId(++lastId), kind);
        nodes.put(node.id(), node);
        return node;
    }

    // ==================== Lookup ====================

    /**
     * @param id A node id
     * @return The node, attached or not, if it was created by this graph
     */
    public Optional<ModelNode> find(NodeId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * @param id A node id
     * @return The node
     * @throws IllegalArgumentException if the id is unknown
     */
    public ModelNode node(NodeId id) {
        ModelNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node " + id);
        }
        return node;
    }

    public List<ModelNode> tables() {
        return root.children(NodeKind.TABLE);
    }

    public Stream<ModelNode> measures() {
        return tables().stream().flatMap(t -> t.children(NodeKind.MEASURE).stream());
    }

    public Optional<ModelNode> findTable(String name) {
        return tables().stream().filter(t -> t.name().equalsIgnoreCase(name)).findFirst();
    }

    public Optional<ModelNode> findMeasure(String name) {
        return measures().filter(m -> m.name().equalsIgnoreCase(name)).findFirst();
    }

    public Optional<ModelNode> findColumn(ModelNode table, String name) {
        return table.children().stream()
                .filter(c -> c.kind().isColumn() && c.name().equalsIgnoreCase(name))
                .findFirst();
    }

    /**
     * @param table A table
     * @param name  A column or measure name
     * @return The column of that name, else the measure of that name in the table
     */
    public Optional<ModelNode> findColumnOrMeasure(ModelNode table, String name) {
        Optional<ModelNode> column = findColumn(table, name);
        if (column.isPresent()) {
            return column;
        }
        return table.children(NodeKind.MEASURE).stream()
                .filter(m -> m.name().equalsIgnoreCase(name))
                .findFirst();
    }

    /**
     * @param node The subtree root
     * @return The node followed by all its descendants, depth first
     */
    public Stream<ModelNode> subtree(ModelNode node) {
        return Stream.concat(Stream.of(node), node.children().stream().flatMap(this::subtree));
    }

    /**
     * @return Every attached node that carries a formula
     */
    public List<FormulaBearing> formulas() {
        return subtree(root).flatMap(n -> n.formula().stream()).toList();
    }

    // ==================== Validation ====================

    /**
     * Checks that a name is legal for a node placed under the given parent.
     *
     * @param node   The node being named; may be detached
     * @param parent The parent the node has or will have
     * @param name   The proposed name
     * @throws InvalidValueException if the name is blank or contains control characters
     * @throws NameConflictException if another node in the name scope has the name
     */
    public void checkName(ModelNode node, ModelNode parent, String name) {
        checkName(node.kind(), node, parent, name);
    }

    /**
     * Checks the name of a node that has not been created yet.
     *
     * @see #checkName(ModelNode, ModelNode, String)
     */
    public void checkName(NodeKind kind, ModelNode parent, String name) {
        checkName(kind, null, parent, name);
    }

    private void checkName(NodeKind kind, ModelNode self, ModelNode parent, String name) {
        NodeId selfId = self == null ? null : self.id();
        checkNameSyntax(name, selfId);
        Stream<ModelNode> rivals = switch (kind.nameScope()) {
            case NONE -> Stream.empty();
            case MODEL -> kind == NodeKind.MEASURE
                    ? measures()
                    : root.children().stream();
            case PARENT -> parent.children().stream();
        };
        Optional<ModelNode> clash = Stream.concat(
                        rivals.filter(r -> r.kind().sameNameClass(kind)),
                        bracketRivals(kind))
                .filter(r -> r != self)
                .filter(r -> r.name().equalsIgnoreCase(name))
                .findFirst();
        if (clash.isPresent()) {
            throw new NameConflictException(kind, name, selfId, clash.get().id());
        }
    }

    /**
     * An unqualified {@code [Name]} tries the columns of the formula's table before measures,
     * so no measure may share its name with any column in the model.
     */
    private Stream<ModelNode> bracketRivals(NodeKind kind) {
        if (kind == NodeKind.MEASURE) {
            return tables().stream().flatMap(t -> t.children().stream()).filter(c -> c.kind().isColumn());
        }
        if (kind.isColumn()) {
            return measures();
        }
        return Stream.empty();
    }

    /**
     * Checks that a node of the given kind may live under the given parent.
     *
     * @throws InvalidMoveException if the parent is detached or of the wrong kind
     */
    public void checkPlacement(NodeKind kind, ModelNode parent, NodeId nodeId) {
        if (parent.graph() != this || !parent.isAttached()) {
            throw new InvalidMoveException("Parent " + parent.id() + " is not part of this model", nodeId);
        }
        if (!kind.canBeChildOf(parent.kind())) {
            throw new InvalidMoveException(
                    kind.nameClass() + " cannot be placed under " + parent.kind().nameClass(), nodeId);
        }
    }

    private static void checkNameSyntax(String name, NodeId nodeId) {
        if (name == null || name.isBlank()) {
            throw new InvalidValueException("Name cannot be blank", nodeId, NodeProperty.NAME);
        }
        if (name.chars().anyMatch(Character::isISOControl)) {
            throw new InvalidValueException("Name cannot contain control characters", nodeId, NodeProperty.NAME);
        }
    }

    // ==================== Raw mutation ====================

    public Object readProperty(ModelNode node, NodeProperty property) {
        return store.read(node, property);
    }

    /**
     * Writes a property through the store and notifies listeners. Not recorded.
     *
     * @throws InvalidValueException if the store rejects the value; nothing is notified
     */
    public void writeProperty(ModelNode node, NodeProperty property, Object value) {
        Object oldValue = store.read(node, property);
        store.write(node, property, value);
        fire(ModelChangeEvent.propertyChanged(node, property, oldValue, value));
    }

    /**
     * Inserts a detached node under a parent and notifies listeners. Not recorded.
     */
    public void attach(ModelNode node, ModelNode parent, int index) {
        if (node.parent().isPresent() || node == root) {
            throw new IllegalStateException(node + " is already attached");
        }
        if (index < 0 || index > parent.children().size()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range for " + parent);
        }
        parent.insertChild(index, node);
        fire(ModelChangeEvent.nodeAdded(node, parent));
    }

    /**
     * Removes a node, with its subtree, from its parent and notifies listeners. Not recorded.
     *
     * @return The index the node had in its parent
     */
    public int detach(ModelNode node) {
        ModelNode parent = node.parent()
                .orElseThrow(() -> new IllegalStateException(node + " is not attached"));
        int index = parent.removeChild(node);
        fire(ModelChangeEvent.nodeRemoved(node, parent));
        return index;
    }

    /**
     * Moves an attached node to a new parent and position and notifies listeners. Not
     * recorded. The index is taken after the node has left its old position.
     */
    public void relocate(ModelNode node, ModelNode newParent, int index) {
        ModelNode oldParent = node.parent()
                .orElseThrow(() -> new IllegalStateException(node + " is not attached"));
        int limit = newParent.children().size() - (newParent == oldParent ? 1 : 0);
        if (index < 0 || index > limit) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range for " + newParent);
        }
        oldParent.removeChild(node);
        newParent.insertChild(index, node);
        fire(ModelChangeEvent.nodeMoved(node, oldParent, newParent));
    }

    // ==================== Listeners ====================

    public void addListener(ModelChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void removeListener(ModelChangeListener listener) {
        listeners.remove(listener);
    }

    private void fire(ModelChangeEvent event) {
        for (ModelChangeListener listener : List.copyOf(listeners)) {
            listener.modelChanged(event);
        }
    }
}
