package org.tabular.lite.engine.session;

import org.jboss.logging.Logger;
import org.tabular.lite.dax.DaxTokenizer;
import org.tabular.lite.dax.ExpressionTokenizer;
import org.tabular.lite.engine.dependency.DependencyIndex;
import org.tabular.lite.engine.dependency.FormulaFlag;
import org.tabular.lite.engine.fixup.FixupPlan;
import org.tabular.lite.engine.fixup.FixupResult;
import org.tabular.lite.engine.fixup.FormulaFixupEngine;
import org.tabular.lite.engine.undo.FormulaFlagChange;
import org.tabular.lite.engine.undo.NodeAdded;
import org.tabular.lite.engine.undo.NodeMoved;
import org.tabular.lite.engine.undo.NodeRemoved;
import org.tabular.lite.engine.undo.PropertyChange;
import org.tabular.lite.engine.undo.UndoManager;
import org.tabular.lite.model.DataType;
import org.tabular.lite.model.InvalidMoveException;
import org.tabular.lite.model.InvalidValueException;
import org.tabular.lite.model.ModelChangeListener;
import org.tabular.lite.model.ModelGraph;
import org.tabular.lite.model.ModelNode;
import org.tabular.lite.model.ModelPermission;
import org.tabular.lite.model.NodeId;
import org.tabular.lite.model.NodeKind;
import org.tabular.lite.model.NodeProperty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One editing session over one semantic model.
 *
 * The session owns the model graph, its dependency index, its undo manager and the
 * formula fixup engine, and is the only way to edit the model: the property grid, the
 * script host and a deserializer replaying a load all use the same methods.
 *
 * Every edit follows the same path:
 * 1. Validate; a failure throws a {@link org.tabular.lite.model.ModelEditException}
 *    before anything changes
 * 2. Apply the primitive change to the graph, which notifies listeners (the dependency
 *    index among them)
 * 3. Record the action with the undo manager
 * 4. For a rename or move of a reference target, rewrite the dependent formulas through
 *    this same path, inside the batch of the rename or move
 *
 * Edits outside an explicit batch each become one undoable transaction; a rename with its
 * formula fixups is always a single transaction. There is no automatic rollback: if an
 * edit inside a batch throws, the changes already applied stay and are committed when the
 * batch closes, and the caller can undo them.
 *
 * Single-threaded; all work completes within the calling method.
 */
public final class ModelingSession {

    private static final Logger LOG = Logger.getLogger(ModelingSession.class);

    private final SessionOptions options;
    private final ModelGraph graph;
    private final DependencyIndex dependencyIndex;
    private final UndoManager undoManager;
    private final FormulaFixupEngine fixupEngine;

    public ModelingSession(String modelName) {
        this(modelName, SessionOptions.DEFAULTS);
    }

    public ModelingSession(String modelName, SessionOptions options) {
        this(new ModelGraph(modelName), new DaxTokenizer(), options);
    }

    public ModelingSession(ModelGraph graph, ExpressionTokenizer tokenizer, SessionOptions options) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.graph = Objects.requireNonNull(graph, "Graph cannot be null");
        this.dependencyIndex = new DependencyIndex(graph, Objects.requireNonNull(tokenizer, "Tokenizer cannot be null"));
        this.undoManager = new UndoManager(graph, options.maxUndoHistory());
        this.fixupEngine = new FormulaFixupEngine(dependencyIndex);
        graph.addListener(dependencyIndex);
        dependencyIndex.rebuild();
    }

    public SessionOptions options() {
        return options;
    }

    public ModelGraph graph() {
        return graph;
    }

    public ModelNode model() {
        return graph.root();
    }

    public DependencyIndex dependencyIndex() {
        return dependencyIndex;
    }

    public UndoManager undoManager() {
        return undoManager;
    }

    public void addListener(ModelChangeListener listener) {
        graph.addListener(listener);
    }

    public void removeListener(ModelChangeListener listener) {
        graph.removeListener(listener);
    }

    // ==================== History ====================

    public void beginBatch(String label) {
        undoManager.beginBatch(label);
    }

    public void endBatch() {
        undoManager.endBatch();
    }

    /**
     * Opens a batch closed by try-with-resources; everything inside becomes one
     * transaction.
     */
    public UndoManager.Batch batch(String label) {
        return undoManager.batch(label);
    }

    public boolean undo() {
        return undoManager.undo();
    }

    public boolean redo() {
        return undoManager.redo();
    }

    public boolean canUndo() {
        return undoManager.canUndo();
    }

    public boolean canRedo() {
        return undoManager.canRedo();
    }

    /**
     * Forgets all undo and redo history, e.g. after a model has been loaded.
     */
    public void clearHistory() {
        undoManager.clear();
    }

    // ==================== Dependencies ====================

    public Set<ModelNode> getDependents(ModelNode node) {
        return dependencyIndex.getDependents(node);
    }

    public Set<ModelNode> getDependents(ModelNode node, boolean transitive) {
        return dependencyIndex.getDependents(node, transitive);
    }

    public Set<ModelNode> getReferences(ModelNode node) {
        return dependencyIndex.getReferences(node);
    }

    /**
     * @return The error marker of a formula: tokenizer failure or a skipped fixup
     */
    public Optional<String> errorOf(ModelNode node) {
        return dependencyIndex.errorOf(node);
    }

    // ==================== Adding and removing ====================

    /**
     * Adds a node at the end of a parent's children.
     */
    public ModelNode addNode(ModelNode parent, NodeKind kind, String name) {
        ensureLive(parent);
        return addNode(parent, kind, name, parent.children().size());
    }

    /**
     * Adds a node at a position among a parent's children.
     *
     * @throws InvalidMoveException  if the kind cannot live under the parent or the
     *                               index is out of range
     * @throws org.tabular.lite.model.NameConflictException if the name is taken
     */
    public ModelNode addNode(ModelNode parent, NodeKind kind, String name, int index) {
        ensureLive(parent);
        graph.checkPlacement(kind, parent, null);
        if (index < 0 || index > parent.children().size()) {
            throw new InvalidMoveException("Index " + index + " out of range for " + parent, null);
        }
        graph.checkName(kind, parent, name);

        ModelNode node = graph.createNode(kind, name);
        graph.attach(node, parent, index);
        undoManager.add(new NodeAdded(node.id(), parent.id(), index));
        return node;
    }

    public ModelNode addTable(String name) {
        return addNode(model(), NodeKind.TABLE, name);
    }

    public ModelNode addCalculatedTable(String name, String expression) {
        try (UndoManager.Batch batch = batch("Add calculated table '" + name + "'")) {
            ModelNode table = addTable(name);
            setExpression(table, expression);
            return table;
        }
    }

    public ModelNode addDataColumn(ModelNode table, String name, DataType dataType) {
        try (UndoManager.Batch batch = batch("Add column '" + name + "'")) {
            ModelNode column = addNode(table, NodeKind.DATA_COLUMN, name);
            setProperty(column, NodeProperty.DATA_TYPE, dataType);
            setProperty(column, NodeProperty.SOURCE_COLUMN, name);
            return column;
        }
    }

    public ModelNode addCalculatedColumn(ModelNode table, String name, String expression) {
        try (UndoManager.Batch batch = batch("Add calculated column '" + name + "'")) {
            ModelNode column = addNode(table, NodeKind.CALCULATED_COLUMN, name);
            setExpression(column, expression);
            return column;
        }
    }

    public ModelNode addMeasure(ModelNode table, String name, String expression) {
        try (UndoManager.Batch batch = batch("Add measure '" + name + "'")) {
            ModelNode measure = addNode(table, NodeKind.MEASURE, name);
            setExpression(measure, expression);
            return measure;
        }
    }

    public ModelNode addRelationship(String name, ModelNode fromColumn, ModelNode toColumn) {
        checkEndpoint(fromColumn.id(), NodeProperty.FROM_COLUMN, null);
        checkEndpoint(toColumn.id(), NodeProperty.TO_COLUMN, null);
        if (fromColumn.table().equals(toColumn.table())) {
            throw new InvalidValueException("A relationship must join two different tables", null, NodeProperty.TO_COLUMN);
        }
        try (UndoManager.Batch batch = batch("Add relationship '" + name + "'")) {
            ModelNode relationship = addNode(model(), NodeKind.RELATIONSHIP, name);
            setProperty(relationship, NodeProperty.FROM_COLUMN, fromColumn.id());
            setProperty(relationship, NodeProperty.TO_COLUMN, toColumn.id());
            return relationship;
        }
    }

    public ModelNode addHierarchy(ModelNode table, String name) {
        return addNode(table, NodeKind.HIERARCHY, name);
    }

    public ModelNode addPerspective(String name) {
        return addNode(model(), NodeKind.PERSPECTIVE, name);
    }

    public ModelNode addRole(String name, ModelPermission permission) {
        try (UndoManager.Batch batch = batch("Add role '" + name + "'")) {
            ModelNode role = addNode(model(), NodeKind.ROLE, name);
            setProperty(role, NodeProperty.MODEL_PERMISSION, permission);
            return role;
        }
    }

    public ModelNode addAnnotation(ModelNode owner, String name, String value) {
        try (UndoManager.Batch batch = batch("Add annotation '" + name + "'")) {
            ModelNode annotation = addNode(owner, NodeKind.ANNOTATION, name);
            setProperty(annotation, NodeProperty.VALUE, value);
            return annotation;
        }
    }

    /**
     * Removes a node with its subtree. Relationships that use a removed column are
     * removed with it, in the same transaction. Formulas referencing removed objects keep
     * their text; their references become unresolved until undo brings the objects back.
     *
     * @throws InvalidMoveException if the node is the model root
     */
    public void removeNode(ModelNode node) {
        ensureLive(node);
        if (node == graph.root()) {
            throw new InvalidMoveException("The model itself cannot be removed", node.id());
        }

        Set<NodeId> removedColumns = graph.subtree(node)
                .filter(n -> n.kind().isColumn())
                .map(ModelNode::id)
                .collect(Collectors.toSet());
        List<ModelNode> orphanedRelationships = model().children(NodeKind.RELATIONSHIP).stream()
                .filter(r -> r != node)
                .filter(r -> removedColumns.contains((NodeId) r.get(NodeProperty.FROM_COLUMN))
                        || removedColumns.contains((NodeId) r.get(NodeProperty.TO_COLUMN)))
                .toList();

        try (UndoManager.Batch batch = batch("Delete " + node.kind().nameClass() + " '" + node.name() + "'")) {
            for (ModelNode relationship : orphanedRelationships) {
                detach(relationship);
            }
            detach(node);
        }
    }

    private void detach(ModelNode node) {
        ModelNode parent = node.parent().orElseThrow();
        int index = graph.detach(node);
        undoManager.add(new NodeRemoved(node.id(), parent.id(), index));
    }

    // ==================== Rename and move ====================

    /**
     * Renames a node and, for tables, columns and measures, rewrites every formula that
     * references it. The rename and its rewrites form one transaction.
     *
     * @throws org.tabular.lite.model.NameConflictException if the name is taken
     * @throws InvalidValueException if the name is blank or has control characters
     */
    public void rename(ModelNode node, String newName) {
        ensureLive(node);
        String oldName = node.name();
        if (oldName.equals(newName)) {
            return;
        }
        graph.checkName(node, node.parent().orElse(null), newName);

        FixupPlan plan = fixupEnabled(node) ? fixupEngine.planRename(node, newName) : FixupPlan.none(node);
        try (UndoManager.Batch batch = batch("Rename " + node.kind().nameClass() + " '" + oldName + "'")) {
            applyProperty(node, NodeProperty.NAME, newName);
            report(fixupEngine.apply(plan, this::applyExpression, this::applyFlag));
        }
        LOG.debugf("Renamed %s '%s' to '%s'", node.kind().nameClass(), oldName, newName);
    }

    /**
     * Moves a node to the end of another parent's children.
     */
    public void move(ModelNode node, ModelNode newParent) {
        ensureLive(node);
        ensureLive(newParent);
        boolean sameParent = node.parent().filter(p -> p == newParent).isPresent();
        move(node, newParent, newParent.children().size() - (sameParent ? 1 : 0));
    }

    /**
     * Moves a node to a position under a parent. Any node can be reordered among its
     * siblings; only measures can change table. Moving a measure rewrites table
     * qualifiers in formulas that reference it, in the same transaction.
     *
     * @throws InvalidMoveException if the move is not allowed or the index is out of range
     * @throws org.tabular.lite.model.NameConflictException if the name is taken in the new scope
     */
    public void move(ModelNode node, ModelNode newParent, int index) {
        ensureLive(node);
        ensureLive(newParent);
        if (node == graph.root()) {
            throw new InvalidMoveException("The model itself cannot be moved", node.id());
        }
        if (newParent.isWithin(node)) {
            throw new InvalidMoveException(node + " cannot be moved under itself", node.id());
        }
        graph.checkPlacement(node.kind(), newParent, node.id());

        ModelNode oldParent = node.parent().orElseThrow();
        boolean crossParent = oldParent != newParent;
        if (crossParent && !node.kind().isMovable()) {
            throw new InvalidMoveException(node.kind().nameClass() + " cannot change parent", node.id());
        }
        int limit = newParent.children().size() - (crossParent ? 0 : 1);
        if (index < 0 || index > limit) {
            throw new InvalidMoveException("Index " + index + " out of range for " + newParent, node.id());
        }
        if (crossParent) {
            graph.checkName(node, newParent, node.name());
        }
        int fromIndex = node.index();
        if (!crossParent && fromIndex == index) {
            return;
        }

        FixupPlan plan = crossParent && fixupEnabled(node)
                ? fixupEngine.planMove(node, newParent)
                : FixupPlan.none(node);
        try (UndoManager.Batch batch = batch("Move " + node.kind().nameClass() + " '" + node.name() + "'")) {
            graph.relocate(node, newParent, index);
            undoManager.add(new NodeMoved(node.id(), oldParent.id(), fromIndex, newParent.id(), index));
            report(fixupEngine.apply(plan, this::applyExpression, this::applyFlag));
        }
    }

    private boolean fixupEnabled(ModelNode node) {
        return options.formulaFixup() && node.kind().isReferenceTarget() && !undoManager.isReplaying();
    }

    private void report(FixupResult result) {
        if (!result.flagged().isEmpty()) {
            LOG.warnf("%d formulas could not be fixed up and were flagged", result.flagged().size());
        }
    }

    // ==================== Properties ====================

    /**
     * Replaces the formula of a table, calculated column or measure.
     *
     * @throws InvalidValueException if the node has no formula or the text is null
     */
    public void setExpression(ModelNode node, String expression) {
        ensureLive(node);
        if (!node.kind().isFormulaBearing()) {
            throw new InvalidValueException(node.kind().nameClass() + " has no expression", node.id(), NodeProperty.EXPRESSION);
        }
        if (expression == null) {
            throw new InvalidValueException("Expression cannot be null", node.id(), NodeProperty.EXPRESSION);
        }
        applyProperty(node, NodeProperty.EXPRESSION, expression);
    }

    /**
     * Writes any property. NAME goes through {@link #rename} and EXPRESSION through
     * {@link #setExpression}; relationship endpoints must be columns of the model.
     *
     * @throws InvalidValueException if the value is illegal for the node
     */
    public void setProperty(ModelNode node, NodeProperty property, Object value) {
        ensureLive(node);
        switch (property) {
            case NAME -> {
                if (!(value instanceof String name)) {
                    throw new InvalidValueException("Name must be a string", node.id(), property);
                }
                rename(node, name);
            }
            case EXPRESSION -> {
                if (value != null && !(value instanceof String)) {
                    throw new InvalidValueException("Expression must be a string", node.id(), property);
                }
                setExpression(node, (String) value);
            }
            case FROM_COLUMN, TO_COLUMN -> {
                if (!(value instanceof NodeId columnId)) {
                    throw new InvalidValueException(property + " must be a column id", node.id(), property);
                }
                checkEndpoint(columnId, property, node.id());
                applyProperty(node, property, value);
            }
            default -> applyProperty(node, property, value);
        }
    }

    private void checkEndpoint(NodeId columnId, NodeProperty property, NodeId nodeId) {
        boolean valid = graph.find(columnId)
                .filter(c -> c.kind().isColumn() && c.isAttached())
                .isPresent();
        if (!valid) {
            throw new InvalidValueException(property + " must name a column of the model, got " + columnId, nodeId, property);
        }
    }

    private void applyExpression(ModelNode node, String expression) {
        applyProperty(node, NodeProperty.EXPRESSION, expression);
    }

    private void applyFlag(ModelNode node, FormulaFlag flag) {
        FormulaFlag oldFlag = dependencyIndex.flagOf(node).orElse(null);
        if (Objects.equals(oldFlag, flag)) {
            return;
        }
        dependencyIndex.setFlag(node, flag);
        undoManager.add(new FormulaFlagChange(dependencyIndex, node.id(), oldFlag, flag));
    }

    /**
     * Writes and records one property change. Writing the current value is not an edit.
     */
    private void applyProperty(ModelNode node, NodeProperty property, Object value) {
        Object oldValue = node.get(property);
        if (Objects.equals(oldValue, value)) {
            return;
        }
        graph.writeProperty(node, property, value);
        undoManager.add(new PropertyChange(node.id(), property, oldValue, value));
    }

    private void ensureLive(ModelNode node) {
        Objects.requireNonNull(node, "Node cannot be null");
        if (node.graph() != graph || !node.isAttached()) {
            throw new IllegalArgumentException(node + " is not part of this model");
        }
    }
}
