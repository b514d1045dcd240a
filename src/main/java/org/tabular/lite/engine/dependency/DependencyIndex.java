package org.tabular.lite.engine.dependency;

import org.eclipse.collections.api.multimap.set.MutableSetMultimap;
import org.eclipse.collections.impl.factory.Multimaps;
import org.jboss.logging.Logger;
import org.tabular.lite.dax.ExpressionTokenizer;
import org.tabular.lite.dax.Token;
import org.tabular.lite.dax.TokenizeException;
import org.tabular.lite.model.FormulaBearing;
import org.tabular.lite.model.ModelChangeEvent;
import org.tabular.lite.model.ModelChangeListener;
import org.tabular.lite.model.ModelGraph;
import org.tabular.lite.model.ModelNode;
import org.tabular.lite.model.NodeId;
import org.tabular.lite.model.NodeProperty;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tracks which formulas reference which model objects.
 *
 * For every formula-bearing node the index keeps the last tokenization of its formula and
 * the reference spans resolved from it. From those it maintains the reverse edges, target
 * to dependents, used to find the formulas a rename has to fix.
 *
 * The index listens to the model graph and stays current on its own, also while undo and
 * redo replay history:
 * - An EXPRESSION write re-tokenizes that formula and replaces all its edges
 * - Adding, removing, renaming or moving a node re-resolves the formulas that spell its
 *   old or new name, because resolution depends on the names in the model right now
 *
 * A formula that cannot be tokenized keeps no edges and carries an error marker until its
 * text is changed to something that tokenizes. Reference cycles are ordinary data here.
 *
 * Flags left by the fixup engine are kept apart from tokenizer errors. They are written
 * only through recorded edits and survive re-indexing, so undo and redo can restore them.
 */
public final class DependencyIndex implements ModelChangeListener {

    private static final Logger LOG = Logger.getLogger(DependencyIndex.class);

    private static final Comparator<ModelNode> BY_ID = Comparator.comparing(ModelNode::id);

    private final ModelGraph graph;
    private final ExpressionTokenizer tokenizer;
    private final ReferenceResolver resolver;

    private final Map<NodeId, IndexedExpression> expressions = new HashMap<>();
    private final MutableSetMultimap<NodeId, NodeId> dependentsByTarget = Multimaps.mutable.set.empty();
    private final MutableSetMultimap<String, NodeId> formulasByName = Multimaps.mutable.set.empty();
    private final Map<NodeId, String> errors = new HashMap<>();
    private final Map<NodeId, FormulaFlag> flags = new HashMap<>();

    public DependencyIndex(ModelGraph graph, ExpressionTokenizer tokenizer) {
        this.graph = graph;
        this.tokenizer = tokenizer;
        this.resolver = new ReferenceResolver(graph);
    }

    /**
     * Drops everything derived from formula text and indexes every formula in the model.
     * Flags are kept.
     */
    public void rebuild() {
        expressions.clear();
        dependentsByTarget.clear();
        formulasByName.clear();
        errors.clear();
        for (FormulaBearing formula : graph.formulas()) {
            onExpressionChanged(formula, "", formula.expression());
        }
        LOG.debugf("Indexed %d formulas", expressions.size());
    }

    // ==================== Indexing ====================

    /**
     * Re-tokenizes a formula and replaces all of its outgoing edges.
     *
     * @param formula The formula-bearing node
     * @param oldText The previous formula text
     * @param newText The current formula text
     */
    public void onExpressionChanged(FormulaBearing formula, String oldText, String newText) {
        NodeId id = formula.id();
        forget(id);
        IndexedExpression indexed;
        try {
            List<Token> tokens = tokenizer.tokenize(newText);
            indexed = resolve(formula, newText, tokens);
            errors.remove(id);
        } catch (TokenizeException e) {
            LOG.debugf("Cannot tokenize formula of %s: %s", formula.node(), e.getMessage());
            indexed = IndexedExpression.failed(newText, e.getMessage());
            errors.put(id, e.getMessage());
        }
        remember(id, indexed);
        LOG.tracef("Re-indexed %s: '%s' -> '%s'", formula.node(), oldText, newText);
    }

    private IndexedExpression resolve(FormulaBearing formula, String text, List<Token> tokens) {
        ReferenceResolver.Resolution resolution = resolver.resolve(formula, tokens);
        return new IndexedExpression(text, tokens, resolution.spans(), resolution.mentions(), null);
    }

    private void remember(NodeId id, IndexedExpression indexed) {
        expressions.put(id, indexed);
        for (NodeId target : indexed.targets()) {
            dependentsByTarget.put(target, id);
        }
        for (String name : indexed.mentions()) {
            formulasByName.put(name, id);
        }
    }

    private void forget(NodeId id) {
        IndexedExpression previous = expressions.remove(id);
        if (previous == null) {
            return;
        }
        for (NodeId target : previous.targets()) {
            dependentsByTarget.remove(target, id);
        }
        for (String name : previous.mentions()) {
            formulasByName.remove(name, id);
        }
    }

    /**
     * Resolves the cached tokens of the given formulas again against current names.
     */
    private void reresolve(Collection<NodeId> formulaIds) {
        for (NodeId id : List.copyOf(formulaIds)) {
            IndexedExpression indexed = expressions.get(id);
            if (indexed == null || !indexed.isTokenized()) {
                continue;
            }
            Optional<FormulaBearing> formula = graph.find(id)
                    .filter(ModelNode::isAttached)
                    .flatMap(ModelNode::formula);
            if (formula.isEmpty()) {
                continue;
            }
            forget(id);
            remember(id, resolve(formula.get(), indexed.text(), indexed.tokens()));
        }
    }

    private Set<NodeId> formulasMentioning(Collection<String> names) {
        Set<NodeId> ids = new HashSet<>();
        for (String name : names) {
            ids.addAll(formulasByName.get(ReferenceResolver.lower(name)));
        }
        return ids;
    }

    // ==================== Change notification ====================

    @Override
    public void modelChanged(ModelChangeEvent event) {
        ModelNode node = event.node();
        switch (event.type()) {
            case PROPERTY_CHANGED -> {
                if (!node.isAttached()) {
                    return;
                }
                if (event.property() == NodeProperty.EXPRESSION) {
                    node.formula().ifPresent(f -> onExpressionChanged(f, (String) event.oldValue(), (String) event.newValue()));
                } else if (event.property() == NodeProperty.NAME && node.kind().isReferenceTarget()) {
                    reresolve(formulasMentioning(List.of((String) event.oldValue(), (String) event.newValue())));
                }
            }
            case NODE_ADDED -> {
                List<ModelNode> added = graph.subtree(node).toList();
                for (ModelNode n : added) {
                    n.formula().ifPresent(f -> onExpressionChanged(f, "", f.expression()));
                }
                reresolve(formulasMentioning(targetNames(added)));
            }
            case NODE_REMOVED -> {
                List<ModelNode> removed = graph.subtree(node).toList();
                for (ModelNode n : removed) {
                    forget(n.id());
                    errors.remove(n.id());
                }
                reresolve(formulasMentioning(targetNames(removed)));
            }
            case NODE_MOVED -> {
                List<ModelNode> moved = graph.subtree(node).toList();
                for (ModelNode n : moved) {
                    n.formula().ifPresent(f -> onExpressionChanged(f, f.expression(), f.expression()));
                }
                reresolve(formulasMentioning(targetNames(moved)));
            }
        }
    }

    private static List<String> targetNames(List<ModelNode> nodes) {
        return nodes.stream()
                .filter(n -> n.kind().isReferenceTarget())
                .map(ModelNode::name)
                .toList();
    }

    // ==================== Queries ====================

    /**
     * @param target A reference target
     * @return The formula-bearing nodes that reference it, in ascending id order
     */
    public Set<ModelNode> getDependents(ModelNode target) {
        return toNodes(dependentsByTarget.get(target.id()));
    }

    /**
     * @param target    A reference target
     * @param transitive true to also include dependents of dependents, and so on
     * @return The dependents in ascending id order; a cycle back to the target includes it
     */
    public Set<ModelNode> getDependents(ModelNode target, boolean transitive) {
        if (!transitive) {
            return getDependents(target);
        }
        Set<NodeId> seen = new HashSet<>();
        Deque<NodeId> queue = new ArrayDeque<>();
        queue.add(target.id());
        while (!queue.isEmpty()) {
            for (NodeId dependent : dependentsByTarget.get(queue.poll())) {
                if (seen.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return toNodes(seen);
    }

    /**
     * @param node A formula-bearing node
     * @return The nodes its formula references, in ascending id order
     */
    public Set<ModelNode> getReferences(ModelNode node) {
        IndexedExpression indexed = expressions.get(node.id());
        return indexed == null ? Set.of() : toNodes(indexed.targets());
    }

    /**
     * @param dependent A formula-bearing node
     * @param target    A node its formula references
     * @return The spans in the dependent's last tokenization that must change when the
     *         target is renamed or moved, in source order
     */
    public List<ReferenceSpan> referenceSpans(ModelNode dependent, NodeId target) {
        IndexedExpression indexed = expressions.get(dependent.id());
        if (indexed == null) {
            return List.of();
        }
        return indexed.references().stream().filter(r -> r.concerns(target)).toList();
    }

    public Optional<IndexedExpression> indexed(ModelNode node) {
        return Optional.ofNullable(expressions.get(node.id()));
    }

    /**
     * @return Formulas whose last tokenization failed and whose text spells the name as a
     *         whole word, bare, bracketed or quoted, in ascending id order
     */
    public Set<ModelNode> untokenizedMentioning(String name) {
        Pattern spelling = spellingOf(name);
        Set<NodeId> ids = expressions.entrySet().stream()
                .filter(e -> !e.getValue().isTokenized())
                .filter(e -> spelling.matcher(e.getValue().text()).find())
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
        return toNodes(ids);
    }

    /**
     * Matches the name, or its escaped form inside brackets or quotes, when it is not part
     * of a longer identifier.
     */
    private static Pattern spellingOf(String name) {
        String alternatives = Stream.of(name, name.replace("]", "]]"), name.replace("'", "''"))
                .distinct()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\p{L}\\p{N}_])(?:" + alternatives + ")(?![\\p{L}\\p{N}_])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    // ==================== Diagnostics ====================

    /**
     * @return The error marker of a formula, if any: its flag while the flag applies to the
     *         current text, otherwise the tokenizer's message
     */
    public Optional<String> errorOf(ModelNode node) {
        String error = errors.get(node.id());
        if (error == null) {
            return Optional.empty();
        }
        FormulaFlag flag = flags.get(node.id());
        IndexedExpression indexed = expressions.get(node.id());
        if (flag != null && indexed != null && flag.text().equals(indexed.text())) {
            return Optional.of(flag.message());
        }
        return Optional.of(error);
    }

    /**
     * @return The flag last set on a formula, whether or not it still applies
     */
    public Optional<FormulaFlag> flagOf(ModelNode node) {
        return Optional.ofNullable(flags.get(node.id()));
    }

    /**
     * Sets or, with null, clears the flag of a formula. Callers record the change so it
     * can be undone.
     */
    public void setFlag(ModelNode node, FormulaFlag flag) {
        if (flag == null) {
            flags.remove(node.id());
        } else {
            flags.put(node.id(), flag);
        }
    }

    /**
     * @return Every formula currently carrying an error marker, in ascending id order
     */
    public Set<ModelNode> formulasWithErrors() {
        return toNodes(errors.keySet());
    }

    private Set<ModelNode> toNodes(Iterable<NodeId> ids) {
        List<ModelNode> nodes = new ArrayList<>();
        for (NodeId id : ids) {
            graph.find(id).ifPresent(nodes::add);
        }
        nodes.sort(BY_ID);
        return new LinkedHashSet<>(nodes);
    }
}
