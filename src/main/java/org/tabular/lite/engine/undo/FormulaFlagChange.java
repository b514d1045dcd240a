package org.tabular.lite.engine.undo;

import org.tabular.lite.engine.dependency.DependencyIndex;
import org.tabular.lite.engine.dependency.FormulaFlag;
import org.tabular.lite.model.ModelGraph;
import org.tabular.lite.model.ModelNode;
import org.tabular.lite.model.NodeId;

import java.util.Objects;

/**
 * The fixup flag of a formula changed. Flags live in the dependency index, not in the
 * model, so the action carries the index it writes to.
 *
 * @param index   The index holding the flag
 * @param nodeId  The flagged formula
 * @param oldFlag The flag before the change, or null
 * @param newFlag The flag after the change, or null
 */
public record FormulaFlagChange(DependencyIndex index, NodeId nodeId, FormulaFlag oldFlag, FormulaFlag newFlag)
        implements UndoableAction {

    public FormulaFlagChange {
        Objects.requireNonNull(index, "Index cannot be null");
        Objects.requireNonNull(nodeId, "Node id cannot be null");
    }

    @Override
    public void apply(ModelGraph graph) {
        write(graph, oldFlag, newFlag);
    }

    @Override
    public void revert(ModelGraph graph) {
        write(graph, newFlag, oldFlag);
    }

    private void write(ModelGraph graph, FormulaFlag expected, FormulaFlag flag) {
        ModelNode node = graph.node(nodeId);
        FormulaFlag current = index.flagOf(node).orElse(null);
        if (!Objects.equals(current, expected)) {
            throw new UndoStateException("Expected flag of " + nodeId + " to be " + expected + " but found " + current);
        }
        index.setFlag(node, flag);
    }

    @Override
    public String describe() {
        return "flag formula of " + nodeId;
    }
}
