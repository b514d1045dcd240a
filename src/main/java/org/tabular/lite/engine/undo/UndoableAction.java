package org.tabular.lite.engine.undo;

import org.tabular.lite.model.ModelGraph;

/**
 * Immutable record of one primitive model mutation.
 *
 * An action is created after its mutation has been applied and holds enough data to apply
 * it again (redo) or to invert it (undo). Actions refer to nodes by id only. Both
 * directions check that the model is in the state they expect and throw
 * {@link UndoStateException} otherwise.
 */
public sealed interface UndoableAction permits PropertyChange, NodeAdded, NodeRemoved, NodeMoved, FormulaFlagChange {

    /**
     * Re-applies the mutation.
     */
    void apply(ModelGraph graph);

    /**
     * Applies the inverse of the mutation.
     */
    void revert(ModelGraph graph);

    /**
     * @return A short human readable description, for logs
     */
    String describe();
}
