package org.tabular.lite.engine.undo;

import org.tabular.lite.model.ModelGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The unit of undo: an ordered list of actions committed together under one label.
 *
 * Owned by the {@link UndoManager}. Actions are appended while the transaction is pending
 * and never change after it is committed.
 */
public final class Transaction {

    private final String label;
    private final List<UndoableAction> actions = new ArrayList<>();

    Transaction(String label) {
        this.label = Objects.requireNonNull(label, "Label cannot be null");
    }

    public String label() {
        return label;
    }

    public List<UndoableAction> actions() {
        return Collections.unmodifiableList(actions);
    }

    public int size() {
        return actions.size();
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    void append(UndoableAction action) {
        actions.add(Objects.requireNonNull(action, "Action cannot be null"));
    }

    /**
     * Inverts every action, newest first.
     */
    void revert(ModelGraph graph) {
        for (int i = actions.size() - 1; i >= 0; i--) {
            actions.get(i).revert(graph);
        }
    }

    /**
     * Applies every action again, oldest first.
     */
    void apply(ModelGraph graph) {
        for (UndoableAction action : actions) {
            action.apply(graph);
        }
    }

    @Override
    public String toString() {
        return "Transaction '" + label + "' (" + actions.size() + " actions)";
    }
}
