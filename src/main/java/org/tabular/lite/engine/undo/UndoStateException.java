package org.tabular.lite.engine.undo;

/**
 * Thrown when an action is replayed against a model that is not in the state the action
 * recorded. This is an internal invariant violation, not a user error: history and model
 * have diverged and the session cannot continue safely.
 */
public class UndoStateException extends IllegalStateException {

    public UndoStateException(String message) {
        super(message);
    }
}
