package org.tabular.lite.engine.undo;

import org.jboss.logging.Logger;
import org.tabular.lite.model.ModelGraph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Records model mutations as transactions and replays them backwards (undo) and forwards
 * (redo).
 *
 * Batches nest: {@link #beginBatch(String)} and {@link #endBatch()} maintain a depth
 * counter, and everything added between the outermost pair becomes one transaction. An
 * action added outside any batch becomes a transaction of its own.
 *
 * Any recorded action discards the redo stack. Actions applied by undo and redo are never
 * recorded: during replay the manager is in the UNDOING or REDOING state and {@link #add}
 * rejects calls. Collaborators that react to model changes check {@link #isReplaying()}
 * before producing further edits.
 *
 * One manager belongs to one modeling session. Not thread-safe.
 */
public final class UndoManager {

    private static final Logger LOG = Logger.getLogger(UndoManager.class);

    public enum State {
        IDLE,
        RECORDING,
        UNDOING,
        REDOING
    }

    private final ModelGraph graph;
    private final int maxHistory;
    private final Deque<Transaction> undoStack = new ArrayDeque<>();
    private final Deque<Transaction> redoStack = new ArrayDeque<>();
    private Transaction pending;
    private int depth;
    private boolean replaying;
    private State replayState = State.IDLE;

    /**
     * @param graph      The graph actions are replayed against
     * @param maxHistory Maximum number of undoable transactions kept, 0 for no limit
     */
    public UndoManager(ModelGraph graph, int maxHistory) {
        if (maxHistory < 0) {
            throw new IllegalArgumentException("History limit cannot be negative: " + maxHistory);
        }
        this.graph = Objects.requireNonNull(graph, "Graph cannot be null");
        this.maxHistory = maxHistory;
    }

    public UndoManager(ModelGraph graph) {
        this(graph, 0);
    }

    // ==================== Recording ====================

    /**
     * Opens a batch. Only the outermost label names the resulting transaction.
     */
    public void beginBatch(String label) {
        ensureNotReplaying("begin a batch");
        if (depth == 0) {
            pending = new Transaction(label);
        }
        depth++;
    }

    /**
     * Opens a batch that is closed by {@link Batch#close()}, for use in try-with-resources.
     */
    public Batch batch(String label) {
        beginBatch(label);
        return new Batch();
    }

    /**
     * Records an action that has just been applied to the model.
     */
    public void add(UndoableAction action) {
        Objects.requireNonNull(action, "Action cannot be null");
        ensureNotReplaying("record " + action.describe());
        redoStack.clear();
        if (depth > 0) {
            pending.append(action);
            return;
        }
        Transaction single = new Transaction(action.describe());
        single.append(action);
        commit(single);
    }

    /**
     * Closes the innermost batch. Closing the outermost one commits the pending
     * transaction; an empty transaction is dropped.
     */
    public void endBatch() {
        if (depth == 0) {
            throw new IllegalStateException("endBatch() without matching beginBatch()");
        }
        depth--;
        if (depth == 0) {
            Transaction done = pending;
            pending = null;
            if (!done.isEmpty()) {
                redoStack.clear();
                commit(done);
            }
        }
    }

    private void commit(Transaction transaction) {
        undoStack.push(transaction);
        LOG.debugf("Committed %s", transaction);
        while (maxHistory > 0 && undoStack.size() > maxHistory) {
            Transaction evicted = undoStack.removeLast();
            LOG.debugf("Evicted %s from undo history", evicted);
        }
    }

    // ==================== Replay ====================

    /**
     * Reverts the most recent transaction.
     *
     * @return false if there was nothing to undo
     */
    public boolean undo() {
        ensureNoBatch("undo");
        ensureNotReplaying("undo");
        if (undoStack.isEmpty()) {
            return false;
        }
        Transaction transaction = undoStack.pop();
        replay(State.UNDOING, () -> transaction.revert(graph));
        redoStack.push(transaction);
        LOG.debugf("Undid %s", transaction);
        return true;
    }

    /**
     * Re-applies the most recently undone transaction.
     *
     * @return false if there was nothing to redo
     */
    public boolean redo() {
        ensureNoBatch("redo");
        ensureNotReplaying("redo");
        if (redoStack.isEmpty()) {
            return false;
        }
        Transaction transaction = redoStack.pop();
        replay(State.REDOING, () -> transaction.apply(graph));
        undoStack.push(transaction);
        LOG.debugf("Redid %s", transaction);
        return true;
    }

    private void replay(State state, Runnable work) {
        replaying = true;
        replayState = state;
        try {
            work.run();
        } finally {
            replaying = false;
            replayState = State.IDLE;
        }
    }

    /**
     * Empties both stacks. Meant for session reset, e.g. after loading a model.
     */
    public void clear() {
        ensureNoBatch("clear history");
        undoStack.clear();
        redoStack.clear();
    }

    // ==================== State ====================

    public State state() {
        if (replaying) {
            return replayState;
        }
        return depth > 0 ? State.RECORDING : State.IDLE;
    }

    public boolean isReplaying() {
        return replaying;
    }

    public boolean isBatchOpen() {
        return depth > 0;
    }

    public int batchDepth() {
        return depth;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int undoDepth() {
        return undoStack.size();
    }

    public int redoDepth() {
        return redoStack.size();
    }

    /**
     * @return Labels of the undoable transactions, most recent first
     */
    public List<String> undoLabels() {
        return undoStack.stream().map(Transaction::label).toList();
    }

    /**
     * @return Labels of the redoable transactions, next redo first
     */
    public List<String> redoLabels() {
        return redoStack.stream().map(Transaction::label).toList();
    }

    private void ensureNotReplaying(String what) {
        if (replaying) {
            throw new IllegalStateException("Cannot " + what + " while " + replayState);
        }
    }

    private void ensureNoBatch(String what) {
        if (depth > 0) {
            throw new IllegalStateException("Cannot " + what + " while batch '" + pending.label() + "' is open");
        }
    }

    /**
     * Handle for a batch opened with {@link UndoManager#batch(String)}. Closing it more
     * than once has no further effect.
     */
    public final class Batch implements AutoCloseable {

        private boolean closed;

        private Batch() {
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                endBatch();
            }
        }
    }
}
