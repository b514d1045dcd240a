package org.tabular.lite.model;

/**
 * Receives every change applied to a {@link ModelGraph}, including changes replayed by
 * undo and redo.
 */
@FunctionalInterface
public interface ModelChangeListener {

    void modelChanged(ModelChangeEvent event);
}
