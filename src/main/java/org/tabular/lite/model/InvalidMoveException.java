package org.tabular.lite.model;

/**
 * Thrown when a node cannot be placed under the requested parent or position.
 */
public class InvalidMoveException extends ModelEditException {

    public InvalidMoveException(String message, NodeId nodeId) {
        super(message, nodeId);
    }
}
