package org.tabular.lite.model;

/**
 * Thrown when a property value is illegal for the node it is written to.
 */
public class InvalidValueException extends ModelEditException {

    private final NodeProperty property;

    public InvalidValueException(String message, NodeId nodeId, NodeProperty property) {
        super(message, nodeId);
        this.property = property;
    }

    /**
     * @return The property being written, or null for structural edits
     */
    public NodeProperty getProperty() {
        return property;
    }
}
