package org.tabular.lite.model;

/**
 * Thrown when a new or changed name collides with an existing node in the same name scope.
 */
public class NameConflictException extends ModelEditException {

    private final String name;
    private final NodeId existingId;

    public NameConflictException(NodeKind kind, String name, NodeId nodeId, NodeId existingId) {
        super(kind.nameClass() + " name '" + name + "' is already used by " + existingId, nodeId);
        this.name = name;
        this.existingId = existingId;
    }

    public String getName() {
        return name;
    }

    public NodeId getExistingId() {
        return existingId;
    }
}
