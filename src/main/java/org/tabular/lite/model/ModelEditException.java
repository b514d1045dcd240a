package org.tabular.lite.model;

/**
 * Base class of the validation failures raised by model edits.
 * 
 * A ModelEditException is always thrown before anything is mutated: no property is
 * written, no change notification fires and no undo entry is recorded.
 */
public class ModelEditException extends RuntimeException {

    private final NodeId nodeId;

    public ModelEditException(String message) {
        this(message, null);
    }

    public ModelEditException(String message, NodeId nodeId) {
        super(message);
        this.nodeId = nodeId;
    }

    /**
     * @return The node the rejected edit was aimed at, or null if not tied to one node
     */
    public NodeId getNodeId() {
        return nodeId;
    }
}
