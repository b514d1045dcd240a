package org.tabular.lite.model;

/**
 * Notification of one primitive change to the model graph.
 *
 * @param type      What happened
 * @param node      The node that changed, was added, removed or moved
 * @param property  The property written (PROPERTY_CHANGED only)
 * @param oldValue  The value before the write (PROPERTY_CHANGED only)
 * @param newValue  The value after the write (PROPERTY_CHANGED only)
 * @param oldParent The parent before the change (NODE_REMOVED, NODE_MOVED)
 * @param newParent The parent after the change (NODE_ADDED, NODE_MOVED)
 */
public record ModelChangeEvent(
        Type type,
        ModelNode node,
        NodeProperty property,
        Object oldValue,
        Object newValue,
        ModelNode oldParent,
        ModelNode newParent
) {

    public enum Type {
        PROPERTY_CHANGED,
        NODE_ADDED,
        NODE_REMOVED,
        NODE_MOVED
    }

    public static ModelChangeEvent propertyChanged(ModelNode node, NodeProperty property, Object oldValue, Object newValue) {
        return new ModelChangeEvent(Type.PROPERTY_CHANGED, node, property, oldValue, newValue, null, null);
    }

    public static ModelChangeEvent nodeAdded(ModelNode node, ModelNode parent) {
        return new ModelChangeEvent(Type.NODE_ADDED, node, null, null, null, null, parent);
    }

    public static ModelChangeEvent nodeRemoved(ModelNode node, ModelNode parent) {
        return new ModelChangeEvent(Type.NODE_REMOVED, node, null, null, null, parent, null);
    }

    public static ModelChangeEvent nodeMoved(ModelNode node, ModelNode oldParent, ModelNode newParent) {
        return new ModelChangeEvent(Type.NODE_MOVED, node, null, null, null, oldParent, newParent);
    }

    public boolean isPropertyChange(NodeProperty expected) {
        return type == Type.PROPERTY_CHANGED && property == expected;
    }
}
