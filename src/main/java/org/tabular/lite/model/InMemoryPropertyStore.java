package org.tabular.lite.model;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Property store that keeps values in memory, keyed by node id.
 *
 * Validation is limited to what the store can decide on its own: the node kind must
 * support the property, the value must have the declared type, and only node-reference
 * properties accept null. Cross-node rules (name uniqueness, relationship endpoints) are
 * checked by {@link ModelGraph}.
 *
 * Values of detached nodes are kept, so a removed node can be re-attached by undo with
 * its properties intact.
 */
public final class InMemoryPropertyStore implements PropertyStore {

    private final Map<NodeId, Map<NodeProperty, Object>> values = new HashMap<>();

    @Override
    public Object read(ModelNode node, NodeProperty property) {
        Map<NodeProperty, Object> nodeValues = values.get(node.id());
        if (nodeValues != null && nodeValues.containsKey(property)) {
            return nodeValues.get(property);
        }
        return property.defaultValue();
    }

    @Override
    public void write(ModelNode node, NodeProperty property, Object value) {
        if (!node.kind().supports(property)) {
            throw new InvalidValueException(
                    node.kind().nameClass() + " does not have property " + property, node.id(), property);
        }
        if (value == null) {
            if (property.valueType() != NodeId.class) {
                throw new InvalidValueException(property + " cannot be null", node.id(), property);
            }
        } else if (!property.valueType().isInstance(value)) {
            throw new InvalidValueException(
                    property + " expects " + property.valueType().getSimpleName()
                            + " but got " + value.getClass().getSimpleName(),
                    node.id(), property);
        }
        values.computeIfAbsent(node.id(), id -> new EnumMap<>(NodeProperty.class)).put(property, value);
    }
}
