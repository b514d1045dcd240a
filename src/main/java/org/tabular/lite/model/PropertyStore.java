package org.tabular.lite.model;

/**
 * Authoritative storage of node property values.
 *
 * The model graph layers identity, structure and change notification around this store;
 * the store itself only validates and keeps primitive values. Implementations must reject
 * an illegal value by throwing {@link InvalidValueException} before storing anything, so
 * no notification fires for a rejected write.
 */
public interface PropertyStore {

    /**
     * @param node     The node to read from
     * @param property The property to read
     * @return The stored value, or the property's default if it was never written
     */
    Object read(ModelNode node, NodeProperty property);

    /**
     * Validates and stores a value.
     *
     * @param node     The node to write to
     * @param property The property to write
     * @param value    The new value
     * @throws InvalidValueException if the value is not legal for this node and property
     */
    void write(ModelNode node, NodeProperty property, Object value);
}
