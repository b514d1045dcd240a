package org.tabular.lite.model;

/**
 * Properties that can be stored on a model node.
 *
 * Each property declares the Java type of its values and the value a node reports
 * before the property has ever been written. Which node kinds carry which properties is
 * decided by {@link NodeKind#supports(NodeProperty)}.
 *
 * NAME and EXPRESSION are special: a NAME write goes through the rename path (uniqueness
 * check and formula fixup) and an EXPRESSION write re-indexes the node's references.
 */
public enum NodeProperty {

    // Common
    NAME(String.class, null),
    DESCRIPTION(String.class, ""),

    // Formula
    EXPRESSION(String.class, ""),

    // Presentation
    FORMAT_STRING(String.class, ""),
    DISPLAY_FOLDER(String.class, ""),
    IS_HIDDEN(Boolean.class, Boolean.FALSE),

    // Columns
    DATA_TYPE(DataType.class, DataType.STRING),
    SOURCE_COLUMN(String.class, ""),

    // Relationships
    FROM_COLUMN(NodeId.class, null),
    TO_COLUMN(NodeId.class, null),
    IS_ACTIVE(Boolean.class, Boolean.TRUE),
    CROSS_FILTERING(CrossFilteringBehavior.class, CrossFilteringBehavior.ONE_DIRECTION),

    // Roles
    MODEL_PERMISSION(ModelPermission.class, ModelPermission.READ),

    // Annotations
    VALUE(String.class, "");

    private final Class<?> valueType;
    private final Object defaultValue;

    NodeProperty(Class<?> valueType, Object defaultValue) {
        this.valueType = valueType;
        this.defaultValue = defaultValue;
    }

    /**
     * @return The type every stored value must be an instance of
     */
    public Class<?> valueType() {
        return valueType;
    }

    /**
     * @return The value reported for a node that never had this property written
     */
    public Object defaultValue() {
        return defaultValue;
    }
}
