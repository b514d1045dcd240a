package org.tabular.lite.model;

/**
 * The tag of a {@link ModelNode}.
 *
 * Node kinds replace a per-type class hierarchy: behaviour that differs between kinds is
 * looked up here (allowed parents, supported properties, naming rules) instead of being
 * spread over subclasses.
 *
 * Kinds that carry an EXPRESSION are formula bearing; kinds whose name can be spelled
 * inside another node's formula are reference targets.
 */
public enum NodeKind {

    MODEL("Model", NameScope.NONE),
    TABLE("Table", NameScope.MODEL),
    DATA_COLUMN("Column", NameScope.PARENT),
    CALCULATED_COLUMN("Column", NameScope.PARENT),
    MEASURE("Measure", NameScope.MODEL),
    RELATIONSHIP("Relationship", NameScope.MODEL),
    HIERARCHY("Hierarchy", NameScope.PARENT),
    PERSPECTIVE("Perspective", NameScope.MODEL),
    ROLE("Role", NameScope.MODEL),
    ANNOTATION("Annotation", NameScope.PARENT);

    /**
     * Where a name must be unique among nodes of the same name class.
     */
    public enum NameScope {
        /** Only the model root, which has no siblings */
        NONE,
        /** All attached nodes of the name class in the model */
        MODEL,
        /** Children of the same parent */
        PARENT
    }

    private final String nameClass;
    private final NameScope nameScope;

    NodeKind(String nameClass, NameScope nameScope) {
        this.nameClass = nameClass;
        this.nameScope = nameScope;
    }

    /**
     * Kinds sharing a name class compete for the same names. Data and calculated columns
     * share the "Column" class, so a table cannot hold both a data column and a calculated
     * column called Amount.
     *
     * @return The name class, also used as the display name of the kind
     */
    public String nameClass() {
        return nameClass;
    }

    public NameScope nameScope() {
        return nameScope;
    }

    public boolean sameNameClass(NodeKind other) {
        return nameClass.equals(other.nameClass);
    }

    public boolean isColumn() {
        return this == DATA_COLUMN || this == CALCULATED_COLUMN;
    }

    /**
     * @return true if nodes of this kind carry a formula in their EXPRESSION property
     */
    public boolean isFormulaBearing() {
        return this == TABLE || this == CALCULATED_COLUMN || this == MEASURE;
    }

    /**
     * @return true if the name of a node of this kind can appear inside a formula
     */
    public boolean isReferenceTarget() {
        return this == TABLE || isColumn() || this == MEASURE;
    }

    /**
     * Only measures can change their parent table. Every kind can be reordered among its
     * siblings.
     */
    public boolean isMovable() {
        return this == MEASURE;
    }

    /**
     * @param parent Kind of the prospective parent
     * @return true if a node of this kind may be a child of a node of the given kind
     */
    public boolean canBeChildOf(NodeKind parent) {
        return switch (this) {
            case MODEL -> false;
            case TABLE, RELATIONSHIP, PERSPECTIVE, ROLE -> parent == MODEL;
            case DATA_COLUMN, CALCULATED_COLUMN, MEASURE, HIERARCHY -> parent == TABLE;
            case ANNOTATION -> parent != ANNOTATION;
        };
    }

    /**
     * @param property The property to check
     * @return true if nodes of this kind store the given property
     */
    public boolean supports(NodeProperty property) {
        return switch (property) {
            case NAME, DESCRIPTION -> true;
            case EXPRESSION -> isFormulaBearing();
            case FORMAT_STRING -> isColumn() || this == MEASURE;
            case DISPLAY_FOLDER -> isColumn() || this == MEASURE || this == HIERARCHY;
            case IS_HIDDEN -> this == TABLE || isColumn() || this == MEASURE || this == HIERARCHY;
            case DATA_TYPE -> isColumn();
            case SOURCE_COLUMN -> this == DATA_COLUMN;
            case FROM_COLUMN, TO_COLUMN, IS_ACTIVE, CROSS_FILTERING -> this == RELATIONSHIP;
            case MODEL_PERMISSION -> this == ROLE;
            case VALUE -> this == ANNOTATION;
        };
    }
}
