package org.tabular.lite.model;

/**
 * Filter propagation direction of a relationship.
 */
public enum CrossFilteringBehavior {
    ONE_DIRECTION,
    BOTH_DIRECTIONS,
    AUTOMATIC
}
