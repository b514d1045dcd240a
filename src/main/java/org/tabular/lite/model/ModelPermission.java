package org.tabular.lite.model;

/**
 * Model-level permission granted by a role.
 */
public enum ModelPermission {
    NONE,
    READ,
    READ_REFRESH,
    REFRESH,
    ADMINISTRATOR
}
