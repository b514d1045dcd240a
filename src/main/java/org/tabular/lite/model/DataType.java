package org.tabular.lite.model;

/**
 * Storage data types of a column.
 */
public enum DataType {
    STRING,
    INT64,
    DOUBLE,
    DECIMAL,
    BOOLEAN,
    DATE_TIME,
    BINARY
}
