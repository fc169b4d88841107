package org.tamodel.document.query;

/**
 * The kind of value a query is expected to produce.
 */
public enum ExpectationType {
    SYMBOLIC,
    PROBABILITY,
    NUMERIC_VALUE,
    ERROR_VALUE
}
