package org.tamodel.document.query;

/**
 * The expected outcome of a query.
 */
public enum QueryStatus {
    TRUE,
    FALSE,
    MAYBE_TRUE,
    MAYBE_FALSE,
    UNKNOWN
}
