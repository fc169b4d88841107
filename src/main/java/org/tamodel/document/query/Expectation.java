package org.tamodel.document.query;

import java.util.List;

/**
 * The result a query is expected to produce.
 *
 * @param valueType The kind of value.
 * @param status    The expected outcome.
 * @param value     The expected value as written; empty for symbolic queries.
 * @param resources The expected resource usage.
 */
public record Expectation(ExpectationType valueType, QueryStatus status, String value, List<Resource> resources) {

    /** No expectation. */
    public static final Expectation NONE =
            new Expectation(ExpectationType.SYMBOLIC, QueryStatus.UNKNOWN, "", List.of());

    public Expectation {
        value = value == null ? "" : value;
        resources = resources == null ? List.of() : List.copyOf(resources);
    }
}
