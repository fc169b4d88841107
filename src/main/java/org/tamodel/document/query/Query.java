package org.tamodel.document.query;

import java.util.List;

/**
 * An entry of the query list of a document.
 *
 * @param formula     The query formula as written.
 * @param comment     The comment shown next to the query.
 * @param options     Options applied while the query is checked.
 * @param expectation The expected result.
 * @param location    Where the query was read from, e.g. a file name.
 */
public record Query(String formula, String comment, List<QueryOption> options, Expectation expectation,
                    String location) {

    public Query {
        comment = comment == null ? "" : comment;
        options = options == null ? List.of() : List.copyOf(options);
        expectation = expectation == null ? Expectation.NONE : expectation;
        location = location == null ? "" : location;
    }

    /**
     * Creates a query without options or expectation.
     * @param formula The formula.
     * @param comment The comment.
     * @return The query.
     */
    public static Query of(String formula, String comment) {
        return new Query(formula, comment, List.of(), Expectation.NONE, "");
    }
}
