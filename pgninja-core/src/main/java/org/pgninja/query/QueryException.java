package org.pgninja.query;

import org.pgninja.PgNinjaException;

/**
 * The database rejected a single statement. The driver error is the cause.
 */
public class QueryException extends PgNinjaException {
    private final transient Query query;

    public QueryException(Query query, Throwable cause) {
        super("error with query: " + query.text() + (cause == null ? "" : " (" + cause.getMessage() + ")"), cause);
        this.query = query;
    }

    public Query getQuery() {
        return query;
    }
}
