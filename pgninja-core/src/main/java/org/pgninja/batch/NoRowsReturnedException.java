package org.pgninja.batch;

import org.pgninja.PgNinjaException;
import org.pgninja.query.Query;

/**
 * Recorded for a batch item that executed but produced no rows. Batch items only count as completed when they
 * return data, so a zero-row {@code UPDATE} lands here too.
 */
public class NoRowsReturnedException extends PgNinjaException {
    private final transient Query query;

    public NoRowsReturnedException(Query query) {
        super("query returned no rows");
        this.query = query;
    }

    public Query getQuery() {
        return query;
    }
}
