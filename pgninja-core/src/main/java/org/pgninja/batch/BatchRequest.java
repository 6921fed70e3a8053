package org.pgninja.batch;

import org.pgninja.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Independent queries to run concurrently. {@code retainSuccessRows} keeps the rows of successful items in the
 * report.
 */
public record BatchRequest(List<Query> queries, boolean retainSuccessRows) {

    public BatchRequest {
        Objects.requireNonNull(queries, "queries");
        queries = List.copyOf(queries);
    }

    public static BatchRequest of(List<Query> queries) {
        return new BatchRequest(queries, false);
    }

    public static BatchRequest of(List<Query> queries, boolean retainSuccessRows) {
        return new BatchRequest(queries, retainSuccessRows);
    }

    /**
     * Pairs each text with the parameter list at the same position; missing parameter lists mean no
     * parameters.
     */
    public static BatchRequest of(List<String> texts, List<List<Object>> params, boolean retainSuccessRows) {
        Objects.requireNonNull(texts, "texts");
        List<Query> queries = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            List<Object> p = params != null && i < params.size() ? params.get(i) : null;
            queries.add(new Query(texts.get(i), p));
        }
        return new BatchRequest(queries, retainSuccessRows);
    }
}
