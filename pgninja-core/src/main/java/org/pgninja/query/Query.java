package org.pgninja.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One statement plus its positional parameters. Parameters may contain {@code null} (bound as SQL NULL).
 */
public record Query(String text, List<Object> params) {

    public Query {
        Objects.requireNonNull(text, "text");
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static Query of(String text, Object... params) {
        return new Query(text, params == null ? List.of() : Arrays.asList(params));
    }
}
