package org.pgninja;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for the {@link java.util.concurrent.CompletableFuture} based API.
 */
public final class Futures {
    private Futures() {}

    /** Strips the {@link CompletionException}/{@link ExecutionException} wrappers added by future chaining. */
    public static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
