package org.pgninja.connection;

import org.pgninja.query.QueryResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One live session to the database.
 * <p>
 * Statements handed to {@link #query} may be dispatched from many callers at once; the handle decides the
 * order in which they reach the wire. Reconnection, pooling and credentials are the implementation's concern.
 */
public interface ConnectionHandle extends AutoCloseable {

    /** Opens the session. Completes exceptionally with {@link ConnectionException}. */
    CompletableFuture<Void> connect();

    /**
     * Runs one statement. Completes exceptionally with the driver's error when the database rejects it,
     * or with {@link IllegalStateException} once {@link #end()} was called.
     */
    CompletableFuture<QueryResult> query(String text, List<Object> params);

    /** Terminates the session. Safe to call more than once. */
    void end();

    @Override
    default void close() {
        end();
    }
}
