package org.pgninja.support;

import org.pgninja.connection.ConnectionHandle;
import org.pgninja.query.MutationResult;
import org.pgninja.query.QueryResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-memory {@link ConnectionHandle} answering from a script. Unscripted statements answer with a
 * {@link MutationResult} tagged with their first word.
 *
 * <p>In {@link #hold() hold} mode every query stays pending until {@link #releaseAll()}.
 */
public class ScriptedConnectionHandle implements ConnectionHandle {

    private final List<String> statements = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Supplier<QueryResult>> script = new ConcurrentHashMap<>();
    private final List<Runnable> pending = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean holding;
    private volatile boolean ended;
    private volatile Throwable connectFailure;

    public ScriptedConnectionHandle respond(String text, QueryResult result) {
        script.put(text, () -> result);
        return this;
    }

    public ScriptedConnectionHandle fail(String text, RuntimeException error) {
        script.put(text, () -> {
            throw error;
        });
        return this;
    }

    public ScriptedConnectionHandle failConnect(Throwable error) {
        this.connectFailure = error;
        return this;
    }

    public ScriptedConnectionHandle hold() {
        this.holding = true;
        return this;
    }

    public void releaseAll() {
        holding = false;
        List<Runnable> toRun;
        synchronized (pending) {
            toRun = new ArrayList<>(pending);
            pending.clear();
        }
        toRun.forEach(Runnable::run);
    }

    public List<String> statements() {
        synchronized (statements) {
            return List.copyOf(statements);
        }
    }

    public boolean isEnded() {
        return ended;
    }

    @Override
    public CompletableFuture<Void> connect() {
        return connectFailure == null
                ? CompletableFuture.completedFuture(null)
                : CompletableFuture.failedFuture(connectFailure);
    }

    @Override
    public CompletableFuture<QueryResult> query(String text, List<Object> params) {
        if (ended) {
            return CompletableFuture.failedFuture(new IllegalStateException("ended"));
        }
        statements.add(text);
        CompletableFuture<QueryResult> fut = new CompletableFuture<>();
        Runnable answer = () -> {
            try {
                Supplier<QueryResult> s = script.get(text);
                fut.complete(s != null ? s.get() : new MutationResult(firstWord(text), 0));
            } catch (RuntimeException e) {
                fut.completeExceptionally(e);
            }
        };
        if (holding) {
            pending.add(answer);
        } else {
            answer.run();
        }
        return fut;
    }

    @Override
    public void end() {
        ended = true;
    }

    private static String firstWord(String text) {
        String t = text.trim();
        int sp = t.indexOf(' ');
        return (sp < 0 ? t : t.substring(0, sp)).toUpperCase(Locale.ROOT);
    }
}
