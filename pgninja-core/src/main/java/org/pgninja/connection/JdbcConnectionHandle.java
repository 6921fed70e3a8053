package org.pgninja.connection;

import org.pgninja.query.MutationResult;
import org.pgninja.query.QueryResult;
import org.pgninja.query.SelectResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ConnectionHandle} over one JDBC {@link Connection}.
 *
 * <p>Every statement runs on a single daemon session thread, in the order it was handed to {@link #query}.
 * Callers get concurrency of dispatch; the wire only ever sees one statement at a time.
 *
 * <p>{@code BEGIN}, {@code COMMIT} and {@code ROLLBACK} are mapped onto the JDBC transaction API so that the
 * same protocol works with drivers that refuse those statements while auto-commit is on.
 */
public class JdbcConnectionHandle implements ConnectionHandle {
    private static final Logger log = LoggerFactory.getLogger(JdbcConnectionHandle.class);
    private static final AtomicInteger SESSION_IDS = new AtomicInteger();

    private final ConnectionSettings settings;
    private final JdbcConnectionProvider provider;
    private final ExecutorService session;
    private final AtomicBoolean ended = new AtomicBoolean(false);

    // Only touched from the session thread.
    private Connection connection;

    public JdbcConnectionHandle(ConnectionSettings settings) {
        this(settings, new DriverManagerConnectionProvider());
    }

    public JdbcConnectionHandle(ConnectionSettings settings, JdbcConnectionProvider provider) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.provider = Objects.requireNonNull(provider, "provider");
        int id = SESSION_IDS.incrementAndGet();
        this.session = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "pgninja-session-" + id);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<Void> connect() {
        return submit(() -> {
            if (connection != null) {
                return null;
            }
            try {
                connection = provider.openConnection(settings);
                connection.setAutoCommit(true);
            } catch (Exception e) {
                throw new ConnectionException("Error connecting to " + settings.jdbcUrl() + ": " + e.getMessage(), e);
            }
            log.debug("Opened session to {}", settings.jdbcUrl());
            return null;
        });
    }

    @Override
    public CompletableFuture<QueryResult> query(String text, List<Object> params) {
        Objects.requireNonNull(text, "text");
        List<Object> bound = params == null ? List.of() : params;
        return submit(() -> run(text, bound));
    }

    @Override
    public void end() {
        if (!ended.compareAndSet(false, true)) {
            return;
        }
        // Queued statements still run; the close is queued behind them.
        try {
            session.execute(this::closeConnection);
        } catch (RejectedExecutionException e) {
            log.debug("Session already shut down", e);
        }
        session.shutdown();
    }

    private QueryResult run(String text, List<Object> params) throws SQLException {
        Connection conn = requireOpen();
        String keyword = CommandTags.leadingKeyword(text);
        if (params.isEmpty() && keyword != null) {
            switch (keyword) {
                case "BEGIN", "START" -> {
                    conn.setAutoCommit(false);
                    return new MutationResult(keyword, 0);
                }
                case "COMMIT", "END" -> {
                    finishTransaction(conn, true);
                    return new MutationResult("COMMIT", 0);
                }
                case "ROLLBACK", "ABORT" -> {
                    if (CommandTags.isRollbackToSavepoint(text)) {
                        break;
                    }
                    finishTransaction(conn, false);
                    return new MutationResult("ROLLBACK", 0);
                }
                default -> {
                }
            }
        }

        try (PreparedStatement ps = conn.prepareStatement(text)) {
            bind(ps, params);
            boolean hasResultSet = ps.execute();
            if (hasResultSet) {
                try (ResultSet rs = ps.getResultSet()) {
                    return new SelectResult(CommandTags.of(text, true), toRows(rs));
                }
            }
            return new MutationResult(CommandTags.of(text, false), Math.max(0, ps.getUpdateCount()));
        }
    }

    /**
     * Ends the open transaction and returns to auto-commit. If the driver fails to commit or roll back, the
     * transaction state is unknown: the connection is replaced so that the server discards the pending work
     * and later statements run in auto-commit again.
     */
    private void finishTransaction(Connection conn, boolean commit) throws SQLException {
        if (conn.getAutoCommit()) {
            return;
        }
        try {
            if (commit) {
                conn.commit();
            } else {
                conn.rollback();
            }
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("{} failed on {}; reopening the session: {}",
                    commit ? "COMMIT" : "ROLLBACK", settings.jdbcUrl(), e.toString());
            reopen(e);
            throw e;
        }
    }

    private void reopen(SQLException failure) {
        try {
            connection.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
        connection = null;
        try {
            Connection fresh = provider.openConnection(settings);
            fresh.setAutoCommit(true);
            connection = fresh;
        } catch (Exception e) {
            failure.addSuppressed(e);
        }
    }

    private Connection requireOpen() {
        if (connection == null) {
            throw new IllegalStateException("Not connected; call connect() first");
        }
        return connection;
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private static List<Map<String, Object>> toRows(ResultSet rs) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        ResultSetMetaData md = rs.getMetaData();
        int cols = md.getColumnCount();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= cols; i++) {
                row.put(md.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    private void closeConnection() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
            log.debug("Closed session to {}", settings.jdbcUrl());
        } catch (SQLException e) {
            log.warn("Failed to close session to {}: {}", settings.jdbcUrl(), e.toString());
        } finally {
            connection = null;
        }
    }

    private <T> CompletableFuture<T> submit(SessionTask<T> task) {
        CompletableFuture<T> fut = new CompletableFuture<>();
        if (ended.get()) {
            fut.completeExceptionally(new IllegalStateException("Connection handle has been ended"));
            return fut;
        }
        try {
            session.execute(() -> {
                try {
                    fut.complete(task.call());
                } catch (Throwable e) {
                    fut.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            fut.completeExceptionally(new IllegalStateException("Connection handle has been ended", e));
        }
        return fut;
    }

    @FunctionalInterface
    private interface SessionTask<T> {
        T call() throws Exception;
    }
}
