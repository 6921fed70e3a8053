package org.pgninja.log;

/**
 * Sink for the per-query, per-transaction and per-batch events. Implementations must not change results;
 * turning a sink off only silences output.
 */
@FunctionalInterface
public interface QueryLog {

    QueryLog NOOP = (message, severity) -> {
    };

    void log(String message, Severity severity);

    default void log(String message) {
        log(message, Severity.WHITE);
    }
}
