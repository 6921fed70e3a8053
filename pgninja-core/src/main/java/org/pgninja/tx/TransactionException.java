package org.pgninja.tx;

import org.pgninja.PgNinjaException;

/**
 * A transaction did not commit. Always raised after a best-effort {@code ROLLBACK}.
 *
 * <p>Non-fatal: a step completed without a command tag. Fatal: something threw (a step, {@code BEGIN},
 * {@code COMMIT} or {@code ROLLBACK}); the original error is the cause.
 */
public class TransactionException extends PgNinjaException {
    private final boolean fatal;
    private final int failedStep;

    public TransactionException(String message, int failedStep) {
        super(message);
        this.fatal = false;
        this.failedStep = failedStep;
    }

    public TransactionException(String message, Throwable cause) {
        super(message, cause);
        this.fatal = true;
        this.failedStep = -1;
    }

    public boolean isFatal() {
        return fatal;
    }

    /** Index of the step without a command tag, or -1 for fatal failures. */
    public int getFailedStep() {
        return failedStep;
    }
}
