package org.pgninja;

/**
 * Root of the unchecked exceptions raised by pgninja.
 */
public class PgNinjaException extends RuntimeException {
    public PgNinjaException(String message, Throwable cause) { super(message, cause); }
    public PgNinjaException(String message) { super(message); }
}
