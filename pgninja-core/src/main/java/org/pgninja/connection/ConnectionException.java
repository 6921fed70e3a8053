package org.pgninja.connection;

import org.pgninja.PgNinjaException;

public class ConnectionException extends PgNinjaException {
    public ConnectionException(String message, Throwable cause) { super(message, cause); }
    public ConnectionException(String message) { super(message); }
}
