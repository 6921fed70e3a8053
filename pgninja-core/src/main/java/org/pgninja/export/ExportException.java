package org.pgninja.export;

import org.pgninja.PgNinjaException;

public class ExportException extends PgNinjaException {
    public ExportException(String message, Throwable cause) { super(message, cause); }
    public ExportException(String message) { super(message); }
}
