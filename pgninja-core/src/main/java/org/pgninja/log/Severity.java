package org.pgninja.log;

/**
 * Colour tag of a query log event.
 */
public enum Severity {
    WHITE("\u001b[37m"),
    GREEN("\u001b[32m"),
    YELLOW("\u001b[33m"),
    RED("\u001b[31m"),
    BLUE("\u001b[34m");

    static final String RESET = "\u001b[0m";

    private final String ansi;

    Severity(String ansi) {
        this.ansi = ansi;
    }

    public String ansi() {
        return ansi;
    }
}
