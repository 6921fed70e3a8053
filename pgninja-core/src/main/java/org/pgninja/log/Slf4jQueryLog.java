package org.pgninja.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link QueryLog} backed by the {@code org.pgninja.query} SLF4J logger.
 *
 * <p>{@link Severity#RED} logs at error, {@link Severity#YELLOW} at warn, everything else at info. The
 * timestamp comes from the logging backend's pattern.
 */
public class Slf4jQueryLog implements QueryLog {
    public static final String LOGGER_NAME = "org.pgninja.query";

    private final Logger logger;
    private final boolean enabled;
    private final boolean colors;

    public Slf4jQueryLog(boolean enabled) {
        this(enabled, true);
    }

    public Slf4jQueryLog(boolean enabled, boolean colors) {
        this(LoggerFactory.getLogger(LOGGER_NAME), enabled, colors);
    }

    Slf4jQueryLog(Logger logger, boolean enabled, boolean colors) {
        this.logger = logger;
        this.enabled = enabled;
        this.colors = colors;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void log(String message, Severity severity) {
        if (!enabled) {
            return;
        }
        Severity s = severity == null ? Severity.WHITE : severity;
        String line = colors ? s.ansi() + message + Severity.RESET : message;
        switch (s) {
            case RED -> logger.error(line);
            case YELLOW -> logger.warn(line);
            default -> logger.info(line);
        }
    }
}
