package org.pgninja.log;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class Slf4jQueryLogTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        logger = (Logger) LoggerFactory.getLogger(Slf4jQueryLog.LOGGER_NAME);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    @Test
    void severitiesMapToLevels() {
        QueryLog log = new Slf4jQueryLog(true, false);

        log.log("a", Severity.WHITE);
        log.log("b", Severity.GREEN);
        log.log("c", Severity.YELLOW);
        log.log("d", Severity.RED);
        log.log("e", Severity.BLUE);

        assertThat(appender.list)
                .extracting(ILoggingEvent::getLevel, ILoggingEvent::getFormattedMessage)
                .containsExactly(
                        tuple(Level.INFO, "a"),
                        tuple(Level.INFO, "b"),
                        tuple(Level.WARN, "c"),
                        tuple(Level.ERROR, "d"),
                        tuple(Level.INFO, "e"));
    }

    @Test
    void colors_wrapMessageInAnsiCodes() {
        new Slf4jQueryLog(true, true).log("success query: SELECT 1", Severity.BLUE);

        assertThat(appender.list).singleElement()
                .extracting(ILoggingEvent::getFormattedMessage)
                .isEqualTo("\u001b[34msuccess query: SELECT 1\u001b[0m");
    }

    @Test
    void disabledSink_emitsNothing() {
        Slf4jQueryLog log = new Slf4jQueryLog(false);

        for (Severity s : Severity.values()) {
            log.log("quiet", s);
        }

        assertThat(log.isEnabled()).isFalse();
        assertThat(appender.list).isEmpty();
    }

    @Test
    void nullSeverity_defaultsToWhite() {
        new Slf4jQueryLog(true, true).log("plain", null);

        assertThat(appender.list).singleElement()
                .extracting(ILoggingEvent::getFormattedMessage)
                .isEqualTo(Severity.WHITE.ansi() + "plain\u001b[0m");
    }
}
