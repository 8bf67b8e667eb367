package io.latexium.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogbackConfiguratorTest {

    private static Logger root() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        return context.getLogger(Logger.ROOT_LOGGER_NAME);
    }

    @AfterEach
    void reset() {
        LogbackConfigurator.configure("text", "WARN");
    }

    @Test
    void textModeUsesPatternOnStderr() {
        LogbackConfigurator.configure("text", "debug");

        Appender<ILoggingEvent> appender = root().getAppender(LogbackConfigurator.APPENDER_NAME);
        assertThat(root().getLevel()).isEqualTo(Level.DEBUG);
        assertThat(appender).isInstanceOfSatisfying(ConsoleAppender.class, console -> {
            assertThat(console.getTarget()).isEqualTo("System.err");
            assertThat(console.getEncoder()).isInstanceOfSatisfying(PatternLayoutEncoder.class,
                    encoder -> assertThat(encoder.getPattern()).isEqualTo(LogbackConfigurator.TEXT_PATTERN));
        });
    }

    @Test
    void jsonModeUsesJsonEncoder() {
        LogbackConfigurator.configure("JSON", "ERROR");

        Appender<ILoggingEvent> appender = root().getAppender(LogbackConfigurator.APPENDER_NAME);
        assertThat(root().getLevel()).isEqualTo(Level.ERROR);
        assertThat(appender).isInstanceOfSatisfying(ConsoleAppender.class,
                console -> assertThat(console.getEncoder()).isInstanceOf(JsonEncoder.class));
    }

    @Test
    void unknownLevelFallsBackToInfo() {
        LogbackConfigurator.configure("text", "chatty");
        assertThat(root().getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void reconfiguringReplacesTheAppender() {
        LogbackConfigurator.configure("text", "INFO");
        LogbackConfigurator.configure("json", "INFO");

        int count = 0;
        for (var it = root().iteratorForAppenders(); it.hasNext(); it.next()) {
            count++;
        }
        assertThat(count).isEqualTo(1);
    }
}
