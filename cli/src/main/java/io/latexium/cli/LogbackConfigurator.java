package io.latexium.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code logging.format} and {@code logging.level} to the Logback root logger once the
 * configuration is known.
 *
 * <p>Everything is written to standard error, leaving standard output to the analysis result.
 */
public final class LogbackConfigurator {

    /** Single-threaded command line, so no thread column. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{30} %msg%n";

    static final String APPENDER_NAME = "STDERR";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Swaps whatever appenders the root logger has for one stderr console appender.
     *
     * @param format "json" selects Logback's {@link JsonEncoder}; any other value selects text
     * @param level  root level name; unknown names fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

        root.detachAndStopAllAppenders();
        root.setLevel(Level.toLevel(level, Level.INFO));
        root.addAppender(stderrAppender(context, encoder(context, "json".equalsIgnoreCase(format))));
    }

    private static ConsoleAppender<ILoggingEvent> stderrAppender(
            LoggerContext context, Encoder<ILoggingEvent> encoder) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, boolean json) {
        if (json) {
            JsonEncoder jsonEncoder = new JsonEncoder();
            jsonEncoder.setContext(context);
            jsonEncoder.start();
            return jsonEncoder;
        }
        PatternLayoutEncoder patternEncoder = new PatternLayoutEncoder();
        patternEncoder.setContext(context);
        patternEncoder.setPattern(TEXT_PATTERN);
        patternEncoder.start();
        return patternEncoder;
    }
}
