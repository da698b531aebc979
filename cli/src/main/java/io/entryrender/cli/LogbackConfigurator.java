package io.entryrender.cli;

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
 * Programmatic Logback setup for the command-line renderer.
 *
 * <p>
 * Standard output carries the rendered markup, so every log line goes to standard error. The
 * configured level applies to the renderer's own loggers ({@value #APP_LOGGER}); third-party
 * libraries such as the schema validator stay at {@code WARN} unless a stricter level is asked
 * for.
 */
public final class LogbackConfigurator {

    /** Logger hierarchy of the renderer itself. */
    static final String APP_LOGGER = "io.entryrender";

    /** Appender name; one appender is attached to the root logger. */
    static final String APPENDER_NAME = "STDERR";

    /** Pattern for text mode. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    private static final Level LIBRARY_LEVEL = Level.WARN;

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the Logback configuration.
     *
     * @param format "json" for one JSON object per line, anything else for text
     * @param level  level of the renderer's loggers; unknown values fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level appLevel = Level.toLevel(level, Level.INFO);

        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.detachAndStopAllAppenders();
        rootLogger.setLevel(appLevel.isGreaterOrEqual(LIBRARY_LEVEL) ? appLevel : LIBRARY_LEVEL);
        context.getLogger(APP_LOGGER).setLevel(appLevel);

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder("json".equalsIgnoreCase(format) ? jsonEncoder(context) : textEncoder(context));
        appender.start();
        rootLogger.addAppender(appender);
    }

    private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
        JsonEncoder encoder = new JsonEncoder();
        encoder.setContext(context);
        encoder.setWithFormattedMessage(true);
        encoder.start();
        return encoder;
    }

    private static Encoder<ILoggingEvent> textEncoder(LoggerContext context) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }
}
