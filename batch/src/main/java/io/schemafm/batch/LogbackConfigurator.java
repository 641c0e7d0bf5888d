package io.schemafm.batch;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback configuration for structured JSON vs. text logging.
 *
 * <p>
 * Called after the configuration is loaded. Replaces the root appender and level according to
 * {@code logging.format} and {@code logging.level}. JSON mode uses Logback's {@link JsonEncoder},
 * which includes MDC fields, so every line logged while a document is checked carries its
 * {@code document} and {@code batch} ids.
 */
public final class LogbackConfigurator {

    /** Human-readable pattern for text mode; shows the batch id when one is set. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} %X{batch} - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * @param format "json" for structured JSON output, anything else for the text pattern
     * @param level  root log level, INFO when unrecognised
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(Level.toLevel(level, Level.INFO));
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("STDOUT");

        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            appender.setEncoder(encoder);
        } else {
            PatternLayoutEncoder encoder = new PatternLayoutEncoder();
            encoder.setContext(context);
            encoder.setPattern(TEXT_PATTERN);
            encoder.start();
            appender.setEncoder(encoder);
        }

        appender.start();
        rootLogger.addAppender(appender);

        // networknt logs schema loading at DEBUG
        context.getLogger("com.networknt").setLevel(Level.WARN);
    }
}
