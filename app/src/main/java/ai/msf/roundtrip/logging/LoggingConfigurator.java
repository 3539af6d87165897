package ai.msf.roundtrip.logging;

import ai.msf.roundtrip.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.Iterator;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Swaps the encoder of every stream appender on the root logger between the text pattern and JSON lines.
 */
public final class LoggingConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{30} [%X{document:-}] - %msg%n";

    private LoggingConfigurator() {
    }

    public static void configure(LogFormat format) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            // another SLF4J binding owns the output
            return;
        }
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        Iterator<Appender<ILoggingEvent>> appenders = root.iteratorForAppenders();
        while (appenders.hasNext()) {
            if (appenders.next() instanceof OutputStreamAppender<ILoggingEvent> streamAppender) {
                replaceEncoder(streamAppender, encoderFor(format, context));
            }
        }
    }

    static Encoder<ILoggingEvent> encoderFor(LogFormat format, LoggerContext context) {
        return switch (format) {
            case JSON -> {
                SimpleJsonLayout layout = new SimpleJsonLayout();
                layout.setContext(context);
                layout.start();
                LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
                encoder.setContext(context);
                encoder.setLayout(layout);
                encoder.start();
                yield encoder;
            }
            case TEXT -> {
                PatternLayoutEncoder encoder = new PatternLayoutEncoder();
                encoder.setContext(context);
                encoder.setPattern(TEXT_PATTERN);
                encoder.start();
                yield encoder;
            }
        };
    }

    private static void replaceEncoder(OutputStreamAppender<ILoggingEvent> appender, Encoder<ILoggingEvent> encoder) {
        boolean running = appender.isStarted();
        if (running) {
            appender.stop();
        }
        appender.setEncoder(encoder);
        if (running) {
            appender.start();
        }
    }
}
