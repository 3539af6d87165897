package ai.msf.roundtrip.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * One JSON object per event. The {@value #DOCUMENT_KEY} MDC entry is lifted to a top-level field, the remaining
 * MDC entries are nested under {@code mdc}.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    public static final String DOCUMENT_KEY = "document";

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final JsonFactory jsonFactory = new JsonFactory();

    @Override
    public String doLayout(ILoggingEvent event) {
        StringWriter writer = new StringWriter(256);
        try (JsonGenerator generator = jsonFactory.createGenerator(writer)) {
            generator.writeStartObject();
            generator.writeStringField("timestamp",
                    ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
            generator.writeStringField("level", event.getLevel().toString());
            generator.writeStringField("logger", event.getLoggerName());
            generator.writeStringField("thread", event.getThreadName());
            generator.writeStringField("message", event.getFormattedMessage());

            Map<String, String> mdc = safeMdc(event);
            if (mdc.containsKey(DOCUMENT_KEY)) {
                generator.writeStringField(DOCUMENT_KEY, mdc.get(DOCUMENT_KEY));
            }
            if (mdc.keySet().stream().anyMatch(key -> !DOCUMENT_KEY.equals(key))) {
                generator.writeObjectFieldStart("mdc");
                for (Map.Entry<String, String> entry : mdc.entrySet()) {
                    if (!DOCUMENT_KEY.equals(entry.getKey())) {
                        generator.writeStringField(entry.getKey(), entry.getValue());
                    }
                }
                generator.writeEndObject();
            }

            IThrowableProxy throwable = event.getThrowableProxy();
            if (throwable != null) {
                generator.writeStringField("exception", ThrowableProxyUtil.asString(throwable));
            }
            generator.writeEndObject();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to render log event as JSON", ex);
        }
        return writer.append(CoreConstants.LINE_SEPARATOR).toString();
    }

    private static Map<String, String> safeMdc(ILoggingEvent event) {
        try {
            Map<String, String> map = event.getMDCPropertyMap();
            return map == null ? Map.of() : map;
        } catch (RuntimeException ex) {
            // events built outside a fully initialized context have no MDC adapter
            return Map.of();
        }
    }
}
