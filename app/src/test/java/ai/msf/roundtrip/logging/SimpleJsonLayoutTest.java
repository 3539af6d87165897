package ai.msf.roundtrip.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private LoggerContext context;
    private SimpleJsonLayout layout;

    @BeforeEach
    void startLayout() {
        context = new LoggerContext();
        context.start();
        layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
    }

    @Test
    void formatsEventAsJsonLine() throws Exception {
        LoggingEvent event = event("parsed \"8846A\"\nwith 5 functions");

        String json = layout.doLayout(event);

        assertThat(json).endsWith(System.lineSeparator());
        JsonNode node = objectMapper.readTree(json);
        assertThat(node.get("timestamp").asText()).isEqualTo("1970-01-01T00:00:00Z");
        assertThat(node.get("level").asText()).isEqualTo("INFO");
        assertThat(node.get("logger").asText()).isEqualTo("ai.msf.roundtrip.xml.MsfParser");
        assertThat(node.get("message").asText()).isEqualTo("parsed \"8846A\"\nwith 5 functions");
        assertThat(node.has("mdc")).isFalse();
        assertThat(node.has("document")).isFalse();
    }

    @Test
    void promotesDocumentKeyAndNestsOtherMdcEntries() throws Exception {
        LoggingEvent event = event("wrote document");
        event.setMDCPropertyMap(Map.of(SimpleJsonLayout.DOCUMENT_KEY, "fixtures/8846A.msf", "command", "roundtrip"));

        JsonNode node = objectMapper.readTree(layout.doLayout(event));

        assertThat(node.get("document").asText()).isEqualTo("fixtures/8846A.msf");
        assertThat(node.get("mdc").get("command").asText()).isEqualTo("roundtrip");
        assertThat(node.get("mdc").has(SimpleJsonLayout.DOCUMENT_KEY)).isFalse();
    }

    @Test
    void includesStackTraceOfThrowable() throws Exception {
        LoggingEvent event = event("failed");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("storage offline")));

        JsonNode node = objectMapper.readTree(layout.doLayout(event));

        assertThat(node.get("exception").asText()).contains("IllegalStateException", "storage offline");
    }

    private LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("ai.msf.roundtrip.xml.MsfParser");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
