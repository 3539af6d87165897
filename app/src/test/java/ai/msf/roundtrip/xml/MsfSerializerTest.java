package ai.msf.roundtrip.xml;

import static org.assertj.core.api.Assertions.assertThat;

import ai.msf.roundtrip.Fixtures;
import ai.msf.roundtrip.model.Header;
import ai.msf.roundtrip.model.Instrument;
import ai.msf.roundtrip.model.MsfFunction;
import ai.msf.roundtrip.model.Range;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class MsfSerializerTest {

    private static final Pattern TAG_LINE = Pattern.compile("^\\s*<(/?)([A-Za-z_]+)>");

    private final MsfParser parser = new MsfParser();
    private final MsfSerializer serializer = new MsfSerializer();

    @Test
    void reproducesCanonicalDocumentByteForByte() {
        String fixture = Fixtures.read(Fixtures.FIVE_FUNCTIONS);

        assertThat(serializer.serialize(parser.parse(fixture))).isEqualTo(fixture);
    }

    @Test
    void roundTripPreservesTreeAndIdentifiers() {
        Instrument original = parser.parse(Fixtures.MINIMAL_DOCUMENT);

        String once = serializer.serialize(original);
        Instrument reparsed = parser.parse(once);

        assertThat(reparsed).isEqualTo(original);
        assertThat(IdentifierExtractor.extractAllIdentifiers(reparsed))
                .containsExactlyElementsOf(IdentifierExtractor.extractAllIdentifiers(original));
        assertThat(serializer.serialize(reparsed)).isEqualTo(once);
    }

    @Test
    void writesEveryFieldInCanonicalOrder() {
        String xml = serializer.serialize(parser.parse(Fixtures.MINIMAL_DOCUMENT));

        assertThat(childrenOf(xml, "instrument")).containsExactlyElementsOf(MsfElements.INSTRUMENT_ORDER);
        assertThat(childrenOf(xml, "header")).containsExactlyElementsOf(MsfElements.HEADER_ORDER);
        assertThat(childrenOf(xml, "function")).containsExactlyElementsOf(MsfElements.FUNCTION_ORDER);
        assertThat(childrenOf(xml, "range")).containsExactlyElementsOf(MsfElements.RANGE_ORDER);
        assertThat(childrenOf(xml, "parameter")).containsExactlyElementsOf(MsfElements.PARAMETER_ORDER);
        assertThat(childrenOf(xml, "specification")).containsExactlyElementsOf(MsfElements.SPECIFICATION_ORDER);
    }

    @Test
    void writesBooleansAsSentinelsAndEmptyValuesAsPairs() {
        String xml = serializer.serialize(parser.parse(Fixtures.MINIMAL_DOCUMENT));

        assertThat(xml).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<instrument>\n");
        assertThat(xml).contains("  <verified>-1</verified>\n  <review>0</review>\n");
        assertThat(xml).contains("    <modifier></modifier>\n");
        assertThat(xml).contains("      <autoassign>-1</autoassign>\n");
        assertThat(xml).doesNotContain("/>");
        assertThat(xml).endsWith("</instrument>\n");
    }

    @Test
    void absentAndEmptyModifierSerializeIdentically() {
        Instrument absent = parser.parse(Fixtures.MINIMAL_DOCUMENT);
        Instrument empty = parser.parse(Fixtures.MINIMAL_DOCUMENT);
        absent.functions().get(0).setModifier(Optional.empty());
        empty.functions().get(0).setModifier(Optional.of(""));

        assertThat(serializer.serialize(absent)).isEqualTo(serializer.serialize(empty));
    }

    @Test
    void escapesMarkupAndCarriageReturns() {
        Instrument instrument = parser.parse(Fixtures.MINIMAL_DOCUMENT);
        Header header = instrument.header();
        header.setDescription("<b>Ohms</b> & \"volts\"");
        header.setRevisionNotes("line one\r\nline two");

        String xml = serializer.serialize(instrument);
        Header reparsed = parser.parse(xml).header();

        assertThat(xml).contains("<description>&lt;b&gt;Ohms&lt;/b&gt; &amp; \"volts\"</description>");
        assertThat(reparsed.description()).isEqualTo("<b>Ohms</b> & \"volts\"");
        assertThat(reparsed.revisionNotes()).isEqualTo("line one\r\nline two");
    }

    @Test
    void writesPlainDecimalsWithoutExponent() {
        Instrument instrument = parser.parse(Fixtures.MINIMAL_DOCUMENT.replace("<iv_pct>0.0035</iv_pct>",
                "<iv_pct>3.5E-3</iv_pct>"));

        String xml = serializer.serialize(instrument);

        assertThat(xml).contains("<iv_pct>0.0035</iv_pct>");
        assertThat(xml).contains("<upperlimit>10.000</upperlimit>");
    }

    @Test
    void positiveExponentDecimalsSurviveRoundTrip() {
        Instrument first = parser.parse(Fixtures.MINIMAL_DOCUMENT
                .replace("<upperlimit>10.000</upperlimit>", "<upperlimit>1E+3</upperlimit>")
                .replace("<iv_pct>0.0035</iv_pct>", "<fullscale>1.5E3</fullscale>\n        <iv_pct>0.0035</iv_pct>"));

        String xml = serializer.serialize(first);
        Instrument second = parser.parse(xml);

        assertThat(xml).contains("<upperlimit>1000</upperlimit>");
        assertThat(xml).contains("<fullscale>1500</fullscale>");
        Range range = first.functions().get(0).ranges().get(0);
        assertThat(range.parameter().upperLimit()).isEqualTo(new BigDecimal("1000"));
        assertThat(range.specifications().get(0).fullScale()).isEqualTo(new BigDecimal("1500"));
        assertThat(second).isEqualTo(first);
        assertThat(serializer.serialize(second)).isEqualTo(xml);
    }

    @Test
    void dropsCharactersXmlCannotCarry() {
        Logger serializerLogger = (Logger) LoggerFactory.getLogger(MsfSerializer.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        serializerLogger.addAppender(appender);
        try {
            Instrument instrument = parser.parse(Fixtures.MINIMAL_DOCUMENT);
            instrument.header().setDescription("Volts\u0000 DC\u0007\u000B\tfront\uFFFE panel");

            String xml = serializer.serialize(instrument);
            Instrument reparsed = parser.parse(xml);

            assertThat(xml).contains("<description>Volts DC\tfront panel</description>");
            assertThat(reparsed.header().description()).isEqualTo("Volts DC\tfront panel");
            assertThat(serializer.serialize(reparsed)).isEqualTo(xml);
            assertThat(appender.list)
                    .filteredOn(event -> event.getLevel() == Level.WARN)
                    .singleElement()
                    .satisfies(event -> assertThat(event.getFormattedMessage()).contains("Dropped 4 character(s)"));
        } finally {
            serializerLogger.detachAppender(appender);
            appender.stop();
        }
    }

    @Test
    void honorsLineEndingAndIndentOptions() {
        Instrument instrument = parser.parse(Fixtures.MINIMAL_DOCUMENT);

        String xml = new MsfSerializer(new SerializerOptions(LineEnding.CRLF, 4)).serialize(instrument);

        assertThat(xml).contains("<instrument>\r\n    <pui>");
        assertThat(xml).contains("\r\n        <functionname>DC Voltage</functionname>\r\n");
        assertThat(xml.replace("\r\n", "")).doesNotContain("\n");
        assertThat(parser.parse(xml)).isEqualTo(instrument);
    }

    @Test
    void writesFunctionsAfterHeaderInListOrder() {
        Instrument instrument = parser.parse(Fixtures.read(Fixtures.FIVE_FUNCTIONS));
        MsfFunction last = instrument.functions().remove(4);
        instrument.functions().add(0, last);

        String xml = serializer.serialize(instrument);

        assertThat(xml.indexOf("<functionname>Frequency</functionname>"))
                .isGreaterThan(xml.indexOf("</header>"))
                .isLessThan(xml.indexOf("<functionname>DC Voltage</functionname>"));
    }

    /**
     * Tag names of the direct children of the first {@code parent} element, repeated children collapsed.
     */
    private static List<String> childrenOf(String xml, String parent) {
        List<String> names = new ArrayList<>();
        int depth = -1;
        for (String line : xml.split("\n")) {
            Matcher matcher = TAG_LINE.matcher(line);
            if (!matcher.find()) {
                continue;
            }
            boolean closing = !matcher.group(1).isEmpty();
            String name = matcher.group(2);
            boolean leaf = line.contains("</" + name + ">") && !closing;
            if (depth == -1) {
                if (!closing && !leaf && name.equals(parent)) {
                    depth = 0;
                }
                continue;
            }
            if (closing) {
                if (depth == 0) {
                    break;
                }
                depth--;
                continue;
            }
            if (depth == 0 && (names.isEmpty() || !names.get(names.size() - 1).equals(name))) {
                names.add(name);
            }
            if (!leaf) {
                depth++;
            }
        }
        return names;
    }
}
