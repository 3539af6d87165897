package ai.msf.roundtrip;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Test documents shared across packages.
 */
public final class Fixtures {

    public static final String FIVE_FUNCTIONS = "five-functions.msf";

    /** Primary identifiers of the five functions in {@link #FIVE_FUNCTIONS}, in document order. */
    public static final String DC_VOLTAGE_ID = "{3672FFD5-A9BB-54B1-A82C-8E8A91FB2602}";
    public static final String AC_VOLTAGE_ID = "{82A52739-5AB6-5243-B02A-E5C7BFADA5D4}";
    public static final String RESISTANCE_ID = "{D8E9F608-E7C9-5803-9243-67DB2621963C}";
    public static final String DC_CURRENT_ID = "{7531D75E-74F0-55F7-BC72-4205571C9B28}";
    public static final String FREQUENCY_ID = "{1E9E4653-6A91-5CC3-BA0D-6CD195F50AB1}";

    public static final String INSTRUMENT_ID = "{00000000-0000-0000-0000-000000000001}";
    public static final String FUNCTION_ID = "{00000000-0000-0000-0000-000000000003}";

    /**
     * One function with one range, one parameter and one specification, every collection written as a single
     * element.
     */
    public static final String MINIMAL_DOCUMENT = """
            <?xml version="1.0" encoding="UTF-8"?>
            <instrument>
              <pui>{00000000-0000-0000-0000-000000000001}</pui>
              <dui>{00000000-0000-0000-0000-000000000002}</dui>
              <verified>-1</verified>
              <review>0</review>
              <header>
                <pui>{00000000-0000-0000-0000-000000000010}</pui>
                <dui>{00000000-0000-0000-0000-000000000011}</dui>
                <model>34401A</model>
                <manufacturer>Keysight</manufacturer>
                <revision>2</revision>
                <isactive>-1</isactive>
              </header>
              <function>
                <pui>{00000000-0000-0000-0000-000000000003}</pui>
                <dui>{00000000-0000-0000-0000-000000000004}</dui>
                <sequence>0</sequence>
                <functionname>DC Voltage</functionname>
                <modifier></modifier>
                <isoutput>0</isoutput>
                <range>
                  <pui>{00000000-0000-0000-0000-000000000005}</pui>
                  <dui>{00000000-0000-0000-0000-000000000006}</dui>
                  <sequence>0</sequence>
                  <rangename>10 V</rangename>
                  <autoassign>-1</autoassign>
                  <parameter>
                    <pui>{00000000-0000-0000-0000-000000000007}</pui>
                    <dui>{00000000-0000-0000-0000-000000000008}</dui>
                    <lowerlimit>-10</lowerlimit>
                    <upperlimit>10.000</upperlimit>
                    <isbipolar>-1</isbipolar>
                  </parameter>
                  <specification>
                    <pui>{00000000-0000-0000-0000-000000000009}</pui>
                    <dui>{00000000-0000-0000-0000-00000000000A}</dui>
                    <sequence>0</sequence>
                    <calinterval>365</calinterval>
                    <iv_pct>0.0035</iv_pct>
                    <operand>PlusMinus</operand>
                  </specification>
                </range>
              </function>
            </instrument>
            """;

    private Fixtures() {
    }

    public static String read(String name) {
        try (InputStream input = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (input == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
