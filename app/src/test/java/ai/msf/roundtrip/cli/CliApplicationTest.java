package ai.msf.roundtrip.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.msf.roundtrip.Fixtures;
import ai.msf.roundtrip.config.ConfigLoader;
import ai.msf.roundtrip.config.EnvironmentReader;
import ai.msf.roundtrip.model.Instrument;
import ai.msf.roundtrip.model.MsfFunction;
import ai.msf.roundtrip.xml.MsfParser;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final int INVALID_INPUT = 2;

    @TempDir
    Path tempDir;

    private Path document;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void writeFixture() throws IOException {
        document = tempDir.resolve("8846A.msf");
        Files.writeString(document, Fixtures.read(Fixtures.FIVE_FUNCTIONS), StandardCharsets.UTF_8);
        out = new StringWriter();
        err = new StringWriter();
    }

    @Test
    void roundtripWritesCanonicalDocumentToStandardOutput() {
        int exitCode = run("roundtrip", document.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo(Fixtures.read(Fixtures.FIVE_FUNCTIONS));
    }

    @Test
    void roundtripWritesOutputFileWithRequestedLineEnding() throws IOException {
        Path output = tempDir.resolve("out.msf");

        int exitCode = run("roundtrip", document.toString(), "--output", output.toString(), "--line-ending", "crlf");

        assertThat(exitCode).isZero();
        String written = Files.readString(output, StandardCharsets.UTF_8);
        assertThat(written).isEqualTo(Fixtures.read(Fixtures.FIVE_FUNCTIONS).replace("\n", "\r\n"));
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void idsListsEveryIdentifierInDocumentOrder() {
        int exitCode = run("ids", document.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).hasSize(58)
                .contains(Fixtures.RESISTANCE_ID)
                .allMatch(line -> line.startsWith("{") && line.endsWith("}"));
    }

    @Test
    void indexReportsFunctionOnLine() {
        int exitCode = run("index", document.toString(), "--line", "257");

        assertThat(exitCode).isZero();
        assertThat(out.toString().strip()).isEqualTo("257:4\tResistance");
    }

    @Test
    void indexFailsForLineWithoutFunctionName() {
        int exitCode = run("index", document.toString(), "--line", "3");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("No function name on line 3");
    }

    @Test
    void indexFiltersByName() {
        int exitCode = run("index", document.toString(), "--search", "VOLT");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("41:4\tDC Voltage", "190:4\tAC Voltage");
    }

    @Test
    void pagesSpreadsKnownPageCountAcrossFunctions() {
        int exitCode = run("pages", document.toString(), "--total-pages", "50");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines())
                .extracting(line -> line.split("\t")[2])
                .containsExactly("1", "11", "21", "31", "41");
    }

    @Test
    void addFunctionAppendsBuiltInTemplate() throws IOException {
        Path output = tempDir.resolve("added.msf");

        int exitCode = run("add-function", document.toString(), "--template", "voltage-dc", "--output", output.toString());

        assertThat(exitCode).isZero();
        Instrument instrument = new MsfParser().parse(Files.readString(output, StandardCharsets.UTF_8));
        assertThat(instrument.functions()).hasSize(6);
        assertThat(instrument.functions().get(5).functionName()).isEqualTo("Voltage, DC");
        assertThat(instrument.functions().get(5).sequence()).isEqualTo(5);
    }

    @Test
    void addFunctionRejectsUnknownTemplate() {
        int exitCode = run("add-function", document.toString(), "--template", "capacitance");

        assertThat(exitCode).isEqualTo(INVALID_INPUT);
        assertThat(err.toString()).contains("capacitance", "voltage-dc");
    }

    @Test
    void deleteFunctionRemovesSubtreeAndResequences() throws IOException {
        Path output = tempDir.resolve("deleted.msf");

        int exitCode = run("delete-function", document.toString(), "--function-id", Fixtures.RESISTANCE_ID,
                "--output", output.toString());

        assertThat(exitCode).isZero();
        Instrument instrument = new MsfParser().parse(Files.readString(output, StandardCharsets.UTF_8));
        assertThat(instrument.functions()).extracting(MsfFunction::functionName)
                .containsExactly("DC Voltage", "AC Voltage", "DC Current", "Frequency");
        assertThat(instrument.functions()).extracting(MsfFunction::sequence).containsExactly(0, 1, 2, 3);
    }

    @Test
    void deleteFunctionFailsForUnknownIdentifier() throws IOException {
        Path output = tempDir.resolve("untouched.msf");

        int exitCode = run("delete-function", document.toString(), "--function-id",
                "{00000000-0000-0000-0000-0000000000FF}", "--output", output.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void deleteFunctionRequiresIdentifier() {
        assertThat(run("delete-function", document.toString())).isEqualTo(INVALID_INPUT);
        assertThat(err.toString()).contains("--function-id");
    }

    @Test
    void reportsMalformedDocumentWithoutStackTrace() throws IOException {
        Path broken = tempDir.resolve("broken.msf");
        Files.writeString(broken, "<device></device>", StandardCharsets.UTF_8);

        int exitCode = run("ids", broken.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Invalid MSF document", "found <device>").doesNotContain("\tat ");
    }

    @Test
    void reportsMissingDocument() {
        int exitCode = run("ids", tempDir.resolve("missing.msf").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("missing.msf");
    }

    @Test
    void rejectsUnknownCommand() {
        int exitCode = run("compile", document.toString());

        assertThat(exitCode).isEqualTo(INVALID_INPUT);
        assertThat(err.toString()).contains("compile");
    }

    @Test
    void rejectsInvalidConfiguration() {
        EnvironmentReader env = key -> key.equals("MSF_INDENT_WIDTH") ? Optional.of("wide") : Optional.empty();
        CliApplication application = new CliApplication(new ConfigLoader(env), new PrintWriter(out), new PrintWriter(err));

        int exitCode = application.run(new String[] {"roundtrip", document.toString()});

        assertThat(exitCode).isEqualTo(INVALID_INPUT);
        assertThat(err.toString()).contains("MSF_INDENT_WIDTH");
    }

    private int run(String... args) {
        PrintWriter outWriter = new PrintWriter(out, true);
        PrintWriter errWriter = new PrintWriter(err, true);
        int exitCode = new CliApplication(new ConfigLoader(key -> Optional.empty()), outWriter, errWriter).run(args);
        outWriter.flush();
        errWriter.flush();
        return exitCode;
    }
}
