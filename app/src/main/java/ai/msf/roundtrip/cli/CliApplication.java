package ai.msf.roundtrip.cli;

import ai.msf.roundtrip.config.ConfigLoader;
import ai.msf.roundtrip.config.EngineConfig;
import ai.msf.roundtrip.config.SystemEnvironmentReader;
import ai.msf.roundtrip.edit.DocumentEditor;
import ai.msf.roundtrip.lineindex.FunctionNameLineIndexer;
import ai.msf.roundtrip.lineindex.LineIndex;
import ai.msf.roundtrip.lineindex.LineIndexEntry;
import ai.msf.roundtrip.logging.LoggingConfigurator;
import ai.msf.roundtrip.logging.SimpleJsonLayout;
import ai.msf.roundtrip.model.Instrument;
import ai.msf.roundtrip.model.MsfFunction;
import ai.msf.roundtrip.pages.InMemoryKeyValueStorage;
import ai.msf.roundtrip.pages.PageMappingIndex;
import ai.msf.roundtrip.template.BuiltInTemplates;
import ai.msf.roundtrip.template.FunctionTemplate;
import ai.msf.roundtrip.xml.IdentifierExtractor;
import ai.msf.roundtrip.xml.MsfFormatException;
import ai.msf.roundtrip.xml.MsfParser;
import ai.msf.roundtrip.xml.MsfSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and document engine.
 *
 * <p>Command output goes to standard output; diagnostics go to standard error and the log.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);
        int invalidInput = commandLine.getCommandSpec().exitCodeOnInvalidInput();

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return invalidInput;
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        EngineConfig config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            err.println("Invalid configuration: " + ex.getMessage());
            return invalidInput;
        }
        LoggingConfigurator.configure(config.logFormat());

        Path document = cliArguments.document();
        MDC.put(SimpleJsonLayout.DOCUMENT_KEY, document.toString());
        try {
            String text = Files.readString(document, StandardCharsets.UTF_8);
            LOGGER.debug("Running {} on {} ({} chars)", cliArguments.command().label(), document, text.length());
            return switch (cliArguments.command()) {
                case ROUNDTRIP -> writeDocument(parse(text), cliArguments, config);
                case IDS -> printIdentifiers(parse(text));
                case INDEX -> printLineIndex(text, cliArguments);
                case PAGES -> printPages(parse(text), cliArguments, config);
                case ADD_FUNCTION -> addFunction(parse(text), cliArguments, config, invalidInput);
                case DELETE_FUNCTION -> deleteFunction(parse(text), cliArguments, config, invalidInput);
            };
        } catch (MsfFormatException ex) {
            LOGGER.debug("Rejected document {}", document, ex);
            err.println("Invalid MSF document " + document + ": " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            LOGGER.debug("I/O failure on {}", document, ex);
            err.println("Cannot access " + ex.getMessage());
            return EXIT_FAILURE;
        } finally {
            MDC.remove(SimpleJsonLayout.DOCUMENT_KEY);
        }
    }

    private static Instrument parse(String text) {
        return new MsfParser().parse(text);
    }

    private int writeDocument(Instrument instrument, CliArguments arguments, EngineConfig config) throws IOException {
        String xml = new MsfSerializer(config.serializerOptions()).serialize(instrument);
        Path output = arguments.output();
        if (output == null) {
            out.print(xml);
            out.flush();
        } else {
            Files.writeString(output, xml, StandardCharsets.UTF_8);
            LOGGER.info("Wrote {} functions to {}", instrument.functions().size(), output);
        }
        return EXIT_OK;
    }

    private int printIdentifiers(Instrument instrument) {
        List<String> identifiers = IdentifierExtractor.extractAllIdentifiers(instrument);
        identifiers.forEach(out::println);
        out.flush();
        return EXIT_OK;
    }

    private int printLineIndex(String text, CliArguments arguments) {
        LineIndex index = new FunctionNameLineIndexer().buildLineIndex(text);
        if (arguments.line() != null) {
            Optional<LineIndexEntry> entry = index.findByLine(arguments.line());
            if (entry.isEmpty()) {
                err.println("No function name on line " + arguments.line());
                return EXIT_FAILURE;
            }
            printEntry(entry.get());
        } else {
            index.searchByName(arguments.search()).forEach(this::printEntry);
        }
        out.flush();
        return EXIT_OK;
    }

    private void printEntry(LineIndexEntry entry) {
        out.println(entry.lineNumber() + ":" + entry.columnStart() + "\t" + entry.name());
    }

    private int printPages(Instrument instrument, CliArguments arguments, EngineConfig config) {
        PageMappingIndex pages = new PageMappingIndex(new InMemoryKeyValueStorage(), new ObjectMapper(),
                config.pagesPerFunction());
        int totalPages = arguments.totalPages() == null ? 0 : arguments.totalPages();
        List<MsfFunction> functions = instrument.functions();
        for (MsfFunction function : functions) {
            int page = pages.resolvePageNumber(function.primaryId(), function.sequence(), functions.size(), totalPages);
            out.println(function.sequence() + "\t" + function.primaryId() + "\t" + page + "\t" + function.functionName());
        }
        out.flush();
        return EXIT_OK;
    }

    private int addFunction(Instrument instrument, CliArguments arguments, EngineConfig config, int invalidInput)
            throws IOException {
        Optional<FunctionTemplate> template = Optional.ofNullable(arguments.template()).flatMap(BuiltInTemplates::find);
        if (template.isEmpty()) {
            err.println("Unknown template '" + arguments.template() + "', expected one of "
                    + String.join(", ", BuiltInTemplates.keys()));
            return invalidInput;
        }
        MsfFunction added = new DocumentEditor().addFunction(instrument, template.get());
        LOGGER.info("Added function {} from template {}", added.primaryId(), arguments.template());
        return writeDocument(instrument, arguments, config);
    }

    private int deleteFunction(Instrument instrument, CliArguments arguments, EngineConfig config, int invalidInput)
            throws IOException {
        if (arguments.functionId() == null || arguments.functionId().isBlank()) {
            err.println("--function-id is required for " + arguments.command().label());
            return invalidInput;
        }
        Optional<MsfFunction> removed = new DocumentEditor().deleteFunction(instrument, arguments.functionId());
        if (removed.isEmpty()) {
            err.println("No function with identifier " + arguments.functionId());
            return EXIT_FAILURE;
        }
        LOGGER.info("Deleted function {} with {} ranges", arguments.functionId(), removed.get().ranges().size());
        return writeDocument(instrument, arguments, config);
    }
}
