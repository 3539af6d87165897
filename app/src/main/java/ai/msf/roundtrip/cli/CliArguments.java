package ai.msf.roundtrip.cli;

import ai.msf.roundtrip.config.LogFormat;
import ai.msf.roundtrip.xml.LineEnding;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "msf-roundtrip", mixinStandardHelpOptions = true,
        description = "Parse, inspect and rewrite MSF instrument documents")
public class CliArguments {

    @CommandLine.Parameters(index = "0", converter = CliCommandConverter.class, paramLabel = "COMMAND",
            description = "roundtrip, ids, index, pages, add-function or delete-function")
    private CliCommand command;

    @CommandLine.Parameters(index = "1", paramLabel = "DOCUMENT", description = "MSF document to read")
    private Path document;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "FILE",
            description = "Where rewritten documents go (default: standard output)")
    private Path output;

    @CommandLine.Option(names = "--line", paramLabel = "LINE", description = "Report the function name on this 1-based line")
    private Integer line;

    @CommandLine.Option(names = "--search", paramLabel = "TERM", description = "Case-insensitive function name filter")
    private String search;

    @CommandLine.Option(names = "--template", paramLabel = "KEY", description = "Built-in function template to add")
    private String template;

    @CommandLine.Option(names = "--function-id", paramLabel = "ID", description = "Primary identifier of the target function")
    private String functionId;

    @CommandLine.Option(names = "--total-pages", paramLabel = "COUNT", description = "Page count of the source PDF, if known")
    private Integer totalPages;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--line-ending", description = "Line ending of written documents: lf or crlf",
            converter = LineEndingConverter.class)
    private LineEnding lineEnding;

    public CliCommand command() {
        return command;
    }

    public Path document() {
        return document;
    }

    public Path output() {
        return output;
    }

    public Integer line() {
        return line;
    }

    public String search() {
        return search;
    }

    public String template() {
        return template;
    }

    public String functionId() {
        return functionId;
    }

    public Integer totalPages() {
        return totalPages;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public LineEnding lineEnding() {
        return lineEnding;
    }
}
