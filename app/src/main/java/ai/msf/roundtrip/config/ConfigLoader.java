package ai.msf.roundtrip.config;

import ai.msf.roundtrip.cli.CliArguments;
import ai.msf.roundtrip.pages.PageMappingIndex;
import ai.msf.roundtrip.xml.LineEnding;
import ai.msf.roundtrip.xml.SerializerOptions;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builds an {@link EngineConfig} by combining CLI arguments with environment variables and defaults.
 * CLI values win over the environment.
 */
public class ConfigLoader {

    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LINE_ENDING = "MSF_LINE_ENDING";
    static final String ENV_INDENT_WIDTH = "MSF_INDENT_WIDTH";
    static final String ENV_PAGES_PER_FUNCTION = "MSF_PAGES_PER_FUNCTION";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public EngineConfig load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        LogFormat logFormat = resolveLogFormat(arguments);
        LineEnding lineEnding = resolveLineEnding(arguments);
        int indentWidth = environmentReader.get(ENV_INDENT_WIDTH)
                .filter(ConfigLoader::isNotBlank)
                .map(raw -> parseInteger(raw, ENV_INDENT_WIDTH))
                .orElse(SerializerOptions.DEFAULT_INDENT_WIDTH);
        int pagesPerFunction = environmentReader.get(ENV_PAGES_PER_FUNCTION)
                .filter(ConfigLoader::isNotBlank)
                .map(raw -> parseInteger(raw, ENV_PAGES_PER_FUNCTION))
                .orElse(PageMappingIndex.DEFAULT_PAGES_PER_FUNCTION);
        if (pagesPerFunction < 1) {
            throw new IllegalArgumentException(ENV_PAGES_PER_FUNCTION + " must be at least 1");
        }
        SerializerOptions serializerOptions;
        try {
            serializerOptions = new SerializerOptions(lineEnding, indentWidth);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(ENV_INDENT_WIDTH + ": " + ex.getMessage(), ex);
        }
        return new EngineConfig(logFormat, serializerOptions, pagesPerFunction);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(raw -> parseSetting(raw, ENV_LOG_FORMAT, LogFormat::from))
                .orElse(LogFormat.TEXT);
    }

    private LineEnding resolveLineEnding(CliArguments arguments) {
        LineEnding cliLineEnding = arguments.lineEnding();
        if (cliLineEnding != null) {
            return cliLineEnding;
        }
        return environmentReader.get(ENV_LINE_ENDING)
                .filter(ConfigLoader::isNotBlank)
                .map(raw -> parseSetting(raw, ENV_LINE_ENDING, LineEnding::from))
                .orElse(LineEnding.LF);
    }

    private static <T> T parseSetting(String raw, String key, Function<String, T> parser) {
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(key + ": " + ex.getMessage(), ex);
        }
    }

    private static int parseInteger(String raw, String key) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
