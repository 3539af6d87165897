package ai.msf.roundtrip.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.msf.roundtrip.cli.CliArguments;
import ai.msf.roundtrip.xml.LineEnding;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void appliesDefaultsWhenNothingIsSet() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "roundtrip", "a.msf");

        EngineConfig config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.serializerOptions().lineEnding()).isEqualTo(LineEnding.LF);
        assertThat(config.serializerOptions().indentWidth()).isEqualTo(2);
        assertThat(config.pagesPerFunction()).isEqualTo(3);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> env = Map.of(
                ConfigLoader.ENV_LOG_FORMAT, "json",
                ConfigLoader.ENV_LINE_ENDING, "crlf",
                ConfigLoader.ENV_INDENT_WIDTH, " 4 ",
                ConfigLoader.ENV_PAGES_PER_FUNCTION, "5");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "ids", "a.msf");

        EngineConfig config = new ConfigLoader(key -> Optional.ofNullable(env.get(key))).load(cliArguments);

        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.serializerOptions().lineEnding()).isEqualTo(LineEnding.CRLF);
        assertThat(config.serializerOptions().indentWidth()).isEqualTo(4);
        assertThat(config.pagesPerFunction()).isEqualTo(5);
    }

    @Test
    void cliValuesOverrideEnvironment() {
        Map<String, String> env = Map.of(
                ConfigLoader.ENV_LOG_FORMAT, "json",
                ConfigLoader.ENV_LINE_ENDING, "crlf");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--log-format", "text", "--line-ending", "lf", "roundtrip", "a.msf");

        EngineConfig config = new ConfigLoader(key -> Optional.ofNullable(env.get(key))).load(cliArguments);

        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.serializerOptions().lineEnding()).isEqualTo(LineEnding.LF);
    }

    @Test
    void rejectsInvalidEnvironmentValuesNamingTheSetting() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "ids", "a.msf");

        assertThatThrownBy(() -> new ConfigLoader(env(ConfigLoader.ENV_INDENT_WIDTH, "wide")).load(cliArguments))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_INDENT_WIDTH);
        assertThatThrownBy(() -> new ConfigLoader(env(ConfigLoader.ENV_INDENT_WIDTH, "12")).load(cliArguments))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_INDENT_WIDTH);
        assertThatThrownBy(() -> new ConfigLoader(env(ConfigLoader.ENV_PAGES_PER_FUNCTION, "0")).load(cliArguments))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_PAGES_PER_FUNCTION);
        assertThatThrownBy(() -> new ConfigLoader(env(ConfigLoader.ENV_LINE_ENDING, "cr")).load(cliArguments))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_LINE_ENDING);
        assertThatThrownBy(() -> new ConfigLoader(env(ConfigLoader.ENV_LOG_FORMAT, "xml")).load(cliArguments))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_LOG_FORMAT);
    }

    @Test
    void blankEnvironmentValuesAreIgnored() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "ids", "a.msf");

        EngineConfig config = new ConfigLoader(key -> Optional.of("  ")).load(cliArguments);

        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.pagesPerFunction()).isEqualTo(3);
    }

    private static EnvironmentReader env(String key, String value) {
        return requested -> requested.equals(key) ? Optional.of(value) : Optional.empty();
    }
}
