package ai.msf.roundtrip.cli;

import picocli.CommandLine;

public class CliCommandConverter implements CommandLine.ITypeConverter<CliCommand> {

    @Override
    public CliCommand convert(String value) {
        return CliCommand.from(value);
    }
}
