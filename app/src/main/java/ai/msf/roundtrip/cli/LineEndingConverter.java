package ai.msf.roundtrip.cli;

import ai.msf.roundtrip.xml.LineEnding;
import picocli.CommandLine;

public class LineEndingConverter implements CommandLine.ITypeConverter<LineEnding> {

    @Override
    public LineEnding convert(String value) {
        return LineEnding.from(value);
    }
}
