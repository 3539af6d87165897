package ai.msf.roundtrip.xml;

import java.util.Objects;

/**
 * Layout of serialized documents.
 */
public record SerializerOptions(LineEnding lineEnding, int indentWidth) {

    public static final int DEFAULT_INDENT_WIDTH = 2;
    static final int MAX_INDENT_WIDTH = 8;

    public SerializerOptions {
        Objects.requireNonNull(lineEnding, "lineEnding");
        if (indentWidth < 0 || indentWidth > MAX_INDENT_WIDTH) {
            throw new IllegalArgumentException("indentWidth must be between 0 and " + MAX_INDENT_WIDTH);
        }
    }

    public static SerializerOptions defaults() {
        return new SerializerOptions(LineEnding.LF, DEFAULT_INDENT_WIDTH);
    }
}
