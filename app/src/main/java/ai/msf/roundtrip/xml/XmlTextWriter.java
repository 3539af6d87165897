package ai.msf.roundtrip.xml;

/**
 * Line-per-element XML writer. Empty values are always written as an open/close pair.
 */
final class XmlTextWriter {

    private static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    private final StringBuilder builder = new StringBuilder(16 * 1024);
    private final String lineSeparator;
    private final String indentUnit;
    private int depth;
    private int droppedCharacters;

    XmlTextWriter(SerializerOptions options) {
        this.lineSeparator = options.lineEnding().separator();
        this.indentUnit = " ".repeat(options.indentWidth());
    }

    void declaration() {
        builder.append(DECLARATION).append(lineSeparator);
    }

    void open(String name) {
        indent();
        builder.append('<').append(name).append('>').append(lineSeparator);
        depth++;
    }

    void close(String name) {
        depth--;
        indent();
        builder.append("</").append(name).append('>').append(lineSeparator);
    }

    void element(String name, String value) {
        indent();
        builder.append('<').append(name).append('>');
        appendEscaped(value);
        builder.append("</").append(name).append('>').append(lineSeparator);
    }

    /** Characters removed from values because XML 1.0 cannot carry them. */
    int droppedCharacters() {
        return droppedCharacters;
    }

    @Override
    public String toString() {
        return builder.toString();
    }

    private void indent() {
        for (int i = 0; i < depth; i++) {
            builder.append(indentUnit);
        }
    }

    private void appendEscaped(String value) {
        if (value == null) {
            return;
        }
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '&' -> builder.append("&amp;");
                case '<' -> builder.append("&lt;");
                case '>' -> builder.append("&gt;");
                // a raw CR would be folded into LF by the next parse
                case '\r' -> builder.append("&#13;");
                default -> {
                    if (isXmlCharacter(ch)) {
                        builder.append(ch);
                    } else {
                        droppedCharacters++;
                    }
                }
            }
        }
    }

    // surrogates pass through; paired ones form valid supplementary characters
    private static boolean isXmlCharacter(char ch) {
        if (ch < 0x20) {
            return ch == '\t' || ch == '\n';
        }
        return ch != 0xFFFE && ch != 0xFFFF;
    }
}
