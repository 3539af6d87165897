package ai.msf.roundtrip.xml;

/**
 * Line terminator written between serialized elements.
 */
public enum LineEnding {
    LF("\n"),
    CRLF("\r\n");

    private final String separator;

    LineEnding(String separator) {
        this.separator = separator;
    }

    public String separator() {
        return separator;
    }

    public static LineEnding from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Line ending must be provided");
        }
        for (LineEnding lineEnding : values()) {
            if (lineEnding.name().equalsIgnoreCase(raw.trim())) {
                return lineEnding;
            }
        }
        throw new IllegalArgumentException("Unsupported line ending: " + raw + " (expected lf or crlf)");
    }
}
