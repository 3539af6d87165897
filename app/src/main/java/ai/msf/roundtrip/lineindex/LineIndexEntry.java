package ai.msf.roundtrip.lineindex;

import java.util.Objects;

/**
 * A named entity found on a line: 1-based line number and 0-based column of its opening tag.
 */
public record LineIndexEntry(String name, int lineNumber, int columnStart) {

    public LineIndexEntry {
        Objects.requireNonNull(name, "name");
        if (lineNumber < 1 || columnStart < 0) {
            throw new IllegalArgumentException("Invalid line index position");
        }
    }
}
