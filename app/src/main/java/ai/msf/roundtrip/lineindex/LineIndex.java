package ai.msf.roundtrip.lineindex;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Entries ordered by line number, as produced by a single forward scan.
 */
public record LineIndex(int totalLines, List<LineIndexEntry> entries) {

    public LineIndex {
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    }

    public static LineIndex empty() {
        return new LineIndex(0, List.of());
    }

    /**
     * Binary search for the entry declared on {@code lineNumber}.
     */
    public Optional<LineIndexEntry> findByLine(int lineNumber) {
        int low = 0;
        int high = entries.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            LineIndexEntry current = entries.get(mid);
            if (current.lineNumber() == lineNumber) {
                return Optional.of(current);
            }
            if (current.lineNumber() < lineNumber) {
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return Optional.empty();
    }

    public boolean isIndexedLine(int lineNumber) {
        return findByLine(lineNumber).isPresent();
    }

    /**
     * Case-insensitive substring filter on entry names. A blank term matches everything.
     */
    public List<LineIndexEntry> searchByName(String term) {
        if (term == null || term.isBlank()) {
            return entries;
        }
        String needle = term.trim().toLowerCase(Locale.ROOT);
        return entries.stream()
                .filter(entry -> entry.name().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }
}
