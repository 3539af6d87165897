package ai.msf.roundtrip.lineindex;

import java.util.ArrayList;
import java.util.List;

/**
 * Indexes every {@code <functionname>} element of an MSF document by line.
 *
 * <p>One pass over the text with plain {@code indexOf} scans. LF and CRLF endings are both accepted, and an
 * element is only recognized when its open and close tags sit on the same line.
 */
public class FunctionNameLineIndexer implements LineIndexer {

    private static final String OPEN_TAG = "<functionname>";
    private static final String CLOSE_TAG = "</functionname>";

    @Override
    public LineIndex buildLineIndex(String text) {
        if (text == null || text.isEmpty()) {
            return LineIndex.empty();
        }

        List<LineIndexEntry> entries = new ArrayList<>();
        int lineNumber = 1;
        int position = 0;
        int length = text.length();
        int nextOpen = text.indexOf(OPEN_TAG);
        while (position < length) {
            int lineBreak = text.indexOf('\n', position);
            int lineEnd = lineBreak == -1 ? length : lineBreak;
            int contentEnd = lineEnd > position && text.charAt(lineEnd - 1) == '\r' ? lineEnd - 1 : lineEnd;

            if (nextOpen != -1 && nextOpen < position) {
                nextOpen = text.indexOf(OPEN_TAG, position);
            }
            if (nextOpen != -1 && nextOpen < contentEnd) {
                indexLine(text, position, nextOpen, contentEnd, lineNumber, entries);
            }

            if (lineBreak == -1) {
                break;
            }
            position = lineBreak + 1;
            lineNumber++;
        }
        return new LineIndex(lineNumber, entries);
    }

    private void indexLine(String text, int lineStart, int open, int lineEnd, int lineNumber,
                           List<LineIndexEntry> entries) {
        int valueStart = open + OPEN_TAG.length();
        String rest = text.substring(valueStart, lineEnd);
        int close = rest.indexOf(CLOSE_TAG);
        if (close == -1) {
            return;
        }
        String name = decodeEntities(rest.substring(0, close)).trim();
        if (name.isEmpty()) {
            return;
        }
        entries.add(new LineIndexEntry(name, lineNumber, open - lineStart));
    }

    private static String decodeEntities(String raw) {
        if (raw.indexOf('&') == -1) {
            return raw;
        }
        return raw.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }
}
