package ai.msf.roundtrip.lineindex;

/**
 * Maps raw document lines to named entities without building a document tree.
 */
public interface LineIndexer {

    LineIndex buildLineIndex(String text);
}
