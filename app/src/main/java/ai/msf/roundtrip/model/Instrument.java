package ai.msf.roundtrip.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root of an MSF document: file-level audit state, the header and the ordered functions.
 */
public class Instrument extends MsfEntity {

    private String fileNotes = "";
    private String fileHistory = "";
    private Header header;
    private final List<MsfFunction> functions = new ArrayList<>();

    public Instrument(String primaryId, String secondaryId, Header header) {
        super(primaryId, secondaryId);
        this.header = Objects.requireNonNull(header, "header");
    }

    public String fileNotes() {
        return fileNotes;
    }

    public void setFileNotes(String fileNotes) {
        this.fileNotes = textOrEmpty(fileNotes);
    }

    public String fileHistory() {
        return fileHistory;
    }

    public void setFileHistory(String fileHistory) {
        this.fileHistory = textOrEmpty(fileHistory);
    }

    public Header header() {
        return header;
    }

    public void setHeader(Header header) {
        this.header = Objects.requireNonNull(header, "header");
    }

    /**
     * Live, mutable list of functions in document order.
     */
    public List<MsfFunction> functions() {
        return functions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Instrument other)) {
            return false;
        }
        return sameEntityState(other)
                && fileNotes.equals(other.fileNotes)
                && fileHistory.equals(other.fileHistory)
                && header.equals(other.header)
                && functions.equals(other.functions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityStateHash(), fileNotes, fileHistory, header, functions);
    }

    @Override
    public String toString() {
        return "Instrument{" + primaryId() + ", functions=" + functions.size() + '}';
    }
}
