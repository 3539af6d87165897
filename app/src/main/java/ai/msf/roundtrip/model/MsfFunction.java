package ai.msf.roundtrip.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A measurement function of the instrument (for example "Voltage, DC") and its ranges.
 *
 * <p>{@link #modifier()} is the one text field that tells an explicitly absent value apart from a
 * present one. The expanded flag and review status are view state owned by the editor.
 */
public class MsfFunction extends MsfEntity {

    private String functionName = "";
    private Optional<String> modifier = Optional.empty();
    private String properties = "";
    private String format = "";
    private boolean output;
    private String noteIdList = "";
    private final List<Range> ranges = new ArrayList<>();
    private boolean expanded;
    private ReviewStatus reviewStatus = ReviewStatus.UNREVIEWED;

    public MsfFunction(String primaryId, String secondaryId) {
        super(primaryId, secondaryId);
    }

    public String functionName() {
        return functionName;
    }

    public void setFunctionName(String functionName) {
        this.functionName = textOrEmpty(functionName);
    }

    public Optional<String> modifier() {
        return modifier;
    }

    public void setModifier(Optional<String> modifier) {
        this.modifier = modifier == null ? Optional.empty() : modifier;
    }

    public String properties() {
        return properties;
    }

    public void setProperties(String properties) {
        this.properties = textOrEmpty(properties);
    }

    public String format() {
        return format;
    }

    public void setFormat(String format) {
        this.format = textOrEmpty(format);
    }

    public boolean output() {
        return output;
    }

    public void setOutput(boolean output) {
        this.output = output;
    }

    public String noteIdList() {
        return noteIdList;
    }

    public void setNoteIdList(String noteIdList) {
        this.noteIdList = textOrEmpty(noteIdList);
    }

    /**
     * Live, mutable list of ranges in document order.
     */
    public List<Range> ranges() {
        return ranges;
    }

    public boolean expanded() {
        return expanded;
    }

    public void setExpanded(boolean expanded) {
        this.expanded = expanded;
    }

    public ReviewStatus reviewStatus() {
        return reviewStatus;
    }

    public void setReviewStatus(ReviewStatus reviewStatus) {
        this.reviewStatus = Objects.requireNonNull(reviewStatus, "reviewStatus");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MsfFunction other)) {
            return false;
        }
        return sameEntityState(other)
                && functionName.equals(other.functionName)
                && modifier.equals(other.modifier)
                && properties.equals(other.properties)
                && format.equals(other.format)
                && output == other.output
                && noteIdList.equals(other.noteIdList)
                && ranges.equals(other.ranges)
                && expanded == other.expanded
                && reviewStatus == other.reviewStatus;
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityStateHash(), functionName, modifier, properties, format, output, noteIdList, ranges,
                expanded, reviewStatus);
    }

    @Override
    public String toString() {
        return "MsfFunction{" + sequence() + ": " + functionName + '}';
    }
}
