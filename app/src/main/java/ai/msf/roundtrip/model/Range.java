package ai.msf.roundtrip.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A range of a function: exactly one parameter followed by its specifications.
 */
public class Range extends MsfEntity {

    private String rangeName = "";
    private String rangeId = "";
    private String properties = "";
    private boolean autoAssign;
    private String noteIdList = "";
    private Parameter parameter;
    private final List<Specification> specifications = new ArrayList<>();

    public Range(String primaryId, String secondaryId, Parameter parameter) {
        super(primaryId, secondaryId);
        this.parameter = Objects.requireNonNull(parameter, "parameter");
    }

    public String rangeName() {
        return rangeName;
    }

    public void setRangeName(String rangeName) {
        this.rangeName = textOrEmpty(rangeName);
    }

    public String rangeId() {
        return rangeId;
    }

    public void setRangeId(String rangeId) {
        this.rangeId = textOrEmpty(rangeId);
    }

    public String properties() {
        return properties;
    }

    public void setProperties(String properties) {
        this.properties = textOrEmpty(properties);
    }

    public boolean autoAssign() {
        return autoAssign;
    }

    public void setAutoAssign(boolean autoAssign) {
        this.autoAssign = autoAssign;
    }

    public String noteIdList() {
        return noteIdList;
    }

    public void setNoteIdList(String noteIdList) {
        this.noteIdList = textOrEmpty(noteIdList);
    }

    public Parameter parameter() {
        return parameter;
    }

    public void setParameter(Parameter parameter) {
        this.parameter = Objects.requireNonNull(parameter, "parameter");
    }

    /**
     * Live, mutable list of specifications in document order.
     */
    public List<Specification> specifications() {
        return specifications;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Range other)) {
            return false;
        }
        return sameEntityState(other)
                && rangeName.equals(other.rangeName)
                && rangeId.equals(other.rangeId)
                && properties.equals(other.properties)
                && autoAssign == other.autoAssign
                && noteIdList.equals(other.noteIdList)
                && parameter.equals(other.parameter)
                && specifications.equals(other.specifications);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityStateHash(), rangeName, rangeId, properties, autoAssign, noteIdList, parameter,
                specifications);
    }

    @Override
    public String toString() {
        return "Range{" + sequence() + ": " + rangeName + '}';
    }
}
