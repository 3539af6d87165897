package ai.msf.roundtrip.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * The measured quantity of a range: limits, unit and polarity.
 */
public class Parameter extends MsfEntity {

    private BigDecimal lowerLimit = BigDecimal.ZERO;
    private BigDecimal upperLimit = BigDecimal.ZERO;
    private String unitOfMeasure = "";
    private String unitSymbol = "";
    private boolean bipolar;
    private String noteIdList = "";
    private String paramName = "";

    public Parameter(String primaryId, String secondaryId) {
        super(primaryId, secondaryId);
    }

    public BigDecimal lowerLimit() {
        return lowerLimit;
    }

    public void setLowerLimit(BigDecimal lowerLimit) {
        this.lowerLimit = Objects.requireNonNull(lowerLimit, "lowerLimit");
    }

    public BigDecimal upperLimit() {
        return upperLimit;
    }

    public void setUpperLimit(BigDecimal upperLimit) {
        this.upperLimit = Objects.requireNonNull(upperLimit, "upperLimit");
    }

    public String unitOfMeasure() {
        return unitOfMeasure;
    }

    public void setUnitOfMeasure(String unitOfMeasure) {
        this.unitOfMeasure = textOrEmpty(unitOfMeasure);
    }

    public String unitSymbol() {
        return unitSymbol;
    }

    public void setUnitSymbol(String unitSymbol) {
        this.unitSymbol = textOrEmpty(unitSymbol);
    }

    public boolean bipolar() {
        return bipolar;
    }

    public void setBipolar(boolean bipolar) {
        this.bipolar = bipolar;
    }

    public String noteIdList() {
        return noteIdList;
    }

    public void setNoteIdList(String noteIdList) {
        this.noteIdList = textOrEmpty(noteIdList);
    }

    public String paramName() {
        return paramName;
    }

    public void setParamName(String paramName) {
        this.paramName = textOrEmpty(paramName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Parameter other)) {
            return false;
        }
        return sameEntityState(other)
                && lowerLimit.equals(other.lowerLimit)
                && upperLimit.equals(other.upperLimit)
                && unitOfMeasure.equals(other.unitOfMeasure)
                && unitSymbol.equals(other.unitSymbol)
                && bipolar == other.bipolar
                && noteIdList.equals(other.noteIdList)
                && paramName.equals(other.paramName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityStateHash(), lowerLimit, upperLimit, unitOfMeasure, unitSymbol, bipolar, noteIdList,
                paramName);
    }

    @Override
    public String toString() {
        return "Parameter{" + lowerLimit.toPlainString() + ".." + upperLimit.toPlainString() + ' ' + unitSymbol + '}';
    }
}
