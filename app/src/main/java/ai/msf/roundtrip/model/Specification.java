package ai.msf.roundtrip.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One accuracy specification of a range.
 *
 * <p>The percentage, ppm, floor and dB terms are kept as {@link BigDecimal} so the textual scale read from a
 * document is written back unchanged.
 */
public class Specification extends MsfEntity {

    private int calInterval;
    private String specialCal = "";
    private String assetNum = "";
    private String specType = "";
    private String unitOfMeasure = "";
    private String unitSymbol = "";
    private BigDecimal fullScale = BigDecimal.ZERO;
    private BigDecimal ivPct = BigDecimal.ZERO;
    private BigDecimal ivPctHi = BigDecimal.ZERO;
    private BigDecimal ivPpm = BigDecimal.ZERO;
    private BigDecimal fsPct = BigDecimal.ZERO;
    private BigDecimal fsPctHi = BigDecimal.ZERO;
    private BigDecimal fsPpm = BigDecimal.ZERO;
    private BigDecimal floor = BigDecimal.ZERO;
    private BigDecimal floorHi = BigDecimal.ZERO;
    private BigDecimal db = BigDecimal.ZERO;
    private int dbType;
    private String calcDescription = "";
    private String calcString = "";
    private String operand = "";
    private String noteIdList = "";

    public Specification(String primaryId, String secondaryId) {
        super(primaryId, secondaryId);
    }

    public int calInterval() {
        return calInterval;
    }

    public void setCalInterval(int calInterval) {
        this.calInterval = calInterval;
    }

    public String specialCal() {
        return specialCal;
    }

    public void setSpecialCal(String specialCal) {
        this.specialCal = textOrEmpty(specialCal);
    }

    public String assetNum() {
        return assetNum;
    }

    public void setAssetNum(String assetNum) {
        this.assetNum = textOrEmpty(assetNum);
    }

    public String specType() {
        return specType;
    }

    public void setSpecType(String specType) {
        this.specType = textOrEmpty(specType);
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

    public BigDecimal fullScale() {
        return fullScale;
    }

    public void setFullScale(BigDecimal fullScale) {
        this.fullScale = Objects.requireNonNull(fullScale, "fullScale");
    }

    public BigDecimal ivPct() {
        return ivPct;
    }

    public void setIvPct(BigDecimal ivPct) {
        this.ivPct = Objects.requireNonNull(ivPct, "ivPct");
    }

    public BigDecimal ivPctHi() {
        return ivPctHi;
    }

    public void setIvPctHi(BigDecimal ivPctHi) {
        this.ivPctHi = Objects.requireNonNull(ivPctHi, "ivPctHi");
    }

    public BigDecimal ivPpm() {
        return ivPpm;
    }

    public void setIvPpm(BigDecimal ivPpm) {
        this.ivPpm = Objects.requireNonNull(ivPpm, "ivPpm");
    }

    public BigDecimal fsPct() {
        return fsPct;
    }

    public void setFsPct(BigDecimal fsPct) {
        this.fsPct = Objects.requireNonNull(fsPct, "fsPct");
    }

    public BigDecimal fsPctHi() {
        return fsPctHi;
    }

    public void setFsPctHi(BigDecimal fsPctHi) {
        this.fsPctHi = Objects.requireNonNull(fsPctHi, "fsPctHi");
    }

    public BigDecimal fsPpm() {
        return fsPpm;
    }

    public void setFsPpm(BigDecimal fsPpm) {
        this.fsPpm = Objects.requireNonNull(fsPpm, "fsPpm");
    }

    public BigDecimal floor() {
        return floor;
    }

    public void setFloor(BigDecimal floor) {
        this.floor = Objects.requireNonNull(floor, "floor");
    }

    public BigDecimal floorHi() {
        return floorHi;
    }

    public void setFloorHi(BigDecimal floorHi) {
        this.floorHi = Objects.requireNonNull(floorHi, "floorHi");
    }

    public BigDecimal db() {
        return db;
    }

    public void setDb(BigDecimal db) {
        this.db = Objects.requireNonNull(db, "db");
    }

    public int dbType() {
        return dbType;
    }

    public void setDbType(int dbType) {
        this.dbType = dbType;
    }

    public String calcDescription() {
        return calcDescription;
    }

    public void setCalcDescription(String calcDescription) {
        this.calcDescription = textOrEmpty(calcDescription);
    }

    public String calcString() {
        return calcString;
    }

    public void setCalcString(String calcString) {
        this.calcString = textOrEmpty(calcString);
    }

    public String operand() {
        return operand;
    }

    public void setOperand(String operand) {
        this.operand = textOrEmpty(operand);
    }

    public String noteIdList() {
        return noteIdList;
    }

    public void setNoteIdList(String noteIdList) {
        this.noteIdList = textOrEmpty(noteIdList);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Specification other)) {
            return false;
        }
        return sameEntityState(other)
                && calInterval == other.calInterval
                && specialCal.equals(other.specialCal)
                && assetNum.equals(other.assetNum)
                && specType.equals(other.specType)
                && unitOfMeasure.equals(other.unitOfMeasure)
                && unitSymbol.equals(other.unitSymbol)
                && fullScale.equals(other.fullScale)
                && ivPct.equals(other.ivPct)
                && ivPctHi.equals(other.ivPctHi)
                && ivPpm.equals(other.ivPpm)
                && fsPct.equals(other.fsPct)
                && fsPctHi.equals(other.fsPctHi)
                && fsPpm.equals(other.fsPpm)
                && floor.equals(other.floor)
                && floorHi.equals(other.floorHi)
                && db.equals(other.db)
                && dbType == other.dbType
                && calcDescription.equals(other.calcDescription)
                && calcString.equals(other.calcString)
                && operand.equals(other.operand)
                && noteIdList.equals(other.noteIdList);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityStateHash(), calInterval, specialCal, assetNum, specType, unitOfMeasure,
                unitSymbol, fullScale, ivPct, ivPctHi, ivPpm, fsPct, fsPctHi, fsPpm, floor, floorHi, db, dbType,
                calcDescription, calcString, operand, noteIdList);
    }

    @Override
    public String toString() {
        return "Specification{" + sequence() + ": " + specType + '}';
    }
}
