package ai.msf.roundtrip.template;

import java.math.BigDecimal;
import java.util.Objects;

public record SpecificationTemplate(
        int calInterval,
        String specialCal,
        String assetNum,
        String specType,
        String unitOfMeasure,
        String unitSymbol,
        BigDecimal fullScale,
        BigDecimal ivPct,
        BigDecimal ivPctHi,
        BigDecimal ivPpm,
        BigDecimal fsPct,
        BigDecimal fsPctHi,
        BigDecimal fsPpm,
        BigDecimal floor,
        BigDecimal floorHi,
        BigDecimal db,
        int dbType,
        String calcDescription,
        String calcString,
        String operand
) {

    public SpecificationTemplate {
        specialCal = specialCal == null ? "" : specialCal;
        assetNum = assetNum == null ? "" : assetNum;
        specType = specType == null ? "" : specType;
        unitOfMeasure = unitOfMeasure == null ? "" : unitOfMeasure;
        unitSymbol = unitSymbol == null ? "" : unitSymbol;
        Objects.requireNonNull(fullScale, "fullScale");
        Objects.requireNonNull(ivPct, "ivPct");
        Objects.requireNonNull(ivPctHi, "ivPctHi");
        Objects.requireNonNull(ivPpm, "ivPpm");
        Objects.requireNonNull(fsPct, "fsPct");
        Objects.requireNonNull(fsPctHi, "fsPctHi");
        Objects.requireNonNull(fsPpm, "fsPpm");
        Objects.requireNonNull(floor, "floor");
        Objects.requireNonNull(floorHi, "floorHi");
        Objects.requireNonNull(db, "db");
        calcDescription = calcDescription == null ? "" : calcDescription;
        calcString = calcString == null ? "" : calcString;
        operand = operand == null ? "" : operand;
    }
}
