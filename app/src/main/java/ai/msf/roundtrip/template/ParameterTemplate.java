package ai.msf.roundtrip.template;

import java.math.BigDecimal;
import java.util.Objects;

public record ParameterTemplate(
        BigDecimal lowerLimit,
        BigDecimal upperLimit,
        String unitOfMeasure,
        String unitSymbol,
        boolean bipolar,
        String paramName
) {

    public ParameterTemplate {
        Objects.requireNonNull(lowerLimit, "lowerLimit");
        Objects.requireNonNull(upperLimit, "upperLimit");
        unitOfMeasure = unitOfMeasure == null ? "" : unitOfMeasure;
        unitSymbol = unitSymbol == null ? "" : unitSymbol;
        paramName = paramName == null ? "" : paramName;
    }
}
