package ai.msf.roundtrip.template;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named function templates for common instrument functions, usable before any document is loaded.
 */
public final class BuiltInTemplates {

    private static final int DEFAULT_CAL_INTERVAL_DAYS = 365;
    private static final BigDecimal DEFAULT_READING_PCT = new BigDecimal("0.1");

    private static final Map<String, FunctionTemplate> LIBRARY = createLibrary();

    private BuiltInTemplates() {
    }

    public static List<String> keys() {
        return List.copyOf(LIBRARY.keySet());
    }

    public static Optional<FunctionTemplate> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(LIBRARY.get(key.trim()));
    }

    private static Map<String, FunctionTemplate> createLibrary() {
        Map<String, FunctionTemplate> library = new LinkedHashMap<>();
        library.put("voltage-dc", singleRange("Voltage, DC", 100, "volt", "V", true));
        library.put("voltage-ac", singleRange("Voltage, AC", 100, "volt", "V", false));
        library.put("resistance", singleRange("Resistance", 1000, "ohm", "Ω", false));
        library.put("current-dc", singleRange("Current, DC", 10, "ampere", "A", true));
        return Collections.unmodifiableMap(library);
    }

    private static FunctionTemplate singleRange(String functionName, long upperLimit, String unit, String symbol,
                                                boolean bipolar) {
        ParameterTemplate parameter = new ParameterTemplate(BigDecimal.ZERO, BigDecimal.valueOf(upperLimit), unit,
                symbol, bipolar, "");
        SpecificationTemplate accuracy = new SpecificationTemplate(DEFAULT_CAL_INTERVAL_DAYS, "", "", "Accuracy",
                unit, symbol, BigDecimal.ZERO, DEFAULT_READING_PCT, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0, "", "",
                "PlusMinus");
        RangeTemplate range = new RangeTemplate("Default Range", "", "", true, parameter, List.of(accuracy));
        return new FunctionTemplate(functionName, Optional.empty(), "", "", false, List.of(range));
    }
}
