package ai.msf.roundtrip.template;

import java.util.List;
import java.util.Objects;

/**
 * Identity-free blueprint of a range, its parameter and its specifications.
 */
public record RangeTemplate(
        String rangeName,
        String rangeId,
        String properties,
        boolean autoAssign,
        ParameterTemplate parameter,
        List<SpecificationTemplate> specifications
) {

    public RangeTemplate {
        rangeName = rangeName == null ? "" : rangeName;
        rangeId = rangeId == null ? "" : rangeId;
        properties = properties == null ? "" : properties;
        Objects.requireNonNull(parameter, "parameter");
        specifications = specifications == null ? List.of() : List.copyOf(specifications);
    }
}
