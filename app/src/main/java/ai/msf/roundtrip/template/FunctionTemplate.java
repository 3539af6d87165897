package ai.msf.roundtrip.template;

import java.util.List;
import java.util.Optional;

/**
 * Identity-free blueprint of a function and its whole range hierarchy.
 */
public record FunctionTemplate(
        String functionName,
        Optional<String> modifier,
        String properties,
        String format,
        boolean output,
        List<RangeTemplate> ranges
) {

    public FunctionTemplate {
        functionName = functionName == null ? "" : functionName;
        modifier = modifier == null ? Optional.empty() : modifier;
        properties = properties == null ? "" : properties;
        format = format == null ? "" : format;
        ranges = ranges == null ? List.of() : List.copyOf(ranges);
    }
}
