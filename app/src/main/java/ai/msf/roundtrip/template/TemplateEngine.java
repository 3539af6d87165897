package ai.msf.roundtrip.template;

import ai.msf.roundtrip.id.IdentifierGenerator;
import ai.msf.roundtrip.id.IdentifierService;
import ai.msf.roundtrip.model.MsfFunction;
import ai.msf.roundtrip.model.Parameter;
import ai.msf.roundtrip.model.Range;
import ai.msf.roundtrip.model.ReviewStatus;
import ai.msf.roundtrip.model.Specification;
import java.util.List;
import java.util.Objects;

/**
 * Converts between identity-bearing entities and identity-free templates.
 *
 * <p>Extraction copies content only: identifiers, audit fields and editor view state are dropped.
 * Instantiation mints a new identifier pair for every node it builds and numbers each child collection
 * from zero in template order, so two instances of one template never share an identifier.
 */
public class TemplateEngine {

    private final IdentifierGenerator identifierGenerator;

    public TemplateEngine() {
        this(new IdentifierService());
    }

    public TemplateEngine(IdentifierGenerator identifierGenerator) {
        this.identifierGenerator = Objects.requireNonNull(identifierGenerator, "identifierGenerator");
    }

    public FunctionTemplate extractTemplate(MsfFunction function) {
        Objects.requireNonNull(function, "function");
        List<RangeTemplate> ranges = function.ranges().stream()
                .map(this::extractTemplate)
                .toList();
        return new FunctionTemplate(function.functionName(), function.modifier(), function.properties(),
                function.format(), function.output(), ranges);
    }

    public RangeTemplate extractTemplate(Range range) {
        Objects.requireNonNull(range, "range");
        List<SpecificationTemplate> specifications = range.specifications().stream()
                .map(this::extractTemplate)
                .toList();
        return new RangeTemplate(range.rangeName(), range.rangeId(), range.properties(), range.autoAssign(),
                extractTemplate(range.parameter()), specifications);
    }

    public ParameterTemplate extractTemplate(Parameter parameter) {
        Objects.requireNonNull(parameter, "parameter");
        return new ParameterTemplate(parameter.lowerLimit(), parameter.upperLimit(), parameter.unitOfMeasure(),
                parameter.unitSymbol(), parameter.bipolar(), parameter.paramName());
    }

    public SpecificationTemplate extractTemplate(Specification specification) {
        Objects.requireNonNull(specification, "specification");
        return new SpecificationTemplate(
                specification.calInterval(),
                specification.specialCal(),
                specification.assetNum(),
                specification.specType(),
                specification.unitOfMeasure(),
                specification.unitSymbol(),
                specification.fullScale(),
                specification.ivPct(),
                specification.ivPctHi(),
                specification.ivPpm(),
                specification.fsPct(),
                specification.fsPctHi(),
                specification.fsPpm(),
                specification.floor(),
                specification.floorHi(),
                specification.db(),
                specification.dbType(),
                specification.calcDescription(),
                specification.calcString(),
                specification.operand());
    }

    public MsfFunction instantiate(FunctionTemplate template, int sequence) {
        Objects.requireNonNull(template, "template");
        MsfFunction function = new MsfFunction(identifierGenerator.generate(), identifierGenerator.generate());
        function.setSequence(sequence);
        function.setFunctionName(template.functionName());
        function.setModifier(template.modifier());
        function.setProperties(template.properties());
        function.setFormat(template.format());
        function.setOutput(template.output());
        function.setExpanded(false);
        function.setReviewStatus(ReviewStatus.UNREVIEWED);
        List<RangeTemplate> ranges = template.ranges();
        for (int i = 0; i < ranges.size(); i++) {
            function.ranges().add(instantiate(ranges.get(i), i));
        }
        return function;
    }

    public Range instantiate(RangeTemplate template, int sequence) {
        Objects.requireNonNull(template, "template");
        Range range = new Range(identifierGenerator.generate(), identifierGenerator.generate(),
                instantiate(template.parameter()));
        range.setSequence(sequence);
        range.setRangeName(template.rangeName());
        range.setRangeId(template.rangeId());
        range.setProperties(template.properties());
        range.setAutoAssign(template.autoAssign());
        List<SpecificationTemplate> specifications = template.specifications();
        for (int i = 0; i < specifications.size(); i++) {
            range.specifications().add(instantiate(specifications.get(i), i));
        }
        return range;
    }

    public Parameter instantiate(ParameterTemplate template) {
        Objects.requireNonNull(template, "template");
        Parameter parameter = new Parameter(identifierGenerator.generate(), identifierGenerator.generate());
        parameter.setSequence(0);
        parameter.setLowerLimit(template.lowerLimit());
        parameter.setUpperLimit(template.upperLimit());
        parameter.setUnitOfMeasure(template.unitOfMeasure());
        parameter.setUnitSymbol(template.unitSymbol());
        parameter.setBipolar(template.bipolar());
        parameter.setParamName(template.paramName());
        return parameter;
    }

    public Specification instantiate(SpecificationTemplate template, int sequence) {
        Objects.requireNonNull(template, "template");
        Specification specification = new Specification(identifierGenerator.generate(), identifierGenerator.generate());
        specification.setSequence(sequence);
        specification.setCalInterval(template.calInterval());
        specification.setSpecialCal(template.specialCal());
        specification.setAssetNum(template.assetNum());
        specification.setSpecType(template.specType());
        specification.setUnitOfMeasure(template.unitOfMeasure());
        specification.setUnitSymbol(template.unitSymbol());
        specification.setFullScale(template.fullScale());
        specification.setIvPct(template.ivPct());
        specification.setIvPctHi(template.ivPctHi());
        specification.setIvPpm(template.ivPpm());
        specification.setFsPct(template.fsPct());
        specification.setFsPctHi(template.fsPctHi());
        specification.setFsPpm(template.fsPpm());
        specification.setFloor(template.floor());
        specification.setFloorHi(template.floorHi());
        specification.setDb(template.db());
        specification.setDbType(template.dbType());
        specification.setCalcDescription(template.calcDescription());
        specification.setCalcString(template.calcString());
        specification.setOperand(template.operand());
        return specification;
    }
}
