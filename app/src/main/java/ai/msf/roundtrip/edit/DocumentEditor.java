package ai.msf.roundtrip.edit;

import ai.msf.roundtrip.model.Instrument;
import ai.msf.roundtrip.model.MsfEntity;
import ai.msf.roundtrip.model.MsfFunction;
import ai.msf.roundtrip.model.Range;
import ai.msf.roundtrip.model.Specification;
import ai.msf.roundtrip.template.FunctionTemplate;
import ai.msf.roundtrip.template.TemplateEngine;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural edits on a parsed document. Removals drop the whole subtree and renumber the remaining siblings;
 * an unknown identifier or index is logged and reported as {@link Optional#empty()}.
 */
public class DocumentEditor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentEditor.class);

    private final TemplateEngine templateEngine;

    public DocumentEditor() {
        this(new TemplateEngine());
    }

    public DocumentEditor(TemplateEngine templateEngine) {
        this.templateEngine = Objects.requireNonNull(templateEngine, "templateEngine");
    }

    public Optional<MsfFunction> findFunction(Instrument instrument, String functionId) {
        Objects.requireNonNull(instrument, "instrument");
        return findById(instrument.functions(), functionId);
    }

    public Optional<MsfFunction> deleteFunction(Instrument instrument, String functionId) {
        Objects.requireNonNull(instrument, "instrument");
        Optional<MsfFunction> removed = removeById(instrument.functions(), functionId);
        if (removed.isEmpty()) {
            LOGGER.warn("No function with identifier '{}' to delete", functionId);
        }
        return removed;
    }

    public Optional<MsfFunction> deleteFunctionAt(Instrument instrument, int index) {
        Objects.requireNonNull(instrument, "instrument");
        List<MsfFunction> functions = instrument.functions();
        if (index < 0 || index >= functions.size()) {
            LOGGER.warn("Function index {} out of bounds for {} functions", index, functions.size());
            return Optional.empty();
        }
        MsfFunction removed = functions.remove(index);
        renumber(functions);
        return Optional.of(removed);
    }

    public Optional<Range> deleteRange(MsfFunction function, String rangeId) {
        Objects.requireNonNull(function, "function");
        Optional<Range> removed = removeById(function.ranges(), rangeId);
        if (removed.isEmpty()) {
            LOGGER.warn("No range with identifier '{}' in function {}", rangeId, function.primaryId());
        }
        return removed;
    }

    public Optional<Specification> deleteSpecification(Range range, String specificationId) {
        Objects.requireNonNull(range, "range");
        Optional<Specification> removed = removeById(range.specifications(), specificationId);
        if (removed.isEmpty()) {
            LOGGER.warn("No specification with identifier '{}' in range {}", specificationId, range.primaryId());
        }
        return removed;
    }

    /**
     * Instantiates {@code template} with fresh identifiers and appends it after the last function.
     */
    public MsfFunction addFunction(Instrument instrument, FunctionTemplate template) {
        Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(template, "template");
        MsfFunction function = templateEngine.instantiate(template, instrument.functions().size());
        instrument.functions().add(function);
        LOGGER.debug("Added function '{}' as {}", function.functionName(), function.primaryId());
        return function;
    }

    public Optional<MsfFunction> duplicateFunction(Instrument instrument, String functionId) {
        Optional<MsfFunction> source = findFunction(instrument, functionId);
        if (source.isEmpty()) {
            LOGGER.warn("No function with identifier '{}' to duplicate", functionId);
            return Optional.empty();
        }
        return Optional.of(addFunction(instrument, templateEngine.extractTemplate(source.get())));
    }

    /**
     * Renumbers every sibling collection of the document densely from zero, keeping list order.
     */
    public void resequence(Instrument instrument) {
        Objects.requireNonNull(instrument, "instrument");
        renumber(instrument.functions());
        for (MsfFunction function : instrument.functions()) {
            renumber(function.ranges());
            for (Range range : function.ranges()) {
                renumber(range.specifications());
            }
        }
    }

    private static <T extends MsfEntity> Optional<T> findById(List<T> entities, String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return entities.stream()
                .filter(entity -> entity.primaryId().equals(id))
                .findFirst();
    }

    private static <T extends MsfEntity> Optional<T> removeById(List<T> entities, String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        for (int i = 0; i < entities.size(); i++) {
            if (entities.get(i).primaryId().equals(id)) {
                T removed = entities.remove(i);
                renumber(entities);
                return Optional.of(removed);
            }
        }
        return Optional.empty();
    }

    private static void renumber(List<? extends MsfEntity> entities) {
        for (int i = 0; i < entities.size(); i++) {
            entities.get(i).setSequence(i);
        }
    }
}
