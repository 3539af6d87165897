package ai.msf.roundtrip.xml;

import ai.msf.roundtrip.model.Instrument;
import ai.msf.roundtrip.model.MsfEntity;
import ai.msf.roundtrip.model.MsfFunction;
import ai.msf.roundtrip.model.Range;
import ai.msf.roundtrip.model.Specification;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lists every identifier of a tree in document order, primary before secondary, duplicates kept.
 * Used to audit round trips and diff document versions.
 */
public final class IdentifierExtractor {

    private IdentifierExtractor() {
    }

    public static List<String> extractAllIdentifiers(Instrument instrument) {
        Objects.requireNonNull(instrument, "instrument");
        List<String> identifiers = new ArrayList<>();
        add(identifiers, instrument);
        add(identifiers, instrument.header());
        for (MsfFunction function : instrument.functions()) {
            add(identifiers, function);
            for (Range range : function.ranges()) {
                add(identifiers, range);
                add(identifiers, range.parameter());
                for (Specification specification : range.specifications()) {
                    add(identifiers, specification);
                }
            }
        }
        return identifiers;
    }

    private static void add(List<String> identifiers, MsfEntity entity) {
        identifiers.add(entity.primaryId());
        identifiers.add(entity.secondaryId());
    }
}
