package ai.msf.roundtrip.xml;

import static ai.msf.roundtrip.xml.MsfElements.*;

import ai.msf.roundtrip.model.Header;
import ai.msf.roundtrip.model.Instrument;
import ai.msf.roundtrip.model.MsfFunction;
import ai.msf.roundtrip.model.Parameter;
import ai.msf.roundtrip.model.Range;
import ai.msf.roundtrip.model.Specification;
import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Reads MSF documents into the normalized {@link Instrument} tree.
 *
 * <p>Repeatable children always become lists, {@code -1}/{@code 0} booleans become {@code boolean}, and an
 * empty {@code modifier} becomes an absent value while every other empty text stays an empty string.
 * Elements outside the schema are skipped and reported once per document. Instances hold no state between
 * calls.
 */
public class MsfParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(MsfParser.class);
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public Instrument parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new MsfFormatException("MSF document is empty");
        }
        Document document = readDocument(xml);
        Element root = document.getDocumentElement();
        if (root == null || !INSTRUMENT.equals(root.getTagName())) {
            String found = root == null ? "nothing" : "<" + root.getTagName() + ">";
            throw new MsfFormatException("Invalid MSF document: missing <" + INSTRUMENT + "> root element, found " + found);
        }

        ParseContext context = new ParseContext();
        Instrument instrument = readInstrument(root, context);
        context.reportSkippedElements();
        LOGGER.debug("Parsed MSF document {} with {} functions", instrument.primaryId(), instrument.functions().size());
        return instrument;
    }

    private Document readDocument(String xml) {
        String content = xml.charAt(0) == BYTE_ORDER_MARK ? xml.substring(1) : xml;
        try {
            DocumentBuilder builder = newDocumentBuilderFactory().newDocumentBuilder();
            builder.setErrorHandler(new FailingErrorHandler());
            return builder.parse(new InputSource(new StringReader(content)));
        } catch (SAXException ex) {
            throw new MsfFormatException("MSF document is not well-formed XML: " + ex.getMessage(), ex);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser could not be configured", ex);
        } catch (IOException ex) {
            throw new MsfFormatException("Failed to read MSF document", ex);
        }
    }

    private static DocumentBuilderFactory newDocumentBuilderFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory;
    }

    private Instrument readInstrument(Element element, ParseContext context) {
        String path = INSTRUMENT;
        ChildElements children = ChildElements.of(element, INSTRUMENT_ORDER, path, context);
        Element headerElement = children.single(HEADER)
                .orElseThrow(() -> new MsfFormatException("Invalid MSF document: <" + HEADER + "> section is missing"));

        Instrument instrument = new Instrument(
                identifier(children, PUI, path, context),
                identifier(children, DUI, path, context),
                readHeader(headerElement, path + "/" + HEADER, context));
        instrument.setVerified(MoxBooleans.decode(children.text(VERIFIED)));
        instrument.setReview(MoxBooleans.decode(children.text(REVIEW)));
        instrument.setFileNotes(children.text(FILE_NOTES));
        instrument.setFileHistory(children.text(FILE_HISTORY));

        List<Element> functionElements = children.all(FUNCTION);
        for (int i = 0; i < functionElements.size(); i++) {
            instrument.functions().add(readFunction(functionElements.get(i), i, path + "/" + FUNCTION + "[" + i + "]", context));
        }
        return instrument;
    }

    private Header readHeader(Element element, String path, ParseContext context) {
        ChildElements children = ChildElements.of(element, HEADER_ORDER, path, context);
        Header header = new Header(identifier(children, PUI, path, context), identifier(children, DUI, path, context));
        header.setModel(children.text(MODEL));
        header.setManufacturer(children.text(MANUFACTURER));
        header.setDescription(children.text(DESCRIPTION));
        header.setConfidence(integer(children, CONFIDENCE, path));
        header.setConfidenceDescription(children.text(CONFIDENCE_DESC));
        header.setSpecReference(children.text(SPEC_REFERENCE));
        header.setAuthor(children.text(AUTHOR));
        header.setVerifiedBy(children.text(VERIFIED_BY));
        header.setApprovedBy(children.text(APPROVED_BY));
        header.setApproveDate(children.text(APPROVE_DATE));
        header.setSaveDate(children.text(SAVE_DATE));
        header.setSavedBy(children.text(SAVED_BY));
        header.setRevision(integer(children, REVISION, path));
        header.setAppName(children.text(APP_NAME));
        header.setAppVersion(children.text(APP_VERSION));
        header.setSourceFilename(children.text(SOURCE_FILENAME));
        header.setSourceDate(children.text(SOURCE_DATE));
        header.setLimsWidgetCode(integer(children, LIMS_WIDGET_CODE, path));
        header.setLimsEquipClass(integer(children, LIMS_EQUIP_CLASS, path));
        header.setNoteIdList(children.text(NOTE_ID_LIST));
        header.setActive(MoxBooleans.decode(children.text(IS_ACTIVE)));
        header.setVerified(MoxBooleans.decode(children.text(VERIFIED)));
        header.setReview(MoxBooleans.decode(children.text(REVIEW)));
        header.setRevisionNotes(children.text(REVISION_NOTES));
        return header;
    }

    private MsfFunction readFunction(Element element, int position, String path, ParseContext context) {
        ChildElements children = ChildElements.of(element, FUNCTION_ORDER, path, context);
        MsfFunction function = new MsfFunction(identifier(children, PUI, path, context), identifier(children, DUI, path, context));
        function.setSequence(sequence(children, position, path));
        function.setFunctionName(children.text(FUNCTION_NAME));
        function.setModifier(absentWhenEmpty(children.text(MODIFIER)));
        function.setProperties(children.text(PROPERTIES));
        function.setFormat(children.text(FORMAT));
        function.setOutput(MoxBooleans.decode(children.text(IS_OUTPUT)));
        function.setNoteIdList(children.text(NOTE_ID_LIST));
        function.setVerified(MoxBooleans.decode(children.text(VERIFIED)));
        function.setReview(MoxBooleans.decode(children.text(REVIEW)));

        List<Element> rangeElements = children.all(RANGE);
        for (int i = 0; i < rangeElements.size(); i++) {
            function.ranges().add(readRange(rangeElements.get(i), i, path + "/" + RANGE + "[" + i + "]", context));
        }
        return function;
    }

    private Range readRange(Element element, int position, String path, ParseContext context) {
        ChildElements children = ChildElements.of(element, RANGE_ORDER, path, context);
        Element parameterElement = children.single(PARAMETER)
                .orElseThrow(() -> new MsfFormatException("Invalid MSF document: <" + PARAMETER + "> is missing at " + path));

        Range range = new Range(
                identifier(children, PUI, path, context),
                identifier(children, DUI, path, context),
                readParameter(parameterElement, path + "/" + PARAMETER, context));
        range.setSequence(sequence(children, position, path));
        range.setRangeName(children.text(RANGE_NAME));
        range.setRangeId(children.text(RANGE_ID));
        range.setProperties(children.text(PROPERTIES));
        range.setAutoAssign(MoxBooleans.decode(children.text(AUTO_ASSIGN)));
        range.setNoteIdList(children.text(NOTE_ID_LIST));
        range.setVerified(MoxBooleans.decode(children.text(VERIFIED)));
        range.setReview(MoxBooleans.decode(children.text(REVIEW)));

        List<Element> specificationElements = children.all(SPECIFICATION);
        for (int i = 0; i < specificationElements.size(); i++) {
            range.specifications().add(readSpecification(specificationElements.get(i), i,
                    path + "/" + SPECIFICATION + "[" + i + "]", context));
        }
        return range;
    }

    private Parameter readParameter(Element element, String path, ParseContext context) {
        ChildElements children = ChildElements.of(element, PARAMETER_ORDER, path, context);
        Parameter parameter = new Parameter(identifier(children, PUI, path, context), identifier(children, DUI, path, context));
        parameter.setSequence(sequence(children, 0, path));
        parameter.setLowerLimit(decimal(children, LOWER_LIMIT, path));
        parameter.setUpperLimit(decimal(children, UPPER_LIMIT, path));
        parameter.setUnitOfMeasure(children.text(UNIT_OF_MEASURE));
        parameter.setUnitSymbol(children.text(UNIT_SYMBOL));
        parameter.setBipolar(MoxBooleans.decode(children.text(IS_BIPOLAR)));
        parameter.setNoteIdList(children.text(NOTE_ID_LIST));
        parameter.setParamName(children.text(PARAM_NAME));
        parameter.setVerified(MoxBooleans.decode(children.text(VERIFIED)));
        parameter.setReview(MoxBooleans.decode(children.text(REVIEW)));
        return parameter;
    }

    private Specification readSpecification(Element element, int position, String path, ParseContext context) {
        ChildElements children = ChildElements.of(element, SPECIFICATION_ORDER, path, context);
        Specification specification = new Specification(
                identifier(children, PUI, path, context),
                identifier(children, DUI, path, context));
        specification.setSequence(sequence(children, position, path));
        specification.setCalInterval(integer(children, CAL_INTERVAL, path));
        specification.setSpecialCal(children.text(SPECIAL_CAL));
        specification.setAssetNum(children.text(ASSET_NUM));
        specification.setSpecType(children.text(SPEC_TYPE));
        specification.setUnitOfMeasure(children.text(UNIT_OF_MEASURE));
        specification.setUnitSymbol(children.text(UNIT_SYMBOL));
        specification.setFullScale(decimal(children, FULL_SCALE, path));
        specification.setIvPct(decimal(children, IV_PCT, path));
        specification.setIvPctHi(decimal(children, IV_PCT_HI, path));
        specification.setIvPpm(decimal(children, IV_PPM, path));
        specification.setFsPct(decimal(children, FS_PCT, path));
        specification.setFsPctHi(decimal(children, FS_PCT_HI, path));
        specification.setFsPpm(decimal(children, FS_PPM, path));
        specification.setFloor(decimal(children, FLOOR, path));
        specification.setFloorHi(decimal(children, FLOOR_HI, path));
        specification.setDb(decimal(children, DB, path));
        specification.setDbType(integer(children, DB_TYPE, path));
        specification.setCalcDescription(children.text(CALC_DESC));
        specification.setCalcString(children.text(CALC_STRING));
        specification.setOperand(children.text(OPERAND));
        specification.setNoteIdList(children.text(NOTE_ID_LIST));
        specification.setVerified(MoxBooleans.decode(children.text(VERIFIED)));
        specification.setReview(MoxBooleans.decode(children.text(REVIEW)));
        return specification;
    }

    private static String identifier(ChildElements children, String name, String path, ParseContext context) {
        if (!children.has(name)) {
            context.missingIdentifier(path + "/" + name);
        }
        return children.text(name);
    }

    private static Optional<String> absentWhenEmpty(String value) {
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static int sequence(ChildElements children, int position, String path) {
        if (!children.has(SEQUENCE)) {
            return position;
        }
        int value = integer(children, SEQUENCE, path);
        if (value < 0) {
            throw new MsfFormatException("Invalid MSF document: negative <" + SEQUENCE + "> at " + path);
        }
        return value;
    }

    private static int integer(ChildElements children, String name, String path) {
        String raw = children.text(name).trim();
        if (raw.isEmpty()) {
            return 0;
        }
        try {
            return new BigDecimal(raw).intValueExact();
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new MsfFormatException("Invalid MSF document: <" + name + "> at " + path + " is not an integer: " + raw, ex);
        }
    }

    private static BigDecimal decimal(ChildElements children, String name, String path) {
        String raw = children.text(name).trim();
        if (raw.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal value;
        try {
            value = new BigDecimal(raw);
        } catch (NumberFormatException ex) {
            throw new MsfFormatException("Invalid MSF document: <" + name + "> at " + path + " is not a number: " + raw, ex);
        }
        // positive exponents are written back in plain form, which reads with scale 0
        return value.scale() < 0 ? value.setScale(0) : value;
    }

    /**
     * Child elements of one entity, split into first-occurrence singles and repeatable lists.
     */
    private static final class ChildElements {

        private final Map<String, Element> singles = new HashMap<>();
        private final Map<String, List<Element>> repeated = new HashMap<>();

        static ChildElements of(Element parent, List<String> knownNames, String path, ParseContext context) {
            ChildElements children = new ChildElements();
            NodeList nodes = parent.getChildNodes();
            for (int i = 0; i < nodes.getLength(); i++) {
                Node node = nodes.item(i);
                if (node.getNodeType() != Node.ELEMENT_NODE) {
                    continue;
                }
                Element child = (Element) node;
                String name = child.getTagName();
                if (!knownNames.contains(name)) {
                    context.skipped(path + "/" + name);
                } else if (REPEATABLE.contains(name)) {
                    children.repeated.computeIfAbsent(name, key -> new ArrayList<>()).add(child);
                } else if (children.singles.putIfAbsent(name, child) != null) {
                    context.skipped(path + "/" + name + " (duplicate)");
                }
            }
            return children;
        }

        boolean has(String name) {
            return singles.containsKey(name);
        }

        Optional<Element> single(String name) {
            return Optional.ofNullable(singles.get(name));
        }

        String text(String name) {
            Element element = singles.get(name);
            return element == null ? "" : element.getTextContent();
        }

        List<Element> all(String name) {
            return repeated.getOrDefault(name, List.of());
        }
    }

    /**
     * Collects non-fatal findings of one parse so they are logged once.
     */
    private static final class ParseContext {

        private final Set<String> skippedElements = new LinkedHashSet<>();
        private final Set<String> missingIdentifiers = new LinkedHashSet<>();

        void skipped(String path) {
            skippedElements.add(path);
        }

        void missingIdentifier(String path) {
            missingIdentifiers.add(path);
        }

        void reportSkippedElements() {
            if (!skippedElements.isEmpty()) {
                LOGGER.warn("Skipped {} element(s) outside the MSF schema: {}", skippedElements.size(),
                        String.join(", ", skippedElements));
            }
            if (!missingIdentifiers.isEmpty()) {
                LOGGER.warn("Missing identifier element(s), read as empty: {}", String.join(", ", missingIdentifiers));
            }
        }
    }

    private static final class FailingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            LOGGER.debug("XML parser warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
