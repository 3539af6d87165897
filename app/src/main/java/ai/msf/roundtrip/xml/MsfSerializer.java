package ai.msf.roundtrip.xml;

import static ai.msf.roundtrip.xml.MsfElements.*;

import ai.msf.roundtrip.model.Header;
import ai.msf.roundtrip.model.Instrument;
import ai.msf.roundtrip.model.MsfFunction;
import ai.msf.roundtrip.model.Parameter;
import ai.msf.roundtrip.model.Range;
import ai.msf.roundtrip.model.Specification;
import java.math.BigDecimal;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an {@link Instrument} tree back to MSF text.
 *
 * <p>Fields are emitted in the fixed order the calibration software expects, booleans as {@code -1}/{@code 0},
 * and empty values as an explicit open/close pair. An absent {@code modifier} is written exactly like an empty
 * one, so that distinction does not survive a round trip. Output of this class parses back to an equal tree
 * and re-serializes to identical text.
 */
public class MsfSerializer {

    private static final Logger LOGGER = LoggerFactory.getLogger(MsfSerializer.class);

    private final SerializerOptions options;

    public MsfSerializer() {
        this(SerializerOptions.defaults());
    }

    public MsfSerializer(SerializerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public String serialize(Instrument instrument) {
        Objects.requireNonNull(instrument, "instrument");
        XmlTextWriter writer = new XmlTextWriter(options);
        writer.declaration();
        writeInstrument(writer, instrument);
        if (writer.droppedCharacters() > 0) {
            LOGGER.warn("Dropped {} character(s) not allowed in XML 1.0 while writing MSF document {}",
                    writer.droppedCharacters(), instrument.primaryId());
        }
        return writer.toString();
    }

    private void writeInstrument(XmlTextWriter writer, Instrument instrument) {
        writer.open(INSTRUMENT);
        writer.element(PUI, instrument.primaryId());
        writer.element(DUI, instrument.secondaryId());
        writer.element(VERIFIED, MoxBooleans.encode(instrument.verified()));
        writer.element(REVIEW, MoxBooleans.encode(instrument.review()));
        writer.element(FILE_NOTES, instrument.fileNotes());
        writer.element(FILE_HISTORY, instrument.fileHistory());
        writeHeader(writer, instrument.header());
        for (MsfFunction function : instrument.functions()) {
            writeFunction(writer, function);
        }
        writer.close(INSTRUMENT);
    }

    private void writeHeader(XmlTextWriter writer, Header header) {
        writer.open(HEADER);
        writer.element(PUI, header.primaryId());
        writer.element(DUI, header.secondaryId());
        writer.element(MODEL, header.model());
        writer.element(MANUFACTURER, header.manufacturer());
        writer.element(DESCRIPTION, header.description());
        writer.element(CONFIDENCE, Integer.toString(header.confidence()));
        writer.element(CONFIDENCE_DESC, header.confidenceDescription());
        writer.element(SPEC_REFERENCE, header.specReference());
        writer.element(AUTHOR, header.author());
        writer.element(VERIFIED_BY, header.verifiedBy());
        writer.element(APPROVED_BY, header.approvedBy());
        writer.element(APPROVE_DATE, header.approveDate());
        writer.element(SAVE_DATE, header.saveDate());
        writer.element(SAVED_BY, header.savedBy());
        writer.element(REVISION, Integer.toString(header.revision()));
        writer.element(APP_NAME, header.appName());
        writer.element(APP_VERSION, header.appVersion());
        writer.element(SOURCE_FILENAME, header.sourceFilename());
        writer.element(SOURCE_DATE, header.sourceDate());
        writer.element(LIMS_WIDGET_CODE, Integer.toString(header.limsWidgetCode()));
        writer.element(LIMS_EQUIP_CLASS, Integer.toString(header.limsEquipClass()));
        writer.element(NOTE_ID_LIST, header.noteIdList());
        writer.element(IS_ACTIVE, MoxBooleans.encode(header.active()));
        writer.element(VERIFIED, MoxBooleans.encode(header.verified()));
        writer.element(REVIEW, MoxBooleans.encode(header.review()));
        writer.element(REVISION_NOTES, header.revisionNotes());
        writer.close(HEADER);
    }

    private void writeFunction(XmlTextWriter writer, MsfFunction function) {
        writer.open(FUNCTION);
        writer.element(PUI, function.primaryId());
        writer.element(DUI, function.secondaryId());
        writer.element(SEQUENCE, Integer.toString(function.sequence()));
        writer.element(FUNCTION_NAME, function.functionName());
        writer.element(MODIFIER, function.modifier().orElse(""));
        writer.element(PROPERTIES, function.properties());
        writer.element(FORMAT, function.format());
        writer.element(IS_OUTPUT, MoxBooleans.encode(function.output()));
        writer.element(NOTE_ID_LIST, function.noteIdList());
        writer.element(VERIFIED, MoxBooleans.encode(function.verified()));
        writer.element(REVIEW, MoxBooleans.encode(function.review()));
        for (Range range : function.ranges()) {
            writeRange(writer, range);
        }
        writer.close(FUNCTION);
    }

    private void writeRange(XmlTextWriter writer, Range range) {
        writer.open(RANGE);
        writer.element(PUI, range.primaryId());
        writer.element(DUI, range.secondaryId());
        writer.element(SEQUENCE, Integer.toString(range.sequence()));
        writer.element(RANGE_NAME, range.rangeName());
        writer.element(RANGE_ID, range.rangeId());
        writer.element(PROPERTIES, range.properties());
        writer.element(AUTO_ASSIGN, MoxBooleans.encode(range.autoAssign()));
        writer.element(NOTE_ID_LIST, range.noteIdList());
        writer.element(VERIFIED, MoxBooleans.encode(range.verified()));
        writer.element(REVIEW, MoxBooleans.encode(range.review()));
        writeParameter(writer, range.parameter());
        for (Specification specification : range.specifications()) {
            writeSpecification(writer, specification);
        }
        writer.close(RANGE);
    }

    private void writeParameter(XmlTextWriter writer, Parameter parameter) {
        writer.open(PARAMETER);
        writer.element(PUI, parameter.primaryId());
        writer.element(DUI, parameter.secondaryId());
        writer.element(SEQUENCE, Integer.toString(parameter.sequence()));
        writer.element(LOWER_LIMIT, decimal(parameter.lowerLimit()));
        writer.element(UPPER_LIMIT, decimal(parameter.upperLimit()));
        writer.element(UNIT_OF_MEASURE, parameter.unitOfMeasure());
        writer.element(UNIT_SYMBOL, parameter.unitSymbol());
        writer.element(IS_BIPOLAR, MoxBooleans.encode(parameter.bipolar()));
        writer.element(NOTE_ID_LIST, parameter.noteIdList());
        writer.element(PARAM_NAME, parameter.paramName());
        writer.element(VERIFIED, MoxBooleans.encode(parameter.verified()));
        writer.element(REVIEW, MoxBooleans.encode(parameter.review()));
        writer.close(PARAMETER);
    }

    private void writeSpecification(XmlTextWriter writer, Specification specification) {
        writer.open(SPECIFICATION);
        writer.element(PUI, specification.primaryId());
        writer.element(DUI, specification.secondaryId());
        writer.element(SEQUENCE, Integer.toString(specification.sequence()));
        writer.element(CAL_INTERVAL, Integer.toString(specification.calInterval()));
        writer.element(SPECIAL_CAL, specification.specialCal());
        writer.element(ASSET_NUM, specification.assetNum());
        writer.element(SPEC_TYPE, specification.specType());
        writer.element(UNIT_OF_MEASURE, specification.unitOfMeasure());
        writer.element(UNIT_SYMBOL, specification.unitSymbol());
        writer.element(FULL_SCALE, decimal(specification.fullScale()));
        writer.element(IV_PCT, decimal(specification.ivPct()));
        writer.element(IV_PCT_HI, decimal(specification.ivPctHi()));
        writer.element(IV_PPM, decimal(specification.ivPpm()));
        writer.element(FS_PCT, decimal(specification.fsPct()));
        writer.element(FS_PCT_HI, decimal(specification.fsPctHi()));
        writer.element(FS_PPM, decimal(specification.fsPpm()));
        writer.element(FLOOR, decimal(specification.floor()));
        writer.element(FLOOR_HI, decimal(specification.floorHi()));
        writer.element(DB, decimal(specification.db()));
        writer.element(DB_TYPE, Integer.toString(specification.dbType()));
        writer.element(CALC_DESC, specification.calcDescription());
        writer.element(CALC_STRING, specification.calcString());
        writer.element(OPERAND, specification.operand());
        writer.element(NOTE_ID_LIST, specification.noteIdList());
        writer.element(VERIFIED, MoxBooleans.encode(specification.verified()));
        writer.element(REVIEW, MoxBooleans.encode(specification.review()));
        writer.close(SPECIFICATION);
    }

    private static String decimal(BigDecimal value) {
        return value.toPlainString();
    }
}
