package ai.msf.roundtrip.xml;

import java.util.List;
import java.util.Set;

/**
 * Element names of the MSF schema, with the canonical child order of every entity.
 */
final class MsfElements {

    static final String INSTRUMENT = "instrument";
    static final String HEADER = "header";
    static final String FUNCTION = "function";
    static final String RANGE = "range";
    static final String PARAMETER = "parameter";
    static final String SPECIFICATION = "specification";

    static final String PUI = "pui";
    static final String DUI = "dui";
    static final String SEQUENCE = "sequence";
    static final String VERIFIED = "verified";
    static final String REVIEW = "review";
    static final String NOTE_ID_LIST = "noteidlist";
    static final String PROPERTIES = "properties";
    static final String UNIT_OF_MEASURE = "unitofmeasure";
    static final String UNIT_SYMBOL = "unitsymbol";

    static final String FILE_NOTES = "filenotes";
    static final String FILE_HISTORY = "filehistory";

    static final String MODEL = "model";
    static final String MANUFACTURER = "manufacturer";
    static final String DESCRIPTION = "description";
    static final String CONFIDENCE = "confidence";
    static final String CONFIDENCE_DESC = "confidenceDesc";
    static final String SPEC_REFERENCE = "specreference";
    static final String AUTHOR = "author";
    static final String VERIFIED_BY = "verifiedby";
    static final String APPROVED_BY = "approvedby";
    static final String APPROVE_DATE = "approvedate";
    static final String SAVE_DATE = "save_date";
    static final String SAVED_BY = "saved_by";
    static final String REVISION = "revision";
    static final String APP_NAME = "app_name";
    static final String APP_VERSION = "app_version";
    static final String SOURCE_FILENAME = "source_filename";
    static final String SOURCE_DATE = "source_date";
    static final String LIMS_WIDGET_CODE = "lims_widgetcode";
    static final String LIMS_EQUIP_CLASS = "lims_equipclass";
    static final String IS_ACTIVE = "isactive";
    static final String REVISION_NOTES = "revisionnotes";

    static final String FUNCTION_NAME = "functionname";
    static final String MODIFIER = "modifier";
    static final String FORMAT = "format";
    static final String IS_OUTPUT = "isoutput";

    static final String RANGE_NAME = "rangename";
    static final String RANGE_ID = "rangeid";
    static final String AUTO_ASSIGN = "autoassign";

    static final String LOWER_LIMIT = "lowerlimit";
    static final String UPPER_LIMIT = "upperlimit";
    static final String IS_BIPOLAR = "isbipolar";
    static final String PARAM_NAME = "paramname";

    static final String CAL_INTERVAL = "calinterval";
    static final String SPECIAL_CAL = "Specialcal";
    static final String ASSET_NUM = "AssetNum";
    static final String SPEC_TYPE = "spectype";
    static final String FULL_SCALE = "fullscale";
    static final String IV_PCT = "iv_pct";
    static final String IV_PCT_HI = "iv_pct_hi";
    static final String IV_PPM = "iv_ppm";
    static final String FS_PCT = "fs_pct";
    static final String FS_PCT_HI = "fs_pct_hi";
    static final String FS_PPM = "fs_ppm";
    static final String FLOOR = "floor";
    static final String FLOOR_HI = "floor_hi";
    static final String DB = "db";
    static final String DB_TYPE = "dbtype";
    static final String CALC_DESC = "calcdesc";
    static final String CALC_STRING = "calcstring";
    static final String OPERAND = "operand";

    static final List<String> INSTRUMENT_ORDER = List.of(
            PUI, DUI, VERIFIED, REVIEW, FILE_NOTES, FILE_HISTORY, HEADER, FUNCTION);

    static final List<String> HEADER_ORDER = List.of(
            PUI, DUI, MODEL, MANUFACTURER, DESCRIPTION, CONFIDENCE, CONFIDENCE_DESC, SPEC_REFERENCE, AUTHOR,
            VERIFIED_BY, APPROVED_BY, APPROVE_DATE, SAVE_DATE, SAVED_BY, REVISION, APP_NAME, APP_VERSION,
            SOURCE_FILENAME, SOURCE_DATE, LIMS_WIDGET_CODE, LIMS_EQUIP_CLASS, NOTE_ID_LIST, IS_ACTIVE, VERIFIED,
            REVIEW, REVISION_NOTES);

    static final List<String> FUNCTION_ORDER = List.of(
            PUI, DUI, SEQUENCE, FUNCTION_NAME, MODIFIER, PROPERTIES, FORMAT, IS_OUTPUT, NOTE_ID_LIST, VERIFIED,
            REVIEW, RANGE);

    static final List<String> RANGE_ORDER = List.of(
            PUI, DUI, SEQUENCE, RANGE_NAME, RANGE_ID, PROPERTIES, AUTO_ASSIGN, NOTE_ID_LIST, VERIFIED, REVIEW,
            PARAMETER, SPECIFICATION);

    static final List<String> PARAMETER_ORDER = List.of(
            PUI, DUI, SEQUENCE, LOWER_LIMIT, UPPER_LIMIT, UNIT_OF_MEASURE, UNIT_SYMBOL, IS_BIPOLAR, NOTE_ID_LIST,
            PARAM_NAME, VERIFIED, REVIEW);

    static final List<String> SPECIFICATION_ORDER = List.of(
            PUI, DUI, SEQUENCE, CAL_INTERVAL, SPECIAL_CAL, ASSET_NUM, SPEC_TYPE, UNIT_OF_MEASURE, UNIT_SYMBOL,
            FULL_SCALE, IV_PCT, IV_PCT_HI, IV_PPM, FS_PCT, FS_PCT_HI, FS_PPM, FLOOR, FLOOR_HI, DB, DB_TYPE,
            CALC_DESC, CALC_STRING, OPERAND, NOTE_ID_LIST, VERIFIED, REVIEW);

    /** Children that may occur more than once and are always read into a list. */
    static final Set<String> REPEATABLE = Set.of(FUNCTION, RANGE, SPECIFICATION);

    private MsfElements() {
    }
}
