package ai.msf.roundtrip.xml;

/**
 * Wire encoding of boolean fields: {@code -1} is true, every other literal is false.
 */
final class MoxBooleans {

    static final String TRUE_LITERAL = "-1";
    static final String FALSE_LITERAL = "0";

    private MoxBooleans() {
    }

    static boolean decode(String raw) {
        return raw != null && TRUE_LITERAL.equals(raw.trim());
    }

    static String encode(boolean value) {
        return value ? TRUE_LITERAL : FALSE_LITERAL;
    }
}
