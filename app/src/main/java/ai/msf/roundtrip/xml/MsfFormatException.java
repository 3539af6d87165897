package ai.msf.roundtrip.xml;

/**
 * Raised when a document cannot be turned into an MSF tree. No partial tree accompanies it.
 */
public class MsfFormatException extends RuntimeException {

    public MsfFormatException(String message) {
        super(message);
    }

    public MsfFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
