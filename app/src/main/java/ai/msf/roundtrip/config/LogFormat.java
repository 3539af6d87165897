package ai.msf.roundtrip.config;

/**
 * Supported log output formats.
 */
public enum LogFormat {
    TEXT,
    JSON;

    public static LogFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Log format must be provided");
        }
        for (LogFormat format : values()) {
            if (format.name().equalsIgnoreCase(raw.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported log format: " + raw + " (expected text or json)");
    }
}
