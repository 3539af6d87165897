package ai.msf.roundtrip.cli;

/**
 * Operations the command line front end can run against one document.
 */
public enum CliCommand {
    ROUNDTRIP("roundtrip"),
    IDS("ids"),
    INDEX("index"),
    PAGES("pages"),
    ADD_FUNCTION("add-function"),
    DELETE_FUNCTION("delete-function");

    private final String label;

    CliCommand(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static CliCommand from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Command must be provided");
        }
        String normalized = raw.trim();
        for (CliCommand command : values()) {
            if (command.label.equalsIgnoreCase(normalized) || command.name().equalsIgnoreCase(normalized)) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unsupported command: " + raw);
    }
}
