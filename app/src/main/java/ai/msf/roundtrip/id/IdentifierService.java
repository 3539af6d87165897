package ai.msf.roundtrip.id;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Generates and validates the brace-delimited identifiers used for {@code pui} and {@code dui} fields.
 *
 * <p>Identifiers have the form {@code {XXXXXXXX-XXXX-XXXX-XXXX-XXXXXXXXXXXX}} with uppercase hex digits.
 * Generation draws from {@link UUID#randomUUID()} and keeps no state, so concurrent callers need no
 * coordination.
 */
public final class IdentifierService implements IdentifierGenerator {

    private static final Pattern IDENTIFIER_PATTERN =
            Pattern.compile("^\\{[0-9A-F]{8}-[0-9A-F]{4}-[0-9A-F]{4}-[0-9A-F]{4}-[0-9A-F]{12}\\}$");
    private static final String NULL_IDENTIFIER = "{00000000-0000-0000-0000-000000000000}";

    @Override
    public String generate() {
        return '{' + UUID.randomUUID().toString().toUpperCase(Locale.ROOT) + '}';
    }

    public static boolean isValid(String identifier) {
        return identifier != null && IDENTIFIER_PATTERN.matcher(identifier).matches();
    }

    /**
     * Explicit "no identity" placeholder, distinct from a missing field.
     */
    public static String nullIdentifier() {
        return NULL_IDENTIFIER;
    }
}
