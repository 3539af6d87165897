package ai.msf.roundtrip.id;

/**
 * Source of fresh entity identifiers.
 */
@FunctionalInterface
public interface IdentifierGenerator {
    String generate();
}
