package ai.msf.roundtrip.config;

import ai.msf.roundtrip.xml.SerializerOptions;
import java.util.Objects;

/**
 * Immutable runtime settings assembled from CLI arguments, environment values and defaults.
 */
public record EngineConfig(LogFormat logFormat, SerializerOptions serializerOptions, int pagesPerFunction) {

    public EngineConfig {
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(serializerOptions, "serializerOptions");
        if (pagesPerFunction < 1) {
            throw new IllegalArgumentException("pagesPerFunction must be at least 1");
        }
    }
}
