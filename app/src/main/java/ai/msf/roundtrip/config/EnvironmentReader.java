package ai.msf.roundtrip.config;

import java.util.Optional;

@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);
}
