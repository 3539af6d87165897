package ai.msf.roundtrip.pages;

import java.util.Optional;

/**
 * String key/value surface provided by the hosting application (browser storage, a database table, ...).
 * Implementations may throw unchecked exceptions; callers in this package contain them.
 */
public interface KeyValueStorage {

    Optional<String> get(String key);

    void put(String key, String value);

    void remove(String key);
}
