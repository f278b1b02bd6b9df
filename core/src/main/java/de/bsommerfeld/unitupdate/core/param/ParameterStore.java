package de.bsommerfeld.unitupdate.core.param;

import java.util.Map;
import java.util.Optional;

/**
 * Durable key/value parameters shared by the update components, e.g. the
 * installed core build or the cached update count. Values are stored as
 * strings; the typed accessors parse on read.
 *
 * @see ParameterKeys
 */
public interface ParameterStore {

    Optional<String> get(String key);

    void set(String key, String value);

    /** Writes all entries in one transaction. {@code null} values remove the key. */
    void setAll(Map<String, String> values);

    void remove(String key);

    default String get(String key, String fallback) {
        return get(key).orElse(fallback);
    }

    /** Returns the value as an int, or {@code fallback} if absent or not numeric. */
    default int getInt(String key, int fallback) {
        return get(key).map(v -> {
            try {
                return Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }).orElse(fallback);
    }

    /** Returns the value as a long, or {@code fallback} if absent or not numeric. */
    default long getLong(String key, long fallback) {
        return get(key).map(v -> {
            try {
                return Long.parseLong(v.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }).orElse(fallback);
    }

    default boolean getBoolean(String key, boolean fallback) {
        return get(key).map(v -> "1".equals(v) || "true".equalsIgnoreCase(v)).orElse(fallback);
    }
}
