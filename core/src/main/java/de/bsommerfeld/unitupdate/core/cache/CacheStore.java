package de.bsommerfeld.unitupdate.core.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Generic string key/value cache with per-entry expiry. Values are opaque to
 * the store; callers serialize and deserialize themselves.
 *
 * <p>
 * There is no compare-and-set. Two writers of the same key race and the last
 * one wins, so the store is only suitable for best-effort data.
 */
public interface CacheStore {

    /** Returns the value for {@code key}, or empty if absent or expired. */
    Optional<String> get(String key);

    /** Stores {@code value} under {@code key} until {@code ttl} has elapsed. */
    void put(String key, String value, Duration ttl);

    /** Removes a single entry. Unknown keys are ignored. */
    void forget(String key);

    /** Removes every entry. */
    void flush();
}
