package de.bsommerfeld.unitupdate.core.cache;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link CacheStore}. Expired entries are evicted lazily on read.
 */
@Singleton
public class InMemoryCacheStore implements CacheStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryCacheStore.class);

    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Inject
    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null)
            return Optional.empty();
        if (!entry.expiresAt().isAfter(clock.instant())) {
            entries.remove(key, entry);
            LOG.trace("Cache entry expired: {}", key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void forget(String key) {
        entries.remove(key);
    }

    @Override
    public void flush() {
        LOG.debug("Flushing {} cache entries.", entries.size());
        entries.clear();
    }

    private record Entry(String value, Instant expiresAt) {
    }
}
