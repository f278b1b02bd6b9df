package de.bsommerfeld.unitupdate.core.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCacheStoreTest {

    private MutableClock clock;
    private InMemoryCacheStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        store = new InMemoryCacheStore(clock);
    }

    @Test
    void get_shouldReturnStoredValueBeforeExpiry() {
        store.put("k", "v", Duration.ofMinutes(60));
        clock.advance(Duration.ofMinutes(59));

        assertEquals("v", store.get("k").orElseThrow());
    }

    @Test
    void get_shouldReturnEmptyAfterExpiry() {
        store.put("k", "v", Duration.ofMinutes(60));
        clock.advance(Duration.ofMinutes(60));

        assertTrue(store.get("k").isEmpty());
    }

    @Test
    void forget_shouldRemoveSingleEntry() {
        store.put("a", "1", Duration.ofHours(1));
        store.put("b", "2", Duration.ofHours(1));

        store.forget("a");

        assertTrue(store.get("a").isEmpty());
        assertTrue(store.get("b").isPresent());
    }

    @Test
    void flush_shouldRemoveEverything() {
        store.put("a", "1", Duration.ofHours(1));
        store.put("b", "2", Duration.ofHours(1));

        store.flush();

        assertTrue(store.get("a").isEmpty());
        assertTrue(store.get("b").isEmpty());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
