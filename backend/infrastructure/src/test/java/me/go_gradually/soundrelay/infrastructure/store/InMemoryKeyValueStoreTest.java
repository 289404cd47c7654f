package me.go_gradually.soundrelay.infrastructure.store;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryKeyValueStoreTest {

    @Test
    void set_withTtlExpiresAtDeadline() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);

        store.set("failure:vid1", "2", Duration.ofHours(1));
        store.set("permanent", "x");

        clock.advance(Duration.ofMinutes(59));
        assertEquals(Optional.of("2"), store.get("failure:vid1"));

        clock.advance(Duration.ofMinutes(1));
        assertTrue(store.get("failure:vid1").isEmpty());
        assertEquals(Optional.of("x"), store.get("permanent"));
    }

    @Test
    void hashesAndSets_accumulateAndDeleteClearsEverything() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();

        store.hashPut("video:history", "vid1", "direct");
        store.hashPut("video:history", "vid2", "neko");
        store.setAdd("videos:direct", "vid1");
        store.setAdd("videos:direct", "vid1");

        assertEquals(Optional.of("neko"), store.hashGet("video:history", "vid2"));
        assertEquals(Map.of("vid1", "direct", "vid2", "neko"), store.hashEntries("video:history"));
        assertEquals(Set.of("vid1"), store.setMembers("videos:direct"));

        store.delete("video:history");
        store.delete("videos:direct");

        assertTrue(store.hashEntries("video:history").isEmpty());
        assertTrue(store.setMembers("videos:direct").isEmpty());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        private void advance(Duration duration) {
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
