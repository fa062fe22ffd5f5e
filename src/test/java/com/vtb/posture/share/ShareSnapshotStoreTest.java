package com.vtb.posture.share;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ShareSnapshotStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-07T12:00:00Z"));
    private final ShareSnapshotStore store = new ShareSnapshotStore(clock, Duration.ofHours(2));

    @Test
    void returnsSnapshotUntilExpiry() {
        Instant expiresAt = store.put("abc", "{}");
        assertEquals(Instant.parse("2024-03-07T14:00:00Z"), expiresAt);

        clock.advance(Duration.ofMinutes(119));
        assertEquals("{}", store.get("abc").orElseThrow());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(store.get("abc").isEmpty(), "Снимок должен истечь ровно через ttl");
        assertFalse(store.contains("abc"));
    }

    @Test
    void unknownAndNullTokensAreEmpty() {
        assertTrue(store.get("missing").isEmpty());
        assertTrue(store.get(null).isEmpty());
        assertFalse(store.contains(null));
    }

    @Test
    void putEvictsExpiredSnapshots() {
        store.put("old", "1");
        clock.advance(Duration.ofHours(3));
        store.put("new", "2");

        assertEquals(1, store.size());
        assertTrue(store.contains("new"));
    }

    static final class MutableClock extends Clock {
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
