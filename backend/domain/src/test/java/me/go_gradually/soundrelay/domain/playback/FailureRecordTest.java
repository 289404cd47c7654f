package me.go_gradually.soundrelay.domain.playback;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FailureRecordTest {
    private static final Duration TTL = Duration.ofHours(1);
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void incremented_extendsExpiryFromLatestFailure() {
        FailureRecord first = FailureRecord.first(T0, TTL);
        FailureRecord second = first.incremented(T0.plusSeconds(600), TTL);

        assertEquals(2, second.count());
        assertEquals(T0.plusSeconds(600).plus(TTL), second.expiresAt());
    }

    @Test
    void incremented_restartsCountAfterExpiry() {
        FailureRecord first = FailureRecord.first(T0, TTL);

        FailureRecord next = first.incremented(T0.plus(TTL), TTL);

        assertEquals(1, next.count());
    }

    @Test
    void effectiveCount_dropsToZeroAtExpiry() {
        FailureRecord record = FailureRecord.first(T0, TTL).incremented(T0, TTL);

        assertEquals(2, record.effectiveCount(T0.plus(TTL).minusMillis(1)));
        assertFalse(record.isExpired(T0.plus(TTL).minusMillis(1)));
        assertTrue(record.isExpired(T0.plus(TTL)));
        assertEquals(0, record.effectiveCount(T0.plus(TTL)));
    }
}
