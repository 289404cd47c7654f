package me.go_gradually.soundrelay.domain.playback;

import java.time.Duration;
import java.time.Instant;

/**
 * 영상 하나의 최근 직접 재생 실패 횟수. 실패할 때마다 만료 시각이 TTL만큼 늘어난다.
 */
public record FailureRecord(int count, Instant expiresAt) {
    public FailureRecord {
        if (count < 0) {
            throw new IllegalArgumentException("Failure count must be >= 0");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Failure expiry is required");
        }
    }

    public static FailureRecord first(Instant now, Duration ttl) {
        return new FailureRecord(1, now.plus(ttl));
    }

    public FailureRecord incremented(Instant now, Duration ttl) {
        if (isExpired(now)) {
            return first(now, ttl);
        }
        return new FailureRecord(count + 1, now.plus(ttl));
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public int effectiveCount(Instant now) {
        return isExpired(now) ? 0 : count;
    }
}
