package me.go_gradually.soundrelay.domain.relay;

import java.time.Duration;

/**
 * {@code maxDelay}를 상한으로 하는 선형 백오프. 시도 번호는 1부터
 */
public record ReconnectPolicy(Duration baseDelay, int maxAttempts, Duration maxDelay) {
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    public ReconnectPolicy {
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("Reconnect base delay must be positive");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("Reconnect attempts must be >= 0");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Reconnect max delay must be >= base delay");
        }
    }

    public static ReconnectPolicy of(Duration baseDelay, int maxAttempts) {
        return new ReconnectPolicy(baseDelay, maxAttempts, DEFAULT_MAX_DELAY);
    }

    public boolean allowsAttempt(int attempt) {
        return attempt >= 1 && attempt <= maxAttempts;
    }

    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Reconnect attempt must be >= 1");
        }
        Duration linear = baseDelay.multipliedBy(attempt);
        return linear.compareTo(maxDelay) > 0 ? maxDelay : linear;
    }
}
