package me.go_gradually.soundrelay.domain.playback;

import java.util.List;
import java.util.Locale;

public final class BotDetectionPolicy {
    private static final List<String> PHRASES = List.of(
            "sign in to confirm",
            "bot",
            "captcha",
            "verify",
            "age-restricted",
            "inappropriate",
            "429",
            "too many requests",
            "rate limit"
    );

    private BotDetectionPolicy() {
    }

    public static boolean isBotDetection(String errorMessage) {
        if (errorMessage == null || errorMessage.isBlank()) {
            return false;
        }
        String normalized = errorMessage.toLowerCase(Locale.ROOT);
        for (String phrase : PHRASES) {
            if (normalized.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    public static boolean shouldPreferRelay(int recentFailures, int threshold) {
        return recentFailures > threshold;
    }
}
