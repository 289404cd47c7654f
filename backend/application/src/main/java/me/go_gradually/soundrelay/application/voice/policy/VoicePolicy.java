package me.go_gradually.soundrelay.application.voice.policy;

import java.time.Duration;

public interface VoicePolicy {
    Duration idleDisconnectTimeout();

    Duration recoveryWindow();

    Duration errorGraceDelay();
}
