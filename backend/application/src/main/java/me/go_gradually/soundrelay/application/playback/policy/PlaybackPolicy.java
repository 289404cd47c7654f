package me.go_gradually.soundrelay.application.playback.policy;

import java.time.Duration;

public interface PlaybackPolicy {
    Duration failureTtl();

    int failureThreshold();

    Duration forceRelayTtl();
}
