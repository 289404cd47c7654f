package me.go_gradually.soundrelay.application.shared.port;

import java.time.Duration;

public interface MetricsPort {
    void recordPlaybackStartLatency(Duration duration);

    void recordRelayAcquireLatency(Duration duration);

    void incrementDirectPlayback();

    void incrementRelayPlayback();

    void incrementDirectFailure();

    void incrementBotDetection();

    void incrementPlaybackUnavailable();

    void incrementRelayReconnect();

    void incrementRelayRestart();

    void incrementRelayPoolExhausted();

    void incrementVoiceRecovery();

    void incrementVoiceConnectionLost();

    void incrementPlayerError();
}
