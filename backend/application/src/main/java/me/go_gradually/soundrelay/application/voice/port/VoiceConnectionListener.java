package me.go_gradually.soundrelay.application.voice.port;

import me.go_gradually.soundrelay.domain.voice.ConnectionState;

@FunctionalInterface
public interface VoiceConnectionListener {
    void onStateChange(ConnectionState previous, ConnectionState next);
}
