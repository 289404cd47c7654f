package me.go_gradually.soundrelay.domain.voice;

public enum ConnectionState {
    CONNECTING,
    SIGNALLING,
    READY,
    DISCONNECTED,
    DESTROYED;

    public boolean isRecovering() {
        return this == CONNECTING || this == SIGNALLING;
    }

    public boolean isTerminal() {
        return this == DESTROYED;
    }
}
