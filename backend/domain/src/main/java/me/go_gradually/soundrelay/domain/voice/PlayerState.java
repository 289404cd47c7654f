package me.go_gradually.soundrelay.domain.voice;

public enum PlayerState {
    IDLE,
    BUFFERING,
    PLAYING,
    PAUSED,
    AUTO_PAUSED;

    public boolean isActive() {
        return this != IDLE;
    }
}
