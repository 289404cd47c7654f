package me.go_gradually.soundrelay.application.voice.port;

import me.go_gradually.soundrelay.domain.voice.PlayerState;

public interface AudioPlayer {
    PlayerState state();

    void play(AudioResource resource);

    /**
     * 이미 IDLE 이었으면 false
     */
    boolean stop(boolean force);

    boolean pause();

    boolean unpause();

    void connectionReadinessChanged(boolean ready);
}
