package me.go_gradually.soundrelay.application.voice.port;

import me.go_gradually.soundrelay.domain.voice.PlayerState;

public interface AudioPlayerListener {
    void onStateChange(PlayerState previous, PlayerState next);

    void onError(Throwable error);
}
