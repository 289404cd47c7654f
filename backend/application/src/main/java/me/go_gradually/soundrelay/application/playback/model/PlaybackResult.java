package me.go_gradually.soundrelay.application.playback.model;

import me.go_gradually.soundrelay.domain.playback.PlaybackMethod;

public record PlaybackResult(PlaybackMethod method, PlaybackStream stream) {
    public PlaybackResult {
        if (method == null || stream == null) {
            throw new IllegalArgumentException("Playback method and stream are required");
        }
    }
}
