package me.go_gradually.soundrelay.application.playback.model;

import me.go_gradually.soundrelay.domain.voice.GuildId;

import java.util.function.Consumer;

public record PlaybackContext(GuildId guildId, Consumer<Throwable> streamErrorHandler) {
    public PlaybackContext {
        if (guildId == null) {
            throw new IllegalArgumentException("Guild is required");
        }
        streamErrorHandler = streamErrorHandler == null ? error -> {
        } : streamErrorHandler;
    }

    public static PlaybackContext of(GuildId guildId) {
        return new PlaybackContext(guildId, null);
    }
}
