package me.go_gradually.soundrelay.application.voice.model;

import me.go_gradually.soundrelay.domain.track.Track;
import me.go_gradually.soundrelay.domain.voice.GuildId;

public sealed interface VoiceSessionEvent {
    GuildId guildId();

    record Finished(GuildId guildId, Track track) implements VoiceSessionEvent {
    }

    record PlaybackFailed(GuildId guildId, Track track, String message) implements VoiceSessionEvent {
    }

    record Disconnected(GuildId guildId, String reason) implements VoiceSessionEvent {
    }
}
