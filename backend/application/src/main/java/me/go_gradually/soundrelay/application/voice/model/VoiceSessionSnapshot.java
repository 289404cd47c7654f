package me.go_gradually.soundrelay.application.voice.model;

import me.go_gradually.soundrelay.domain.track.Track;
import me.go_gradually.soundrelay.domain.voice.ConnectionState;
import me.go_gradually.soundrelay.domain.voice.GuildVoiceSession;
import me.go_gradually.soundrelay.domain.voice.PlayerState;

import java.time.Instant;

public record VoiceSessionSnapshot(String guildId,
                                   String channelId,
                                   ConnectionState connectionState,
                                   PlayerState playerState,
                                   Track currentTrack,
                                   Instant idleDisconnectAt) {
    public static VoiceSessionSnapshot of(GuildVoiceSession session) {
        return new VoiceSessionSnapshot(
                session.guildId().value(),
                session.channel().channelId(),
                session.connectionState(),
                session.playerState(),
                session.currentTrack().orElse(null),
                session.idleDisconnectAt().orElse(null)
        );
    }
}
