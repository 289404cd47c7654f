package me.go_gradually.soundrelay.presentation.voice.dto;

import me.go_gradually.soundrelay.application.voice.model.VoiceSessionSnapshot;
import me.go_gradually.soundrelay.domain.track.Track;

import java.time.Instant;

public record VoiceSessionResponse(String guildId,
                                   String channelId,
                                   String connectionState,
                                   String playerState,
                                   CurrentTrack currentTrack,
                                   Instant idleDisconnectAt) {
    public static VoiceSessionResponse from(VoiceSessionSnapshot snapshot) {
        return new VoiceSessionResponse(
                snapshot.guildId(),
                snapshot.channelId(),
                snapshot.connectionState().name(),
                snapshot.playerState().name(),
                CurrentTrack.from(snapshot.currentTrack()),
                snapshot.idleDisconnectAt()
        );
    }

    public record CurrentTrack(String videoId, String title, String url, long durationSeconds, String requestedBy) {
        static CurrentTrack from(Track track) {
            if (track == null) {
                return null;
            }
            return new CurrentTrack(track.id(), track.title(), track.sourceUrl(), track.durationSeconds(), track.requestedBy());
        }
    }
}
