package me.go_gradually.soundrelay.application.voice.port;

import me.go_gradually.soundrelay.domain.voice.GuildId;

public interface AudioPlayerFactory {
    AudioPlayer create(GuildId guildId, AudioPlayerListener listener);
}
