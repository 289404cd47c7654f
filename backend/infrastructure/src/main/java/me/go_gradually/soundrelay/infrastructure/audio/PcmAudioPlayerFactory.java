package me.go_gradually.soundrelay.infrastructure.audio;

import me.go_gradually.soundrelay.application.voice.port.AudioPlayer;
import me.go_gradually.soundrelay.application.voice.port.AudioPlayerFactory;
import me.go_gradually.soundrelay.application.voice.port.AudioPlayerListener;
import me.go_gradually.soundrelay.domain.voice.GuildId;
import org.springframework.stereotype.Component;

@Component
public class PcmAudioPlayerFactory implements AudioPlayerFactory {
    @Override
    public AudioPlayer create(GuildId guildId, AudioPlayerListener listener) {
        return new PcmAudioPlayer(guildId, listener);
    }
}
