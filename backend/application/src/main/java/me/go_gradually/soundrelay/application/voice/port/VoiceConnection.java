package me.go_gradually.soundrelay.application.voice.port;

import me.go_gradually.soundrelay.domain.voice.ConnectionState;
import me.go_gradually.soundrelay.domain.voice.VoiceChannelRef;

public interface VoiceConnection {
    VoiceChannelRef channel();

    ConnectionState state();

    void subscribe(AudioPlayer player);

    void destroy();
}
