package me.go_gradually.soundrelay.application.voice.port;

import me.go_gradually.soundrelay.domain.voice.VoiceChannelRef;

public interface VoiceGateway {
    VoiceConnection connect(VoiceChannelRef channel, VoiceConnectionListener listener);
}
