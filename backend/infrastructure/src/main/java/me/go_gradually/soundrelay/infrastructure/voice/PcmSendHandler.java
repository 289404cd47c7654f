package me.go_gradually.soundrelay.infrastructure.voice;

import me.go_gradually.soundrelay.infrastructure.audio.PcmAudioPlayer;
import net.dv8tion.jda.api.audio.AudioSendHandler;

import java.nio.ByteBuffer;

final class PcmSendHandler implements AudioSendHandler {
    private final PcmAudioPlayer player;

    PcmSendHandler(PcmAudioPlayer player) {
        this.player = player;
    }

    @Override
    public boolean canProvide() {
        return player.canProvide();
    }

    @Override
    public ByteBuffer provide20MsAudio() {
        byte[] frame = player.provideFrame();
        return frame == null ? null : ByteBuffer.wrap(frame);
    }

    @Override
    public boolean isOpus() {
        return false;
    }
}
