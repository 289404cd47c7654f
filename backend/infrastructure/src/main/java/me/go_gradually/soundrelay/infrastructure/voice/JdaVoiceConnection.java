package me.go_gradually.soundrelay.infrastructure.voice;

import me.go_gradually.soundrelay.application.voice.port.AudioPlayer;
import me.go_gradually.soundrelay.application.voice.port.VoiceConnection;
import me.go_gradually.soundrelay.application.voice.port.VoiceConnectionListener;
import me.go_gradually.soundrelay.domain.voice.ConnectionState;
import me.go_gradually.soundrelay.domain.voice.VoiceChannelRef;
import me.go_gradually.soundrelay.infrastructure.audio.PcmAudioPlayer;
import net.dv8tion.jda.api.audio.hooks.ConnectionListener;
import net.dv8tion.jda.api.audio.hooks.ConnectionStatus;
import net.dv8tion.jda.api.managers.AudioManager;

import java.util.logging.Logger;

class JdaVoiceConnection implements VoiceConnection, ConnectionListener {
    private static final Logger log = Logger.getLogger(JdaVoiceConnection.class.getName());
    private final VoiceChannelRef channel;
    private final AudioManager audioManager;
    private final VoiceConnectionListener listener;
    private volatile ConnectionState state = ConnectionState.SIGNALLING;
    private volatile boolean destroyed;

    JdaVoiceConnection(VoiceChannelRef channel, AudioManager audioManager, VoiceConnectionListener listener) {
        this.channel = channel;
        this.audioManager = audioManager;
        this.listener = listener;
    }

    @Override
    public VoiceChannelRef channel() {
        return channel;
    }

    @Override
    public ConnectionState state() {
        return state;
    }

    @Override
    public void subscribe(AudioPlayer player) {
        if (!(player instanceof PcmAudioPlayer pcmPlayer)) {
            throw new IllegalArgumentException("Unsupported audio player: " + player.getClass().getName());
        }
        audioManager.setSendingHandler(new PcmSendHandler(pcmPlayer));
    }

    @Override
    public void destroy() {
        if (destroyed) {
            return;
        }
        destroyed = true;
        state = ConnectionState.DESTROYED;
        audioManager.setSendingHandler(null);
        audioManager.setConnectionListener(null);
        audioManager.closeAudioConnection();
        log.fine(() -> "voice.connection destroyed guild=" + channel.guildId());
    }

    @Override
    public void onStatusChange(ConnectionStatus status) {
        if (destroyed) {
            return;
        }
        ConnectionState next = ConnectionStatusMapper.map(status);
        ConnectionState previous = state;
        log.fine(() -> "voice.connection status guild=" + channel.guildId() + " status=" + status + " state=" + next);
        if (previous == next) {
            return;
        }
        state = next;
        listener.onStateChange(previous, next);
    }
}
