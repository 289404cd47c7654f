package me.go_gradually.soundrelay.infrastructure.audio;

import me.go_gradually.soundrelay.application.voice.port.AudioPlayer;
import me.go_gradually.soundrelay.application.voice.port.AudioPlayerListener;
import me.go_gradually.soundrelay.application.voice.port.AudioResource;
import me.go_gradually.soundrelay.domain.voice.GuildId;
import me.go_gradually.soundrelay.domain.voice.PlayerState;

import java.io.IOException;
import java.util.logging.Logger;

/**
 * 풀 방식 플레이어. 음성 전송 계층이 {@link #provideFrame()}으로 20ms 프레임을 하나씩 가져간다.
 */
public class PcmAudioPlayer implements AudioPlayer {
    private static final Logger log = Logger.getLogger(PcmAudioPlayer.class.getName());
    private final GuildId guildId;
    private final AudioPlayerListener listener;
    private final Object lock = new Object();
    private PlayerState state = PlayerState.IDLE;
    private AudioResource resource;
    private boolean connectionReady;

    public PcmAudioPlayer(GuildId guildId, AudioPlayerListener listener) {
        this.guildId = guildId;
        this.listener = listener;
    }

    @Override
    public PlayerState state() {
        synchronized (lock) {
            return state;
        }
    }

    @Override
    public void play(AudioResource next) {
        AudioResource replaced;
        Transition transition;
        synchronized (lock) {
            replaced = resource;
            resource = next;
            transition = moveTo(PlayerState.BUFFERING);
        }
        if (replaced != null && replaced != next) {
            replaced.close();
        }
        fire(transition);
    }

    @Override
    public boolean stop(boolean force) {
        AudioResource stopped;
        Transition transition;
        synchronized (lock) {
            if (state == PlayerState.IDLE) {
                return false;
            }
            stopped = resource;
            resource = null;
            transition = moveTo(PlayerState.IDLE);
        }
        if (stopped != null) {
            stopped.close();
        }
        fire(transition);
        return true;
    }

    @Override
    public boolean pause() {
        Transition transition;
        synchronized (lock) {
            if (state != PlayerState.PLAYING && state != PlayerState.BUFFERING) {
                return false;
            }
            transition = moveTo(PlayerState.PAUSED);
        }
        fire(transition);
        return true;
    }

    @Override
    public boolean unpause() {
        Transition transition;
        synchronized (lock) {
            if (state != PlayerState.PAUSED) {
                return false;
            }
            transition = moveTo(PlayerState.PLAYING);
        }
        fire(transition);
        return true;
    }

    @Override
    public void connectionReadinessChanged(boolean ready) {
        Transition transition = null;
        synchronized (lock) {
            connectionReady = ready;
            if (!ready && state == PlayerState.PLAYING) {
                transition = moveTo(PlayerState.AUTO_PAUSED);
            } else if (ready && state == PlayerState.AUTO_PAUSED) {
                transition = moveTo(PlayerState.PLAYING);
            }
        }
        fire(transition);
    }

    public boolean canProvide() {
        synchronized (lock) {
            return connectionReady && resource != null
                    && (state == PlayerState.PLAYING || state == PlayerState.BUFFERING);
        }
    }

    /**
     * 보낼 프레임이 없으면 null
     */
    public byte[] provideFrame() {
        AudioResource current;
        synchronized (lock) {
            if (resource == null || (state != PlayerState.PLAYING && state != PlayerState.BUFFERING)) {
                return null;
            }
            current = resource;
        }
        byte[] frame = new byte[PcmFormat.FRAME_BYTES];
        int read;
        try {
            read = current.readFrame(frame);
        } catch (IOException e) {
            log.warning("audio.player read failure guild=" + guildId + " message=" + e.getMessage());
            listener.onError(e);
            stop(true);
            return null;
        }
        if (read < 0) {
            finish(current);
            return null;
        }
        Transition transition = null;
        synchronized (lock) {
            if (resource == current && state == PlayerState.BUFFERING) {
                transition = moveTo(PlayerState.PLAYING);
            }
        }
        fire(transition);
        return frame;
    }

    private void finish(AudioResource finished) {
        Transition transition;
        synchronized (lock) {
            if (resource != finished) {
                return;
            }
            resource = null;
            transition = moveTo(PlayerState.IDLE);
        }
        finished.close();
        log.fine(() -> "audio.player finished guild=" + guildId);
        fire(transition);
    }

    private Transition moveTo(PlayerState next) {
        PlayerState previous = state;
        state = next;
        return previous == next ? null : new Transition(previous, next);
    }

    private void fire(Transition transition) {
        if (transition != null) {
            listener.onStateChange(transition.previous(), transition.next());
        }
    }

    private record Transition(PlayerState previous, PlayerState next) {
    }
}
