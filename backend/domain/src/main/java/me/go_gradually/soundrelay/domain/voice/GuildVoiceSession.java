package me.go_gradually.soundrelay.domain.voice;

import me.go_gradually.soundrelay.domain.track.Track;

import java.time.Instant;
import java.util.Optional;

public class GuildVoiceSession {
    private final VoiceChannelRef channel;
    private ConnectionState connectionState = ConnectionState.CONNECTING;
    private PlayerState playerState = PlayerState.IDLE;
    private Track currentTrack;
    private Instant idleDisconnectAt;

    public GuildVoiceSession(VoiceChannelRef channel) {
        if (channel == null) {
            throw new IllegalArgumentException("Voice channel is required");
        }
        this.channel = channel;
    }

    public GuildId guildId() {
        return channel.guildId();
    }

    public VoiceChannelRef channel() {
        return channel;
    }

    public synchronized ConnectionState connectionState() {
        return connectionState;
    }

    public synchronized PlayerState playerState() {
        return playerState;
    }

    public synchronized Optional<Track> currentTrack() {
        return Optional.ofNullable(currentTrack);
    }

    public synchronized Optional<Instant> idleDisconnectAt() {
        return Optional.ofNullable(idleDisconnectAt);
    }

    public synchronized ConnectionState applyConnectionState(ConnectionState next) {
        if (next == null) {
            throw new IllegalArgumentException("Connection state is required");
        }
        if (connectionState.isTerminal() && !next.isTerminal()) {
            throw new IllegalStateException("Voice session for guild " + guildId() + " is already destroyed");
        }
        ConnectionState previous = connectionState;
        connectionState = next;
        return previous;
    }

    public synchronized PlayerState applyPlayerState(PlayerState next) {
        if (next == null) {
            throw new IllegalArgumentException("Player state is required");
        }
        PlayerState previous = playerState;
        playerState = next;
        if (next == PlayerState.PLAYING) {
            idleDisconnectAt = null;
        }
        return previous;
    }

    public synchronized void startTrack(Track track) {
        if (track == null) {
            throw new IllegalArgumentException("Track is required");
        }
        currentTrack = track;
        idleDisconnectAt = null;
    }

    public synchronized Optional<Track> finishTrack() {
        Track finished = currentTrack;
        currentTrack = null;
        return Optional.ofNullable(finished);
    }

    public synchronized void scheduleIdleDisconnect(Instant at) {
        idleDisconnectAt = at;
    }

    public synchronized void clearIdleDisconnect() {
        idleDisconnectAt = null;
    }

    public synchronized boolean isIdleExpired(Instant now) {
        return idleDisconnectAt != null && !now.isBefore(idleDisconnectAt);
    }

    public synchronized boolean isDestroyed() {
        return connectionState.isTerminal();
    }
}
