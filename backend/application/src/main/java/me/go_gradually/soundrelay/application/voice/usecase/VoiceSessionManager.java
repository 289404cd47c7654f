package me.go_gradually.soundrelay.application.voice.usecase;

import me.go_gradually.soundrelay.application.playback.model.PlaybackContext;
import me.go_gradually.soundrelay.application.playback.model.PlaybackResult;
import me.go_gradually.soundrelay.application.playback.model.PlaybackStream;
import me.go_gradually.soundrelay.application.playback.usecase.PlaybackStrategyCoordinator;
import me.go_gradually.soundrelay.application.shared.event.EventChannel;
import me.go_gradually.soundrelay.application.shared.event.Subscription;
import me.go_gradually.soundrelay.application.shared.port.MetricsPort;
import me.go_gradually.soundrelay.application.shared.port.SchedulerPort;
import me.go_gradually.soundrelay.application.shared.timer.TimerRegistry;
import me.go_gradually.soundrelay.application.voice.model.NotConnectedException;
import me.go_gradually.soundrelay.application.voice.model.VoiceSessionEvent;
import me.go_gradually.soundrelay.application.voice.model.VoiceSessionSnapshot;
import me.go_gradually.soundrelay.application.voice.policy.VoicePolicy;
import me.go_gradually.soundrelay.application.voice.port.AudioPlayer;
import me.go_gradually.soundrelay.application.voice.port.AudioPlayerFactory;
import me.go_gradually.soundrelay.application.voice.port.AudioPlayerListener;
import me.go_gradually.soundrelay.application.voice.port.AudioResource;
import me.go_gradually.soundrelay.application.voice.port.AudioResourceFactory;
import me.go_gradually.soundrelay.application.voice.port.VoiceConnection;
import me.go_gradually.soundrelay.application.voice.port.VoiceGateway;
import me.go_gradually.soundrelay.domain.track.Track;
import me.go_gradually.soundrelay.domain.voice.ConnectionState;
import me.go_gradually.soundrelay.domain.voice.GuildId;
import me.go_gradually.soundrelay.domain.voice.GuildVoiceSession;
import me.go_gradually.soundrelay.domain.voice.PlayerState;
import me.go_gradually.soundrelay.domain.voice.VoiceChannelRef;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 길드별 음성 연결과 플레이어, 타이머, 이벤트 구독을 관리한다. 길드 상태는 하나의 런타임 항목에 모여 있고
 * 퇴장하거나 연결이 영구적으로 끊기면 통째로 제거된다.
 */
public class VoiceSessionManager {
    private static final Logger log = Logger.getLogger(VoiceSessionManager.class.getName());
    private final VoiceGateway voiceGateway;
    private final AudioPlayerFactory playerFactory;
    private final AudioResourceFactory resourceFactory;
    private final PlaybackStrategyCoordinator playbackCoordinator;
    private final SchedulerPort scheduler;
    private final VoicePolicy voicePolicy;
    private final MetricsPort metrics;
    private final Map<GuildId, GuildRuntime> runtimes = new ConcurrentHashMap<>();

    public VoiceSessionManager(VoiceGateway voiceGateway,
                               AudioPlayerFactory playerFactory,
                               AudioResourceFactory resourceFactory,
                               PlaybackStrategyCoordinator playbackCoordinator,
                               SchedulerPort scheduler,
                               VoicePolicy voicePolicy,
                               MetricsPort metrics) {
        this.voiceGateway = voiceGateway;
        this.playerFactory = playerFactory;
        this.resourceFactory = resourceFactory;
        this.playbackCoordinator = playbackCoordinator;
        this.scheduler = scheduler;
        this.voicePolicy = voicePolicy;
        this.metrics = metrics;
    }

    public VoiceConnection join(VoiceChannelRef channel) {
        GuildId guildId = channel.guildId();
        GuildRuntime previous = runtimes.remove(guildId);
        if (previous != null) {
            log.info("voice.join superseding guild=" + guildId + " previousChannel=" + previous.session.channel().channelId());
            teardown(previous, "superseded");
        }
        GuildRuntime runtime = new GuildRuntime(new GuildVoiceSession(channel), new TimerRegistry<>(scheduler));
        runtimes.put(guildId, runtime);
        try {
            runtime.player = playerFactory.create(guildId, new PlayerEvents(runtime));
            runtime.connection = voiceGateway.connect(channel,
                    (before, after) -> handleConnectionState(runtime, after));
            runtime.connection.subscribe(runtime.player);
        } catch (RuntimeException e) {
            runtimes.remove(guildId, runtime);
            teardown(runtime, "join_failed");
            throw e;
        }
        log.info("voice.join guild=" + guildId + " channel=" + channel.channelId());
        return runtime.connection;
    }

    public void leave(GuildId guildId) {
        GuildRuntime runtime = runtimes.remove(guildId);
        if (runtime == null) {
            log.fine(() -> "voice.leave ignored guild=" + guildId + " reason=no_session");
            return;
        }
        teardown(runtime, "left");
        log.info("voice.leave guild=" + guildId);
    }

    public CompletableFuture<Void> play(Track track, GuildId guildId) {
        GuildRuntime runtime = requireRuntime(guildId);
        runtime.timers.cancel(TimerKind.IDLE_DISCONNECT);
        runtime.session.clearIdleDisconnect();
        Instant startedAt = scheduler.now();
        PlaybackContext context = new PlaybackContext(guildId, error -> handleStreamError(runtime, error));
        return playbackCoordinator.attemptPlayback(track, context)
                .thenAccept(result -> startPlayback(runtime, track, result, startedAt))
                .whenComplete((ignored, error) -> {
                    if (error == null) {
                        return;
                    }
                    log.warning("voice.play failure guild=" + guildId + " video=" + track.id()
                            + " message=" + error.getMessage());
                    if (isCurrent(runtime) && !runtime.player.state().isActive()) {
                        armIdleDisconnect(runtime);
                    }
                });
    }

    public boolean skip(GuildId guildId) {
        GuildRuntime runtime = requireRuntime(guildId);
        boolean stopped = runtime.player.stop(false);
        log.info("voice.skip guild=" + guildId + " stopped=" + stopped);
        return stopped;
    }

    public boolean isPlaying(GuildId guildId) {
        GuildRuntime runtime = runtimes.get(guildId);
        return runtime != null && runtime.player != null && runtime.player.state() == PlayerState.PLAYING;
    }

    public Subscription subscribe(GuildId guildId, Consumer<VoiceSessionEvent> listener) {
        return requireRuntime(guildId).events.subscribe(listener);
    }

    public Optional<VoiceSessionSnapshot> session(GuildId guildId) {
        return Optional.ofNullable(runtimes.get(guildId)).map(runtime -> VoiceSessionSnapshot.of(runtime.session));
    }

    public List<VoiceSessionSnapshot> sessions() {
        return runtimes.values().stream().map(runtime -> VoiceSessionSnapshot.of(runtime.session)).toList();
    }

    public int activeSessionCount() {
        return runtimes.size();
    }

    public void stopAll() {
        for (GuildId guildId : List.copyOf(runtimes.keySet())) {
            leave(guildId);
        }
    }

    private void startPlayback(GuildRuntime runtime, Track track, PlaybackResult result, Instant startedAt) {
        PlaybackStream stream = result.stream();
        if (!isCurrent(runtime)) {
            stream.closeQuietly();
            throw new NotConnectedException(runtime.session.guildId());
        }
        AudioResource resource;
        try {
            resource = resourceFactory.create(stream);
        } catch (RuntimeException e) {
            stream.closeQuietly();
            throw e;
        }
        PlaybackStream previous = runtime.stream;
        runtime.stream = stream;
        runtime.session.startTrack(track);
        runtime.player.play(resource);
        if (previous != null && previous != stream) {
            previous.closeQuietly();
        }
        metrics.recordPlaybackStartLatency(Duration.between(startedAt, scheduler.now()));
        log.info("voice.play guild=" + runtime.session.guildId() + " video=" + track.id()
                + " method=" + result.method().code());
    }

    private void handleConnectionState(GuildRuntime runtime, ConnectionState next) {
        if (!isCurrent(runtime)) {
            return;
        }
        runtime.session.applyConnectionState(next);
        if (runtime.player != null) {
            runtime.player.connectionReadinessChanged(next == ConnectionState.READY);
        }
        GuildId guildId = runtime.session.guildId();
        switch (next) {
            case DISCONNECTED -> runtime.timers.arm(TimerKind.RECOVERY, voicePolicy.recoveryWindow(),
                    () -> onRecoveryExpired(runtime));
            case SIGNALLING, CONNECTING, READY -> {
                if (runtime.timers.cancel(TimerKind.RECOVERY)) {
                    metrics.incrementVoiceRecovery();
                    log.info("voice.connection recovered guild=" + guildId + " state=" + next);
                }
            }
            case DESTROYED -> {
                if (runtimes.remove(guildId, runtime)) {
                    teardown(runtime, "destroyed");
                }
            }
        }
    }

    private void onRecoveryExpired(GuildRuntime runtime) {
        if (runtime.session.connectionState() != ConnectionState.DISCONNECTED) {
            return;
        }
        GuildId guildId = runtime.session.guildId();
        if (!runtimes.remove(guildId, runtime)) {
            return;
        }
        log.warning("voice.connection lost guild=" + guildId + " window=" + voicePolicy.recoveryWindow().toMillis() + "ms");
        metrics.incrementVoiceConnectionLost();
        teardown(runtime, "connection_lost");
    }

    private void handlePlayerState(GuildRuntime runtime, PlayerState previous, PlayerState next) {
        if (!isCurrent(runtime)) {
            return;
        }
        runtime.session.applyPlayerState(next);
        if (next == PlayerState.PLAYING) {
            runtime.timers.cancel(TimerKind.IDLE_DISCONNECT);
            return;
        }
        if (next != PlayerState.IDLE || previous == PlayerState.IDLE) {
            return;
        }
        Optional<Track> finished = runtime.session.finishTrack();
        closeStream(runtime);
        if (!runtime.errorPending) {
            runtime.events.publish(new VoiceSessionEvent.Finished(runtime.session.guildId(), finished.orElse(null)));
        }
        armIdleDisconnect(runtime);
    }

    private void handlePlayerError(GuildRuntime runtime, Throwable error) {
        if (!isCurrent(runtime)) {
            return;
        }
        GuildId guildId = runtime.session.guildId();
        log.log(Level.WARNING, "voice.player error guild=" + guildId, error);
        metrics.incrementPlayerError();
        runtime.errorPending = true;
        Track failed = runtime.session.finishTrack().orElse(null);
        runtime.events.publish(new VoiceSessionEvent.PlaybackFailed(guildId, failed, String.valueOf(error.getMessage())));
        runtime.player.stop(true);
        runtime.timers.arm(TimerKind.ERROR_GRACE, voicePolicy.errorGraceDelay(), () -> {
            runtime.errorPending = false;
            runtime.events.publish(new VoiceSessionEvent.Finished(guildId, failed));
        });
    }

    private void handleStreamError(GuildRuntime runtime, Throwable error) {
        if (!isCurrent(runtime)) {
            return;
        }
        log.warning("voice.stream error guild=" + runtime.session.guildId() + " message=" + error.getMessage());
        runtime.player.stop(true);
    }

    private void armIdleDisconnect(GuildRuntime runtime) {
        Duration timeout = voicePolicy.idleDisconnectTimeout();
        runtime.session.scheduleIdleDisconnect(scheduler.now().plus(timeout));
        runtime.timers.arm(TimerKind.IDLE_DISCONNECT, timeout, () -> {
            GuildId guildId = runtime.session.guildId();
            if (isCurrent(runtime) && runtime.session.isIdleExpired(scheduler.now())) {
                log.info("voice.idle disconnect guild=" + guildId);
                leave(guildId);
            }
        });
    }

    private void teardown(GuildRuntime runtime, String reason) {
        runtime.timers.cancelAll();
        if (runtime.player != null) {
            try {
                runtime.player.stop(true);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "voice.teardown player failure guild=" + runtime.session.guildId(), e);
            }
        }
        closeStream(runtime);
        if (runtime.connection != null) {
            try {
                runtime.connection.destroy();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "voice.teardown connection failure guild=" + runtime.session.guildId(), e);
            }
        }
        runtime.session.applyConnectionState(ConnectionState.DESTROYED);
        runtime.events.publish(new VoiceSessionEvent.Disconnected(runtime.session.guildId(), reason));
        runtime.events.close();
    }

    private void closeStream(GuildRuntime runtime) {
        PlaybackStream stream = runtime.stream;
        runtime.stream = null;
        if (stream != null) {
            stream.closeQuietly();
        }
    }

    private GuildRuntime requireRuntime(GuildId guildId) {
        GuildRuntime runtime = runtimes.get(guildId);
        if (runtime == null) {
            throw new NotConnectedException(guildId);
        }
        return runtime;
    }

    private boolean isCurrent(GuildRuntime runtime) {
        return runtimes.get(runtime.session.guildId()) == runtime;
    }

    private enum TimerKind {
        IDLE_DISCONNECT,
        RECOVERY,
        ERROR_GRACE
    }

    private static final class GuildRuntime {
        private final GuildVoiceSession session;
        private final TimerRegistry<TimerKind> timers;
        private final EventChannel<VoiceSessionEvent> events = new EventChannel<>();
        private volatile VoiceConnection connection;
        private volatile AudioPlayer player;
        private volatile PlaybackStream stream;
        private volatile boolean errorPending;

        private GuildRuntime(GuildVoiceSession session, TimerRegistry<TimerKind> timers) {
            this.session = session;
            this.timers = timers;
        }
    }

    private final class PlayerEvents implements AudioPlayerListener {
        private final GuildRuntime runtime;

        private PlayerEvents(GuildRuntime runtime) {
            this.runtime = runtime;
        }

        @Override
        public void onStateChange(PlayerState previous, PlayerState next) {
            handlePlayerState(runtime, previous, next);
        }

        @Override
        public void onError(Throwable error) {
            handlePlayerError(runtime, error);
        }
    }
}
