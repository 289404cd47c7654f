package me.go_gradually.soundrelay.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.soundrelay.application.playback.policy.PlaybackPolicy;
import me.go_gradually.soundrelay.application.playback.port.AudioCapturePort;
import me.go_gradually.soundrelay.application.playback.port.MediaExtractor;
import me.go_gradually.soundrelay.application.playback.usecase.FailureTracker;
import me.go_gradually.soundrelay.application.playback.usecase.PlaybackStrategyCoordinator;
import me.go_gradually.soundrelay.application.relay.policy.RelayPolicy;
import me.go_gradually.soundrelay.application.relay.port.RelayInstanceFactory;
import me.go_gradually.soundrelay.application.relay.usecase.RelayPool;
import me.go_gradually.soundrelay.application.relay.usecase.RelaySessionStore;
import me.go_gradually.soundrelay.application.shared.port.AsyncExecutor;
import me.go_gradually.soundrelay.application.shared.port.KeyValueStorePort;
import me.go_gradually.soundrelay.application.shared.port.MetricsPort;
import me.go_gradually.soundrelay.application.shared.port.NotificationPort;
import me.go_gradually.soundrelay.application.shared.port.SchedulerPort;
import me.go_gradually.soundrelay.application.voice.policy.VoicePolicy;
import me.go_gradually.soundrelay.application.voice.port.AudioPlayerFactory;
import me.go_gradually.soundrelay.application.voice.port.AudioResourceFactory;
import me.go_gradually.soundrelay.application.voice.port.VoiceGateway;
import me.go_gradually.soundrelay.application.voice.usecase.VoiceSessionManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class UseCaseConfig {
    @Bean
    public FailureTracker failureTracker(KeyValueStorePort keyValueStore,
                                         SchedulerPort scheduler,
                                         PlaybackPolicy playbackPolicy) {
        return new FailureTracker(keyValueStore, scheduler, playbackPolicy);
    }

    @Bean
    public RelaySessionStore relaySessionStore(KeyValueStorePort keyValueStore, ObjectMapper objectMapper) {
        return new RelaySessionStore(keyValueStore, objectMapper);
    }

    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    public RelayPool relayPool(RelayInstanceFactory relayInstanceFactory,
                               RelaySessionStore relaySessionStore,
                               NotificationPort notificationPort,
                               SchedulerPort scheduler,
                               RelayPolicy relayPolicy,
                               MetricsPort metricsPort) {
        return new RelayPool(relayInstanceFactory, relaySessionStore, notificationPort, scheduler, relayPolicy, metricsPort);
    }

    @Bean
    public PlaybackStrategyCoordinator playbackStrategyCoordinator(List<MediaExtractor> mediaExtractors,
                                                                   AudioCapturePort audioCapturePort,
                                                                   RelayPool relayPool,
                                                                   FailureTracker failureTracker,
                                                                   KeyValueStorePort keyValueStore,
                                                                   AsyncExecutor asyncExecutor,
                                                                   PlaybackPolicy playbackPolicy,
                                                                   MetricsPort metricsPort) {
        return new PlaybackStrategyCoordinator(
                mediaExtractors,
                audioCapturePort,
                relayPool,
                failureTracker,
                keyValueStore,
                asyncExecutor,
                playbackPolicy,
                metricsPort
        );
    }

    @Bean(destroyMethod = "stopAll")
    public VoiceSessionManager voiceSessionManager(VoiceGateway voiceGateway,
                                                   AudioPlayerFactory audioPlayerFactory,
                                                   AudioResourceFactory audioResourceFactory,
                                                   PlaybackStrategyCoordinator playbackStrategyCoordinator,
                                                   SchedulerPort scheduler,
                                                   VoicePolicy voicePolicy,
                                                   MetricsPort metricsPort) {
        return new VoiceSessionManager(
                voiceGateway,
                audioPlayerFactory,
                audioResourceFactory,
                playbackStrategyCoordinator,
                scheduler,
                voicePolicy,
                metricsPort
        );
    }
}
