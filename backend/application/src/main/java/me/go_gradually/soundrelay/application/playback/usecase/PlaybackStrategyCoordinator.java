package me.go_gradually.soundrelay.application.playback.usecase;

import me.go_gradually.soundrelay.application.playback.model.ExtractionException;
import me.go_gradually.soundrelay.application.playback.model.NoHealthyRelayException;
import me.go_gradually.soundrelay.application.playback.model.NoPlaybackMethodAvailableException;
import me.go_gradually.soundrelay.application.playback.model.PlaybackContext;
import me.go_gradually.soundrelay.application.playback.model.PlaybackResult;
import me.go_gradually.soundrelay.application.playback.model.PlaybackStats;
import me.go_gradually.soundrelay.application.playback.model.PlaybackStream;
import me.go_gradually.soundrelay.application.playback.policy.PlaybackPolicy;
import me.go_gradually.soundrelay.application.playback.port.AudioCapturePort;
import me.go_gradually.soundrelay.application.playback.port.MediaExtractor;
import me.go_gradually.soundrelay.application.relay.port.RelayInstance;
import me.go_gradually.soundrelay.application.relay.usecase.RelayPool;
import me.go_gradually.soundrelay.application.shared.port.AsyncExecutor;
import me.go_gradually.soundrelay.application.shared.port.KeyValueStorePort;
import me.go_gradually.soundrelay.application.shared.port.MetricsPort;
import me.go_gradually.soundrelay.domain.playback.BotDetectionPolicy;
import me.go_gradually.soundrelay.domain.playback.PlaybackMethod;
import me.go_gradually.soundrelay.domain.track.Track;

import java.io.InputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 곡마다 직접 추출과 브라우저 릴레이 중 하나를 골라 읽을 수 있는 오디오 스트림을 돌려준다.
 */
public class PlaybackStrategyCoordinator {
    private static final Logger log = Logger.getLogger(PlaybackStrategyCoordinator.class.getName());
    private static final String FORCE_RELAY_PREFIX = "video:force_neko:";
    private static final String HISTORY_KEY = "video:history";
    private static final String METHOD_SET_PREFIX = "videos:";
    private final List<MediaExtractor> extractors;
    private final AudioCapturePort audioCapture;
    private final RelayPool relayPool;
    private final FailureTracker failureTracker;
    private final KeyValueStorePort store;
    private final AsyncExecutor asyncExecutor;
    private final PlaybackPolicy policy;
    private final MetricsPort metrics;

    public PlaybackStrategyCoordinator(List<MediaExtractor> extractors,
                                       AudioCapturePort audioCapture,
                                       RelayPool relayPool,
                                       FailureTracker failureTracker,
                                       KeyValueStorePort store,
                                       AsyncExecutor asyncExecutor,
                                       PlaybackPolicy policy,
                                       MetricsPort metrics) {
        if (extractors == null || extractors.isEmpty()) {
            throw new IllegalArgumentException("At least one media extractor is required");
        }
        this.extractors = List.copyOf(extractors);
        this.audioCapture = audioCapture;
        this.relayPool = relayPool;
        this.failureTracker = failureTracker;
        this.store = store;
        this.asyncExecutor = asyncExecutor;
        this.policy = policy;
        this.metrics = metrics;
    }

    public CompletableFuture<PlaybackResult> attemptPlayback(Track track, PlaybackContext context) {
        String videoId = track.id();
        if (isForcedToRelay(videoId)) {
            log.info("playback.route method=relay video=" + videoId + " reason=forced");
            return playViaRelay(track, context);
        }
        int failures = failureTracker.count(videoId);
        if (BotDetectionPolicy.shouldPreferRelay(failures, policy.failureThreshold())) {
            log.info("playback.route method=relay video=" + videoId + " reason=failures count=" + failures);
            return playViaRelay(track, context);
        }
        return CompletableFuture.supplyAsync(() -> playDirect(track, context), asyncExecutor::execute)
                .exceptionallyCompose(error -> {
                    Throwable cause = unwrap(error);
                    if (!(cause instanceof ExtractionException extraction)) {
                        return CompletableFuture.failedFuture(cause);
                    }
                    metrics.incrementDirectFailure();
                    if (!isBotDetection(extraction)) {
                        log.warning("playback.direct failure video=" + videoId + " message=" + extraction.getMessage());
                        return CompletableFuture.failedFuture(extraction);
                    }
                    log.warning("playback.direct bot_detection video=" + videoId + " message=" + extraction.getMessage());
                    metrics.incrementBotDetection();
                    failureTracker.recordFailure(videoId);
                    return playViaRelay(track, context);
                });
    }

    public void forceRelay(String videoId) {
        if (videoId == null || videoId.isBlank()) {
            throw new IllegalArgumentException("videoId is required");
        }
        store.set(FORCE_RELAY_PREFIX + videoId, "1", policy.forceRelayTtl());
        log.info("playback.force_relay video=" + videoId + " ttl=" + policy.forceRelayTtl().toSeconds() + "s");
    }

    public PlaybackStats getStats() {
        return new PlaybackStats(
                store.setMembers(METHOD_SET_PREFIX + PlaybackMethod.DIRECT.code()).size(),
                store.setMembers(METHOD_SET_PREFIX + PlaybackMethod.RELAY.code()).size(),
                failureTracker.recentFailures()
        );
    }

    private PlaybackResult playDirect(Track track, PlaybackContext context) {
        InputStream source = openWithExtractors(track);
        PlaybackStream stream = PlaybackStream.wrap(source)
                .onError(error -> context.streamErrorHandler().accept(error));
        failureTracker.clear(track.id());
        recordHistory(track.id(), PlaybackMethod.DIRECT);
        metrics.incrementDirectPlayback();
        log.info("playback.direct success video=" + track.id() + " guild=" + context.guildId());
        return new PlaybackResult(PlaybackMethod.DIRECT, stream);
    }

    private InputStream openWithExtractors(Track track) {
        ExtractionException last = null;
        for (MediaExtractor extractor : extractors) {
            try {
                return extractor.open(track);
            } catch (ExtractionException e) {
                log.fine(() -> "playback.extract failure extractor=" + extractor.name()
                        + " video=" + track.id() + " message=" + e.getMessage());
                if (last != null) {
                    e.addSuppressed(last);
                }
                last = e;
            }
        }
        throw last;
    }

    private CompletableFuture<PlaybackResult> playViaRelay(Track track, PlaybackContext context) {
        String videoId = track.id();
        return relayPool.acquire(track.sourceUrl()).thenCompose(found -> {
            if (found.isEmpty()) {
                metrics.incrementPlaybackUnavailable();
                return CompletableFuture.failedFuture(new NoHealthyRelayException(videoId));
            }
            RelayInstance instance = found.get();
            log.info("playback.relay start video=" + videoId + " instance=" + instance.id());
            return instance.playVideo(track.sourceUrl())
                    .thenApply(ignored -> openCapture(instance, track, context))
                    .exceptionallyCompose(error -> {
                        relayPool.release(instance.id(), track.sourceUrl());
                        metrics.incrementPlaybackUnavailable();
                        Throwable cause = unwrap(error);
                        log.log(Level.WARNING, "playback.relay failure video=" + videoId + " instance=" + instance.id(), cause);
                        return CompletableFuture.failedFuture(new NoPlaybackMethodAvailableException(
                                videoId, "Relay playback failed for video " + videoId, cause));
                    });
        });
    }

    private PlaybackResult openCapture(RelayInstance instance, Track track, PlaybackContext context) {
        InputStream capture = audioCapture.openCapture(instance.id());
        PlaybackStream stream = PlaybackStream.wrap(capture)
                .onError(error -> context.streamErrorHandler().accept(error))
                .onClose(() -> {
                    audioCapture.stopCapture(instance.id());
                    relayPool.release(instance.id(), track.sourceUrl());
                });
        recordHistory(track.id(), PlaybackMethod.RELAY);
        metrics.incrementRelayPlayback();
        return new PlaybackResult(PlaybackMethod.RELAY, stream);
    }

    private boolean isForcedToRelay(String videoId) {
        return store.get(FORCE_RELAY_PREFIX + videoId).isPresent();
    }

    private static boolean isBotDetection(ExtractionException error) {
        if (BotDetectionPolicy.isBotDetection(error.getMessage())) {
            return true;
        }
        for (Throwable suppressed : error.getSuppressed()) {
            if (BotDetectionPolicy.isBotDetection(suppressed.getMessage())) {
                return true;
            }
        }
        return false;
    }

    private void recordHistory(String videoId, PlaybackMethod method) {
        try {
            store.hashPut(HISTORY_KEY, videoId, method.code());
            store.setAdd(METHOD_SET_PREFIX + method.code(), videoId);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "playback.history failure video=" + videoId, e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
