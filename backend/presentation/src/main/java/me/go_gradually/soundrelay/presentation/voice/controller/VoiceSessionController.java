package me.go_gradually.soundrelay.presentation.voice.controller;

import jakarta.validation.Valid;
import me.go_gradually.soundrelay.application.shared.event.Subscription;
import me.go_gradually.soundrelay.application.voice.model.VoiceSessionEvent;
import me.go_gradually.soundrelay.application.voice.usecase.VoiceSessionManager;
import me.go_gradually.soundrelay.domain.track.Track;
import me.go_gradually.soundrelay.domain.voice.GuildId;
import me.go_gradually.soundrelay.domain.voice.VoiceChannelRef;
import me.go_gradually.soundrelay.presentation.voice.dto.JoinRequest;
import me.go_gradually.soundrelay.presentation.voice.dto.PlayRequest;
import me.go_gradually.soundrelay.presentation.voice.dto.PlayResponse;
import me.go_gradually.soundrelay.presentation.voice.dto.SkipResponse;
import me.go_gradually.soundrelay.presentation.voice.dto.VoiceSessionResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

@RestController
@RequestMapping("/api/guilds/{guildId}/voice")
public class VoiceSessionController {
    private final VoiceSessionManager voiceSessionManager;

    public VoiceSessionController(VoiceSessionManager voiceSessionManager) {
        this.voiceSessionManager = voiceSessionManager;
    }

    @PostMapping
    public VoiceSessionResponse join(@PathVariable("guildId") String guildId,
                                     @Valid @RequestBody JoinRequest request) {
        GuildId guild = GuildId.of(guildId);
        voiceSessionManager.join(new VoiceChannelRef(guild, request.channelId(), request.channelName()));
        return status(guildId);
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void leave(@PathVariable("guildId") String guildId) {
        voiceSessionManager.leave(GuildId.of(guildId));
    }

    @GetMapping
    public VoiceSessionResponse status(@PathVariable("guildId") String guildId) {
        return voiceSessionManager.session(GuildId.of(guildId))
                .map(VoiceSessionResponse::from)
                .orElseThrow(() -> new NoSuchElementException("No voice session for guild " + guildId));
    }

    @PostMapping("/play")
    public CompletableFuture<PlayResponse> play(@PathVariable("guildId") String guildId,
                                                @Valid @RequestBody PlayRequest request) {
        Track track = new Track(
                request.videoId(),
                request.title(),
                request.url(),
                request.durationSeconds(),
                request.thumbnailUrl(),
                request.requestedBy()
        );
        return voiceSessionManager.play(track, GuildId.of(guildId))
                .thenApply(ignored -> new PlayResponse(track.id(), track.title(), guildId));
    }

    @PostMapping("/skip")
    public SkipResponse skip(@PathVariable("guildId") String guildId) {
        return new SkipResponse(voiceSessionManager.skip(GuildId.of(guildId)));
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable("guildId") String guildId) {
        SseEmitter emitter = new SseEmitter(Duration.ofMinutes(30).toMillis());
        AtomicBoolean open = new AtomicBoolean(true);
        Subscription subscription = voiceSessionManager.subscribe(GuildId.of(guildId), event -> send(emitter, open, event));
        emitter.onCompletion(() -> close(open, subscription));
        emitter.onTimeout(() -> close(open, subscription));
        return emitter;
    }

    private void send(SseEmitter emitter, AtomicBoolean open, VoiceSessionEvent event) {
        if (!open.get()) {
            return;
        }
        try {
            emitter.send(SseEmitter.event().name(eventName(event)).data(payload(event)));
            if (event instanceof VoiceSessionEvent.Disconnected) {
                emitter.complete();
            }
        } catch (IOException e) {
            emitter.completeWithError(e);
        }
    }

    private void close(AtomicBoolean open, Subscription subscription) {
        if (open.compareAndSet(true, false)) {
            subscription.unsubscribe();
        }
    }

    private static String eventName(VoiceSessionEvent event) {
        if (event instanceof VoiceSessionEvent.Finished) {
            return "finished";
        }
        if (event instanceof VoiceSessionEvent.PlaybackFailed) {
            return "playback_failed";
        }
        return "disconnected";
    }

    private static Map<String, String> payload(VoiceSessionEvent event) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("guildId", event.guildId().value());
        if (event instanceof VoiceSessionEvent.Finished finished) {
            payload.put("videoId", videoId(finished.track()));
        } else if (event instanceof VoiceSessionEvent.PlaybackFailed failed) {
            payload.put("videoId", videoId(failed.track()));
            payload.put("message", failed.message() == null ? "" : failed.message());
        } else if (event instanceof VoiceSessionEvent.Disconnected disconnected) {
            payload.put("reason", disconnected.reason());
        }
        return payload;
    }

    private static String videoId(Track track) {
        return track == null ? "" : track.id();
    }
}
