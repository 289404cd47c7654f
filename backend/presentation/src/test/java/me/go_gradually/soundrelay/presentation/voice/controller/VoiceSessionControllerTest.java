package me.go_gradually.soundrelay.presentation.voice.controller;

import me.go_gradually.soundrelay.application.playback.model.NoHealthyRelayException;
import me.go_gradually.soundrelay.application.voice.model.NotConnectedException;
import me.go_gradually.soundrelay.application.voice.model.VoiceSessionEvent;
import me.go_gradually.soundrelay.application.voice.model.VoiceSessionSnapshot;
import me.go_gradually.soundrelay.application.voice.usecase.VoiceSessionManager;
import me.go_gradually.soundrelay.domain.track.Track;
import me.go_gradually.soundrelay.domain.voice.ConnectionState;
import me.go_gradually.soundrelay.domain.voice.GuildId;
import me.go_gradually.soundrelay.domain.voice.PlayerState;
import me.go_gradually.soundrelay.domain.voice.VoiceChannelRef;
import me.go_gradually.soundrelay.presentation.TestBootApplication;
import me.go_gradually.soundrelay.presentation.shared.error.ApiExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = {TestBootApplication.class, VoiceSessionController.class, ApiExceptionHandler.class})
@AutoConfigureMockMvc
class VoiceSessionControllerTest {
    private static final GuildId GUILD = GuildId.of("g1");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private VoiceSessionManager voiceSessionManager;

    @Test
    void join_connectsAndReturnsSessionSnapshot() throws Exception {
        when(voiceSessionManager.session(GUILD)).thenReturn(Optional.of(new VoiceSessionSnapshot(
                "g1", "c1", ConnectionState.SIGNALLING, PlayerState.IDLE, null,
                Instant.parse("2026-01-01T00:05:00Z"))));

        mockMvc.perform(post("/api/guilds/g1/voice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "channelId":"c1",
                                  "channelName":"music"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.guildId").value("g1"))
                .andExpect(jsonPath("$.channelId").value("c1"))
                .andExpect(jsonPath("$.connectionState").value("SIGNALLING"))
                .andExpect(jsonPath("$.playerState").value("IDLE"));

        ArgumentCaptor<VoiceChannelRef> captor = ArgumentCaptor.forClass(VoiceChannelRef.class);
        verify(voiceSessionManager).join(captor.capture());
        assertEquals(GUILD, captor.getValue().guildId());
        assertEquals("c1", captor.getValue().channelId());
        assertEquals("music", captor.getValue().name());
    }

    @Test
    void join_returnsBadRequest_whenChannelIdMissing() throws Exception {
        mockMvc.perform(post("/api/guilds/g1/voice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verify(voiceSessionManager, never()).join(any());
    }

    @Test
    void leave_returnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/guilds/g1/voice"))
                .andExpect(status().isNoContent());

        verify(voiceSessionManager).leave(GUILD);
    }

    @Test
    void status_returnsNotFound_whenNoSession() throws Exception {
        when(voiceSessionManager.session(GUILD)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/guilds/g1/voice"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No voice session for guild g1"));
    }

    @Test
    void status_includesCurrentTrack() throws Exception {
        Track track = new Track("vid1", "Song", "https://www.youtube.com/watch?v=vid1", 180, null, "user-1");
        when(voiceSessionManager.session(GUILD)).thenReturn(Optional.of(new VoiceSessionSnapshot(
                "g1", "c1", ConnectionState.READY, PlayerState.PLAYING, track, null)));

        mockMvc.perform(get("/api/guilds/g1/voice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.playerState").value("PLAYING"))
                .andExpect(jsonPath("$.currentTrack.videoId").value("vid1"))
                .andExpect(jsonPath("$.currentTrack.requestedBy").value("user-1"));
    }

    @Test
    void play_returnsTrackOncePlaybackStarts() throws Exception {
        when(voiceSessionManager.play(any(), eq(GUILD))).thenReturn(CompletableFuture.completedFuture(null));

        MvcResult result = mockMvc.perform(post("/api/guilds/g1/voice/play")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "videoId":"vid1",
                                  "title":"Song",
                                  "url":"https://www.youtube.com/watch?v=vid1",
                                  "durationSeconds":180,
                                  "requestedBy":"user-1"
                                }
                                """))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.videoId").value("vid1"))
                .andExpect(jsonPath("$.title").value("Song"));

        ArgumentCaptor<Track> captor = ArgumentCaptor.forClass(Track.class);
        verify(voiceSessionManager).play(captor.capture(), eq(GUILD));
        assertEquals("https://www.youtube.com/watch?v=vid1", captor.getValue().sourceUrl());
        assertEquals(180, captor.getValue().durationSeconds());
    }

    @Test
    void play_returnsConflict_whenNotConnected() throws Exception {
        when(voiceSessionManager.play(any(), eq(GUILD))).thenThrow(new NotConnectedException(GUILD));

        mockMvc.perform(post("/api/guilds/g1/voice/play")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"videoId":"vid1","url":"https://www.youtube.com/watch?v=vid1"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("NOT_CONNECTED"));
    }

    @Test
    void play_returnsServiceUnavailable_whenNoRelayIsHealthy() throws Exception {
        when(voiceSessionManager.play(any(), eq(GUILD)))
                .thenReturn(CompletableFuture.failedFuture(new NoHealthyRelayException("vid1")));

        MvcResult result = mockMvc.perform(post("/api/guilds/g1/voice/play")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"videoId":"vid1","url":"https://www.youtube.com/watch?v=vid1"}
                                """))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("NO_PLAYBACK_METHOD"));
    }

    @Test
    void play_returnsBadRequest_whenUrlMissing() throws Exception {
        mockMvc.perform(post("/api/guilds/g1/voice/play")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"videoId":"vid1"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("url")));
    }

    @Test
    void skip_returnsWhetherSomethingWasStopped() throws Exception {
        when(voiceSessionManager.skip(GUILD)).thenReturn(true);

        mockMvc.perform(post("/api/guilds/g1/voice/skip"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skipped").value(true));
    }

    @Test
    @SuppressWarnings("unchecked")
    void events_streamsSessionEventsAsServerSentEvents() throws Exception {
        ArgumentCaptor<Consumer<VoiceSessionEvent>> listener = ArgumentCaptor.forClass(Consumer.class);
        when(voiceSessionManager.subscribe(eq(GUILD), listener.capture())).thenReturn(() -> {
        });

        MvcResult result = mockMvc.perform(get("/api/guilds/g1/voice/events"))
                .andExpect(request().asyncStarted())
                .andReturn();

        listener.getValue().accept(new VoiceSessionEvent.Finished(GUILD, Track.of("vid1", "https://youtu.be/vid1")));

        String body = result.getResponse().getContentAsString();
        assertTrue(body.contains("event:finished"));
        assertTrue(body.contains("\"videoId\":\"vid1\""));
    }
}
