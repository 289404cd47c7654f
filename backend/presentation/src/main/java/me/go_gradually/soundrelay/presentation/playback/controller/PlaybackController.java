package me.go_gradually.soundrelay.presentation.playback.controller;

import me.go_gradually.soundrelay.application.playback.usecase.PlaybackStrategyCoordinator;
import me.go_gradually.soundrelay.presentation.playback.dto.PlaybackStatsResponse;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/playback")
public class PlaybackController {
    private final PlaybackStrategyCoordinator playbackCoordinator;

    public PlaybackController(PlaybackStrategyCoordinator playbackCoordinator) {
        this.playbackCoordinator = playbackCoordinator;
    }

    @GetMapping("/stats")
    public PlaybackStatsResponse stats() {
        return PlaybackStatsResponse.from(playbackCoordinator.getStats());
    }

    @PutMapping("/videos/{videoId}/force-relay")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void forceRelay(@PathVariable("videoId") String videoId) {
        if (videoId == null || videoId.isBlank()) {
            throw new IllegalArgumentException("videoId is required");
        }
        playbackCoordinator.forceRelay(videoId);
    }
}
