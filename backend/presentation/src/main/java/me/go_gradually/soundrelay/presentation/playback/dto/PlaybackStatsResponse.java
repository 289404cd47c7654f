package me.go_gradually.soundrelay.presentation.playback.dto;

import me.go_gradually.soundrelay.application.playback.model.PlaybackStats;

public record PlaybackStatsResponse(long directVideos, long relayVideos, int recentFailures) {
    public static PlaybackStatsResponse from(PlaybackStats stats) {
        return new PlaybackStatsResponse(stats.directVideos(), stats.relayVideos(), stats.recentFailures());
    }
}
