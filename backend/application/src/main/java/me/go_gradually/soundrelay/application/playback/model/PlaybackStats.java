package me.go_gradually.soundrelay.application.playback.model;

public record PlaybackStats(long directVideos, long relayVideos, int recentFailures) {
}
