package me.go_gradually.soundrelay.application.playback.model;

public class NoPlaybackMethodAvailableException extends RuntimeException {
    private final String videoId;

    public NoPlaybackMethodAvailableException(String videoId, String message) {
        super(message);
        this.videoId = videoId;
    }

    public NoPlaybackMethodAvailableException(String videoId, String message, Throwable cause) {
        super(message, cause);
        this.videoId = videoId;
    }

    public String getVideoId() {
        return videoId;
    }
}
