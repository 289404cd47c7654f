package me.go_gradually.soundrelay.application.playback.model;

public class NoHealthyRelayException extends NoPlaybackMethodAvailableException {
    public NoHealthyRelayException(String videoId) {
        super(videoId, "No healthy relay instance available for video " + videoId);
    }
}
