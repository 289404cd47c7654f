package me.go_gradually.soundrelay.domain.playback;

public enum PlaybackMethod {
    DIRECT("direct"),
    RELAY("neko");

    private final String code;

    PlaybackMethod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
