package me.go_gradually.soundrelay.infrastructure.audio;

public final class PcmFormat {
    public static final int SAMPLE_RATE = 48_000;
    public static final int CHANNELS = 2;
    public static final int BYTES_PER_SAMPLE = 2;
    public static final int FRAME_MILLIS = 20;
    public static final int FRAME_BYTES = SAMPLE_RATE / 1000 * FRAME_MILLIS * CHANNELS * BYTES_PER_SAMPLE;

    private PcmFormat() {
    }
}
