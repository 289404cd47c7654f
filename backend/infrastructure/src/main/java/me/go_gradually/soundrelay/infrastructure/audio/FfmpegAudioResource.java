package me.go_gradually.soundrelay.infrastructure.audio;

import me.go_gradually.soundrelay.application.voice.port.AudioResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

final class FfmpegAudioResource implements AudioResource {
    private static final Logger log = Logger.getLogger(FfmpegAudioResource.class.getName());
    private final InputStream source;
    private final InputStream pcm;
    private final Process process;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile IOException pumpFailure;

    private FfmpegAudioResource(InputStream source, InputStream pcm, Process process) {
        this.source = source;
        this.pcm = pcm;
        this.process = process;
    }

    static FfmpegAudioResource start(InputStream source, Process process) {
        FfmpegAudioResource resource = new FfmpegAudioResource(source, process.getInputStream(), process);
        Thread pump = new Thread(resource::pump, "ffmpeg-pump-" + process.pid());
        pump.setDaemon(true);
        pump.start();
        return resource;
    }

    @Override
    public int readFrame(byte[] frame) throws IOException {
        if (pumpFailure != null) {
            throw pumpFailure;
        }
        int read = pcm.readNBytes(frame, 0, frame.length);
        if (read == 0) {
            if (pumpFailure != null) {
                throw pumpFailure;
            }
            return -1;
        }
        if (read < frame.length) {
            Arrays.fill(frame, read, frame.length, (byte) 0);
        }
        return frame.length;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            source.close();
        } catch (IOException e) {
            log.fine(() -> "audio.ffmpeg source close failed message=" + e.getMessage());
        }
        process.destroy();
    }

    private void pump() {
        try (OutputStream stdin = process.getOutputStream()) {
            source.transferTo(stdin);
        } catch (IOException e) {
            if (!closed.get()) {
                pumpFailure = e;
                log.warning("audio.ffmpeg pump failure message=" + e.getMessage());
                process.destroy();
            }
        }
    }
}
