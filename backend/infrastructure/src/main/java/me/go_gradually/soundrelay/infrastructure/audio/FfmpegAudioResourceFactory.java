package me.go_gradually.soundrelay.infrastructure.audio;

import me.go_gradually.soundrelay.application.voice.port.AudioResource;
import me.go_gradually.soundrelay.application.voice.port.AudioResourceFactory;
import me.go_gradually.soundrelay.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * ffmpeg가 읽을 수 있는 입력을 48kHz 스테레오 16bit big-endian PCM으로 변환한다.
 */
@Component
public class FfmpegAudioResourceFactory implements AudioResourceFactory {
    private final AppProperties.Ffmpeg config;

    public FfmpegAudioResourceFactory(AppProperties properties) {
        this.config = properties.getIntegrations().getFfmpeg();
    }

    @Override
    public AudioResource create(InputStream source) {
        List<String> cmd = command();
        try {
            Process process = new ProcessBuilder(cmd)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            return FfmpegAudioResource.start(source, process);
        } catch (IOException e) {
            closeQuietly(source);
            throw new IllegalStateException("Failed to start ffmpeg: " + e.getMessage(), e);
        }
    }

    List<String> command() {
        return List.of(
                config.getExecutable(),
                "-hide_banner",
                "-loglevel", "error",
                "-i", "pipe:0",
                "-f", "s16be",
                "-ar", String.valueOf(PcmFormat.SAMPLE_RATE),
                "-ac", String.valueOf(PcmFormat.CHANNELS),
                "pipe:1"
        );
    }

    private static void closeQuietly(InputStream source) {
        try {
            source.close();
        } catch (IOException ignored) {
            // 원본 스트림 정리 실패는 무시
        }
    }
}
