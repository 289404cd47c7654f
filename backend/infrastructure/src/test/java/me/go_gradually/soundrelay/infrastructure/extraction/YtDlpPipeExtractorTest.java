package me.go_gradually.soundrelay.infrastructure.extraction;

import me.go_gradually.soundrelay.application.playback.model.ExtractionException;
import me.go_gradually.soundrelay.domain.playback.BotDetectionPolicy;
import me.go_gradually.soundrelay.domain.track.Track;
import me.go_gradually.soundrelay.infrastructure.shared.config.AppProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class YtDlpPipeExtractorTest {
    private static final Track TRACK = Track.of("vid1", "https://www.youtube.com/watch?v=vid1");

    @TempDir
    Path tempDir;

    @Test
    void open_throwsExtractionException_whenExecutableMissing() {
        YtDlpPipeExtractor extractor = new YtDlpPipeExtractor(properties(tempDir.resolve("missing-yt-dlp").toString()));

        ExtractionException error = assertThrows(ExtractionException.class, () -> extractor.open(TRACK));

        assertEquals("yt-dlp-pipe", error.getExtractor());
        assertTrue(error.getMessage().startsWith("Failed to start yt-dlp"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void open_surfacesStderr_whenProcessProducesNoAudio() throws Exception {
        Path script = script("""
                #!/bin/sh
                echo "ERROR: [youtube] vid1: Sign in to confirm you're not a bot" >&2
                exit 1
                """);
        YtDlpPipeExtractor extractor = new YtDlpPipeExtractor(properties(script.toString()));

        ExtractionException error = assertThrows(ExtractionException.class, () -> extractor.open(TRACK));

        assertTrue(BotDetectionPolicy.isBotDetection(error.getMessage()));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void open_givesUpWithinResolveTimeout_whenProcessStalls() throws Exception {
        Path script = script("""
                #!/bin/sh
                exec sleep 30
                """);
        AppProperties properties = properties(script.toString());
        properties.getIntegrations().getYtDlp().setResolveTimeoutSeconds(1);
        YtDlpPipeExtractor extractor = new YtDlpPipeExtractor(properties);

        ExtractionException error = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> assertThrows(ExtractionException.class, () -> extractor.open(TRACK)));

        assertEquals("yt-dlp produced no audio within 1s", error.getMessage());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void open_returnsProcessOutput() throws Exception {
        Path script = script("""
                #!/bin/sh
                printf 'audio'
                """);
        YtDlpPipeExtractor extractor = new YtDlpPipeExtractor(properties(script.toString()));

        try (InputStream stream = extractor.open(TRACK)) {
            assertEquals("audio", new String(stream.readAllBytes(), StandardCharsets.US_ASCII));
        }
    }

    private Path script(String body) throws Exception {
        Path script = tempDir.resolve("yt-dlp");
        Files.writeString(script, body, StandardCharsets.UTF_8);
        assertTrue(script.toFile().setExecutable(true));
        return script;
    }

    private static AppProperties properties(String executable) {
        AppProperties properties = new AppProperties();
        properties.getIntegrations().getYtDlp().setExecutable(executable);
        properties.getIntegrations().getYtDlp().setResolveTimeoutSeconds(5);
        return properties;
    }
}
