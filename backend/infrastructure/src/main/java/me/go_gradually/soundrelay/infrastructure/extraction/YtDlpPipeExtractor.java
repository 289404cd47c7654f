package me.go_gradually.soundrelay.infrastructure.extraction;

import me.go_gradually.soundrelay.application.playback.model.ExtractionException;
import me.go_gradually.soundrelay.application.playback.port.MediaExtractor;
import me.go_gradually.soundrelay.domain.track.Track;
import me.go_gradually.soundrelay.infrastructure.shared.config.AppProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * yt-dlp 표준 출력으로 최상 음질 오디오를 스트리밍한다.
 */
@Component
@Order(1)
public class YtDlpPipeExtractor implements MediaExtractor {
    private static final Logger log = Logger.getLogger(YtDlpPipeExtractor.class.getName());
    private static final String NAME = "yt-dlp-pipe";
    private final AppProperties.YtDlp config;

    public YtDlpPipeExtractor(AppProperties properties) {
        this.config = properties.getIntegrations().getYtDlp();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public InputStream open(Track track) {
        List<String> cmd = YtDlpCommand.streamToStdout(config, track.sourceUrl());
        log.fine(() -> "extract.pipe start video=" + track.id() + " cmd=" + String.join(" ", cmd));
        Process process = start(cmd);
        ProcessErrorCollector errors = ProcessErrorCollector.start(process, "yt-dlp-stderr-" + track.id());
        PushbackInputStream stdout = new PushbackInputStream(process.getInputStream(), 1);
        // 첫 바이트가 나올 때까지 기다려 추출 실패를 동기적으로 드러낸다.
        try (ProcessWatchdog watchdog = ProcessWatchdog.arm(process, Duration.ofSeconds(config.getResolveTimeoutSeconds()))) {
            int first = readFirstByte(stdout, process, watchdog);
            if (first < 0) {
                if (watchdog.fired()) {
                    throw timedOut();
                }
                throw failure(process, errors);
            }
            stdout.unread(first);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new ExtractionException(NAME, "yt-dlp stream failed: " + e.getMessage(), e);
        }
        return new ProcessBoundStream(stdout, process);
    }

    private int readFirstByte(InputStream stdout, Process process, ProcessWatchdog watchdog) {
        try {
            return stdout.read();
        } catch (IOException e) {
            process.destroyForcibly();
            if (watchdog.fired()) {
                throw timedOut();
            }
            throw new ExtractionException(NAME, "yt-dlp stream failed: " + e.getMessage(), e);
        }
    }

    private ExtractionException timedOut() {
        return new ExtractionException(NAME, "yt-dlp produced no audio within " + config.getResolveTimeoutSeconds() + "s");
    }

    private Process start(List<String> cmd) {
        try {
            return new ProcessBuilder(cmd).start();
        } catch (IOException e) {
            throw new ExtractionException(NAME, "Failed to start yt-dlp: " + e.getMessage(), e);
        }
    }

    private ExtractionException failure(Process process, ProcessErrorCollector errors) {
        int exitCode = waitForExit(process);
        String output = errors.awaitOutput(1_000);
        String message = output.isBlank() ? "yt-dlp produced no audio (exit " + exitCode + ")" : output;
        return new ExtractionException(NAME, message);
    }

    private int waitForExit(Process process) {
        try {
            if (process.waitFor(config.getResolveTimeoutSeconds(), TimeUnit.SECONDS)) {
                return process.exitValue();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        process.destroyForcibly();
        return -1;
    }

    private static final class ProcessBoundStream extends FilterInputStream {
        private final Process process;

        private ProcessBoundStream(InputStream in, Process process) {
            super(in);
            this.process = process;
        }

        @Override
        public void close() throws IOException {
            try {
                super.close();
            } finally {
                process.destroy();
            }
        }
    }
}
