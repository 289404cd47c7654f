package me.go_gradually.soundrelay.infrastructure.extraction;

import me.go_gradually.soundrelay.application.playback.model.ExtractionException;
import me.go_gradually.soundrelay.application.playback.port.MediaExtractor;
import me.go_gradually.soundrelay.domain.track.Track;
import me.go_gradually.soundrelay.infrastructure.shared.config.AppProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * yt-dlp로 미디어 URL만 얻은 뒤 HTTP로 직접 받아온다.
 */
@Component
@Order(2)
public class YtDlpUrlExtractor implements MediaExtractor {
    private static final Logger log = Logger.getLogger(YtDlpUrlExtractor.class.getName());
    private static final String NAME = "yt-dlp-url";
    private final AppProperties.YtDlp config;
    private final HttpClient httpClient;

    public YtDlpUrlExtractor(AppProperties properties) {
        this.config = properties.getIntegrations().getYtDlp();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public InputStream open(Track track) {
        String mediaUrl = resolve(track);
        log.fine(() -> "extract.url resolved video=" + track.id());
        return fetch(URI.create(mediaUrl));
    }

    String resolve(Track track) {
        List<String> cmd = YtDlpCommand.resolveUrl(config, track.sourceUrl());
        Process process;
        try {
            process = new ProcessBuilder(cmd).start();
        } catch (IOException e) {
            throw new ExtractionException(NAME, "Failed to start yt-dlp: " + e.getMessage(), e);
        }
        ProcessErrorCollector errors = ProcessErrorCollector.start(process, "yt-dlp-url-stderr-" + track.id());
        String stdout;
        Duration timeout = Duration.ofSeconds(config.getResolveTimeoutSeconds());
        try (InputStream in = process.getInputStream();
             ProcessWatchdog watchdog = ProcessWatchdog.arm(process, timeout)) {
            stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            if (!process.waitFor(config.getResolveTimeoutSeconds(), TimeUnit.SECONDS) || watchdog.fired()) {
                process.destroyForcibly();
                throw new ExtractionException(NAME, "yt-dlp timed out after " + config.getResolveTimeoutSeconds() + "s");
            }
        } catch (IOException e) {
            process.destroyForcibly();
            throw new ExtractionException(NAME, "yt-dlp output unreadable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ExtractionException(NAME, "yt-dlp interrupted", e);
        }
        if (process.exitValue() != 0 || stdout.isBlank()) {
            String output = errors.awaitOutput(1_000);
            throw new ExtractionException(NAME, output.isBlank() ? "yt-dlp exited with " + process.exitValue() : output);
        }
        return stdout.lines().findFirst().orElseThrow().trim();
    }

    InputStream fetch(URI mediaUri) {
        HttpRequest request = HttpRequest.newBuilder(mediaUri).GET().build();
        try {
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            int status = response.statusCode();
            if (status / 100 != 2) {
                response.body().close();
                throw new ExtractionException(NAME, httpErrorMessage(status));
            }
            return response.body();
        } catch (IOException e) {
            throw new ExtractionException(NAME, "Media download failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException(NAME, "Media download interrupted", e);
        }
    }

    private static String httpErrorMessage(int status) {
        if (status == 429) {
            return "HTTP Error 429: Too Many Requests";
        }
        return "HTTP Error " + status;
    }
}
