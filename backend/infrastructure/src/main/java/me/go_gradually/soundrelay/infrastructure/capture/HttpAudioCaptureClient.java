package me.go_gradually.soundrelay.infrastructure.capture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.soundrelay.application.playback.port.AudioCapturePort;
import me.go_gradually.soundrelay.domain.relay.RelayInstanceId;
import me.go_gradually.soundrelay.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

@Component
public class HttpAudioCaptureClient implements AudioCapturePort {
    private static final Logger log = Logger.getLogger(HttpAudioCaptureClient.class.getName());
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String baseUrl;
    private final Duration requestTimeout;

    public HttpAudioCaptureClient(AppProperties properties) {
        AppProperties.Capture capture = properties.getIntegrations().getCapture();
        this.baseUrl = trimTrailingSlash(capture.getBaseUrl());
        this.requestTimeout = Duration.ofMillis(capture.getConnectTimeoutMs());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(capture.getConnectTimeoutMs()))
                .build();
    }

    @Override
    public InputStream openCapture(RelayInstanceId instanceId) {
        // 응답 헤더까지만 제한한다. 본문 스트림은 곡이 끝날 때까지 열려 있다.
        HttpRequest request = HttpRequest.newBuilder(captureUri(instanceId))
                .timeout(requestTimeout)
                .header("Accept", "audio/opus")
                .GET()
                .build();
        HttpResponse<InputStream> response = send(request, HttpResponse.BodyHandlers.ofInputStream());
        if (response.statusCode() != 200) {
            closeQuietly(response.body());
            throw new IllegalStateException("Audio capture failed for " + instanceId + " status=" + response.statusCode());
        }
        log.info("capture.open instance=" + instanceId);
        return response.body();
    }

    @Override
    public void stopCapture(RelayInstanceId instanceId) {
        HttpRequest request = HttpRequest.newBuilder(captureUri(instanceId))
                .timeout(requestTimeout)
                .DELETE()
                .build();
        try {
            HttpResponse<Void> response = send(request, HttpResponse.BodyHandlers.discarding());
            log.fine(() -> "capture.stop instance=" + instanceId + " status=" + response.statusCode());
        } catch (IllegalStateException e) {
            log.log(Level.WARNING, "capture.stop failure instance=" + instanceId, e);
        }
    }

    @Override
    public List<String> activeCaptures() {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/streams"))
                .timeout(requestTimeout)
                .GET()
                .build();
        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IllegalStateException("Audio capture stream listing failed status=" + response.statusCode());
        }
        try {
            JsonNode root = objectMapper.readTree(response.body());
            List<String> streams = new ArrayList<>();
            root.path("activeStreams").forEach(node -> streams.add(node.asText()));
            return streams;
        } catch (IOException e) {
            throw new IllegalStateException("Invalid audio capture stream listing", e);
        }
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(request, handler);
        } catch (IOException e) {
            throw new IllegalStateException("Audio capture request failed: " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Audio capture request interrupted: " + request.uri(), e);
        }
    }

    private URI captureUri(RelayInstanceId instanceId) {
        return URI.create(baseUrl + "/capture/" + URLEncoder.encode(instanceId.value(), StandardCharsets.UTF_8));
    }

    private static String trimTrailingSlash(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Audio capture base url is required");
        }
        String trimmed = value.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private static void closeQuietly(InputStream stream) {
        try {
            stream.close();
        } catch (IOException e) {
            log.fine(() -> "capture.close failure message=" + e.getMessage());
        }
    }
}
