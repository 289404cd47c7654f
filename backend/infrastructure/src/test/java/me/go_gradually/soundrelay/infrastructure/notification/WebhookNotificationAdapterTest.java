package me.go_gradually.soundrelay.infrastructure.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.soundrelay.application.shared.model.OperatorAlert;
import me.go_gradually.soundrelay.infrastructure.shared.config.AppProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class WebhookNotificationAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void notifyOperator_postsEmbedWithSeverityColor() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        WebhookNotificationAdapter adapter = new WebhookNotificationAdapter(WebClient.builder().build(),
                properties(server.url("/hooks/relay").toString()));

        adapter.notifyOperator(OperatorAlert.critical("No relay available", "All relay instances are logged out"));

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/hooks/relay", request.getPath());
        JsonNode embed = objectMapper.readTree(request.getBody().readUtf8()).path("embeds").get(0);
        assertEquals("No relay available", embed.path("title").asText());
        assertEquals("All relay instances are logged out", embed.path("description").asText());
        assertEquals(0xFF0000, embed.path("color").asInt());
        assertFalse(embed.path("timestamp").asText().isBlank());
    }

    @Test
    void notifyOperator_swallowsServerErrors() {
        server.enqueue(new MockResponse().setResponseCode(500));
        WebhookNotificationAdapter adapter = new WebhookNotificationAdapter(WebClient.builder().build(),
                properties(server.url("/hooks/relay").toString()));

        assertDoesNotThrow(() -> adapter.notifyOperator(OperatorAlert.warning("Session expired", "neko-1")));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void notifyOperator_skipsWhenWebhookIsNotConfigured() {
        WebhookNotificationAdapter adapter = new WebhookNotificationAdapter(WebClient.builder().build(), properties(""));

        adapter.notifyOperator(OperatorAlert.warning("Session expired", "neko-1"));

        assertEquals(0, server.getRequestCount());
    }

    private static AppProperties properties(String webhookUrl) {
        AppProperties properties = new AppProperties();
        properties.getIntegrations().getNotification().setWebhookUrl(webhookUrl);
        properties.getIntegrations().getNotification().setTimeoutMs(2_000);
        return properties;
    }
}
