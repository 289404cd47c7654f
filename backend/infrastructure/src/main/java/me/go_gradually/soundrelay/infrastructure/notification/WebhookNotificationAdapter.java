package me.go_gradually.soundrelay.infrastructure.notification;

import me.go_gradually.soundrelay.application.shared.model.OperatorAlert;
import me.go_gradually.soundrelay.application.shared.port.NotificationPort;
import me.go_gradually.soundrelay.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

@Component
public class WebhookNotificationAdapter implements NotificationPort {
    private static final Logger log = Logger.getLogger(WebhookNotificationAdapter.class.getName());
    private static final int COLOR_WARNING = 0xFFA500;
    private static final int COLOR_CRITICAL = 0xFF0000;
    private final WebClient webClient;
    private final String webhookUrl;
    private final Duration timeout;

    public WebhookNotificationAdapter(@Qualifier("notificationWebClient") WebClient webClient, AppProperties properties) {
        this.webClient = webClient;
        this.webhookUrl = properties.getIntegrations().getNotification().getWebhookUrl();
        this.timeout = Duration.ofMillis(properties.getIntegrations().getNotification().getTimeoutMs());
    }

    @Override
    public void notifyOperator(OperatorAlert alert) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.info("notification.webhook skipped reason=no_url title=" + alert.title());
            return;
        }
        try {
            webClient.post()
                    .uri(webhookUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload(alert))
                    .retrieve()
                    .toBodilessEntity()
                    .block(timeout);
            log.fine(() -> "notification.webhook sent title=" + alert.title());
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "notification.webhook failure title=" + alert.title(), e);
        }
    }

    private Map<String, Object> payload(OperatorAlert alert) {
        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", alert.title());
        embed.put("description", alert.description());
        embed.put("color", alert.severity() == OperatorAlert.Severity.CRITICAL ? COLOR_CRITICAL : COLOR_WARNING);
        embed.put("timestamp", Instant.now().toString());
        return Map.of("embeds", List.of(embed));
    }
}
