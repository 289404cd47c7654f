package me.go_gradually.soundrelay.infrastructure.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
public class WebClientConfig {
    @Bean("notificationWebClient")
    public WebClient notificationWebClient(AppProperties properties) {
        Duration timeout = Duration.ofMillis(properties.getIntegrations().getNotification().getTimeoutMs());
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(createHttpClient(timeout)))
                .build();
    }

    private HttpClient createHttpClient(Duration timeout) {
        ConnectionProvider provider = ConnectionProvider.builder("soundrelay-webhook")
                .maxConnections(10)
                .pendingAcquireTimeout(Duration.ofSeconds(30))
                .build();
        return HttpClient.create(provider).responseTimeout(timeout);
    }
}
