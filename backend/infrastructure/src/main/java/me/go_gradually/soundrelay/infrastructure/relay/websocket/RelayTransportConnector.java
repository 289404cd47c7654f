package me.go_gradually.soundrelay.infrastructure.relay.websocket;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public interface RelayTransportConnector {
    CompletableFuture<RelayTransport> connect(URI endpoint, Map<String, String> headers, RelayTransportListener listener);
}
