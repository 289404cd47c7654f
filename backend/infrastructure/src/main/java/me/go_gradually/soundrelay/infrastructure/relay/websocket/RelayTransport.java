package me.go_gradually.soundrelay.infrastructure.relay.websocket;

import java.util.concurrent.CompletableFuture;

public interface RelayTransport {
    boolean isOpen();

    CompletableFuture<Void> sendText(String payload);

    /**
     * 대응하는 pong을 받으면 완료된다.
     */
    CompletableFuture<Void> ping();

    void close();
}
