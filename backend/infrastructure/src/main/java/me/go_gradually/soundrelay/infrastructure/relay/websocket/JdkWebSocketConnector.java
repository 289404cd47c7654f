package me.go_gradually.soundrelay.infrastructure.relay.websocket;

import me.go_gradually.soundrelay.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;

@Component
public class JdkWebSocketConnector implements RelayTransportConnector {
    private final HttpClient httpClient;

    public JdkWebSocketConnector(AppProperties properties) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getRelay().getConnectTimeoutMs()))
                .build();
    }

    @Override
    public CompletableFuture<RelayTransport> connect(URI endpoint,
                                                     Map<String, String> headers,
                                                     RelayTransportListener listener) {
        SocketListener socketListener = new SocketListener(listener);
        WebSocket.Builder builder = httpClient.newWebSocketBuilder();
        headers.forEach(builder::header);
        return builder.buildAsync(endpoint, socketListener)
                .thenApply(webSocket -> new JdkWebSocketTransport(webSocket, socketListener.pendingPings));
    }

    private static final class JdkWebSocketTransport implements RelayTransport {
        private final WebSocket webSocket;
        private final Queue<CompletableFuture<Void>> pendingPings;
        private CompletableFuture<?> sendChain = CompletableFuture.completedFuture(null);

        private JdkWebSocketTransport(WebSocket webSocket, Queue<CompletableFuture<Void>> pendingPings) {
            this.webSocket = webSocket;
            this.pendingPings = pendingPings;
        }

        @Override
        public boolean isOpen() {
            return !webSocket.isOutputClosed() && !webSocket.isInputClosed();
        }

        @Override
        public synchronized CompletableFuture<Void> sendText(String payload) {
            // WebSocket은 직전 전송이 끝나기 전에 다음 전송을 허용하지 않는다.
            CompletableFuture<Void> sent = sendChain
                    .handle((ignored, error) -> null)
                    .thenCompose(ignored -> webSocket.sendText(payload, true))
                    .thenApply(ignored -> null);
            sendChain = sent;
            return sent;
        }

        @Override
        public synchronized CompletableFuture<Void> ping() {
            CompletableFuture<Void> pong = new CompletableFuture<>();
            pendingPings.add(pong);
            sendChain = sendChain
                    .handle((ignored, error) -> null)
                    .thenCompose(ignored -> webSocket.sendPing(ByteBuffer.allocate(0)))
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            pendingPings.remove(pong);
                            pong.completeExceptionally(error);
                        }
                    });
            return pong;
        }

        @Override
        public void close() {
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "shutdown")
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            webSocket.abort();
                        }
                    });
        }
    }

    private static final class SocketListener implements WebSocket.Listener {
        private final RelayTransportListener listener;
        private final Queue<CompletableFuture<Void>> pendingPings = new ConcurrentLinkedQueue<>();
        private final StringBuilder textBuffer = new StringBuilder();

        private SocketListener(RelayTransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String payload = textBuffer.toString();
                textBuffer.setLength(0);
                listener.onText(payload);
            }
            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
            CompletableFuture<Void> pong = pendingPings.poll();
            if (pong != null) {
                pong.complete(null);
            }
            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            failPendingPings(new IllegalStateException("Relay socket closed"));
            listener.onClose(statusCode, reason);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            failPendingPings(error);
            listener.onError(error);
        }

        private void failPendingPings(Throwable error) {
            CompletableFuture<Void> pong;
            while ((pong = pendingPings.poll()) != null) {
                pong.completeExceptionally(error);
            }
        }
    }
}
