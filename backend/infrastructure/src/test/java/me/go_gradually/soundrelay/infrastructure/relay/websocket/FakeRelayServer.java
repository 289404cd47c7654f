package me.go_gradually.soundrelay.infrastructure.relay.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 원격 브라우저 서버를 대신하는 인프로세스 구현. 연결 시 세션 id를 부여하고 호스트 제어권을 실제 서버처럼
 * 하나만 허용한다.
 */
class FakeRelayServer implements RelayTransportConnector {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    final List<Connection> connections = new ArrayList<>();
    boolean refuseConnections;
    boolean sendInitOnConnect = true;
    boolean answerPings = true;
    String controlHost;

    @Override
    public CompletableFuture<RelayTransport> connect(URI endpoint,
                                                     Map<String, String> headers,
                                                     RelayTransportListener listener) {
        Connection connection = new Connection(endpoint, headers, listener, "session-" + (connections.size() + 1));
        connections.add(connection);
        if (refuseConnections) {
            return CompletableFuture.failedFuture(new IOException("connection refused"));
        }
        if (sendInitOnConnect) {
            listener.onText("{\"event\":\"system/init\",\"session_id\":\"" + connection.sessionId
                    + "\",\"control_host\":null,\"members\":[{\"id\":\"" + connection.sessionId + "\"}]}");
        }
        return CompletableFuture.completedFuture(connection);
    }

    Connection last() {
        return connections.get(connections.size() - 1);
    }

    void broadcast(String payload) {
        for (Connection connection : List.copyOf(connections)) {
            if (connection.open) {
                connection.listener.onText(payload);
            }
        }
    }

    final class Connection implements RelayTransport {
        final URI endpoint;
        final Map<String, String> headers;
        final RelayTransportListener listener;
        final String sessionId;
        final List<JsonNode> received = new ArrayList<>();
        final List<CompletableFuture<Void>> pings = new ArrayList<>();
        boolean open = true;

        private Connection(URI endpoint, Map<String, String> headers, RelayTransportListener listener, String sessionId) {
            this.endpoint = endpoint;
            this.headers = headers;
            this.listener = listener;
            this.sessionId = sessionId;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public CompletableFuture<Void> sendText(String payload) {
            JsonNode message = parse(payload);
            received.add(message);
            String event = message.path("event").asText();
            if (event.equals("control/request")) {
                if (controlHost == null) {
                    controlHost = sessionId;
                    broadcast("{\"event\":\"control/locked\",\"id\":\"" + sessionId + "\"}");
                } else if (!controlHost.equals(sessionId)) {
                    broadcast("{\"event\":\"control/requesting\",\"id\":\"" + sessionId + "\"}");
                }
            } else if (event.equals("control/release") && sessionId.equals(controlHost)) {
                controlHost = null;
                broadcast("{\"event\":\"control/release\",\"id\":\"" + sessionId + "\"}");
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<Void> ping() {
            CompletableFuture<Void> pong = answerPings
                    ? CompletableFuture.completedFuture(null)
                    : new CompletableFuture<>();
            pings.add(pong);
            return pong;
        }

        @Override
        public void close() {
            drop(1000, "closed by client");
        }

        void deliver(String payload) {
            listener.onText(payload);
        }

        void drop(int code, String reason) {
            if (!open) {
                return;
            }
            open = false;
            if (sessionId.equals(controlHost)) {
                controlHost = null;
            }
            listener.onClose(code, reason);
        }

        List<String> events() {
            return received.stream().map(node -> node.path("event").asText()).toList();
        }
    }

    private static JsonNode parse(String payload) {
        try {
            return MAPPER.readTree(payload);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
