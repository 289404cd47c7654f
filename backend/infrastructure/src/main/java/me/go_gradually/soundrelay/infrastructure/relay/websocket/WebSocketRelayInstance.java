package me.go_gradually.soundrelay.infrastructure.relay.websocket;

import me.go_gradually.soundrelay.application.relay.model.RelayProtocolTimeoutException;
import me.go_gradually.soundrelay.application.relay.port.RelayInstance;
import me.go_gradually.soundrelay.application.shared.event.EventChannel;
import me.go_gradually.soundrelay.application.shared.event.Subscription;
import me.go_gradually.soundrelay.application.shared.port.MetricsPort;
import me.go_gradually.soundrelay.application.shared.port.ScheduledHandle;
import me.go_gradually.soundrelay.application.shared.port.SchedulerPort;
import me.go_gradually.soundrelay.application.shared.timer.TimerRegistry;
import me.go_gradually.soundrelay.domain.relay.BrowserCookie;
import me.go_gradually.soundrelay.domain.relay.ReconnectPolicy;
import me.go_gradually.soundrelay.domain.relay.RelayConnectionState;
import me.go_gradually.soundrelay.domain.relay.RelayInstanceId;
import me.go_gradually.soundrelay.infrastructure.shared.config.AppProperties;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * 제어 WebSocket으로 원격 브라우저 하나를 조작한다. 연결 시도마다 세대 번호를 매기고
 * 이전 세대의 콜백은 무시한다.
 */
public class WebSocketRelayInstance implements RelayInstance {
    static final int KEY_CONTROL_L = 0xFFE3;
    static final int KEY_RETURN = 0xFF0D;
    static final int KEY_SPACE = 0x0020;
    static final int KEY_L = 0x006C;
    static final int CLICK_X = 640;
    static final int CLICK_Y = 360;
    private static final Duration CLICK_HOLD = Duration.ofMillis(50);
    private static final Duration KEY_SPACING = Duration.ofMillis(10);
    private static final Duration NAVIGATION_PAUSE = Duration.ofMillis(100);
    private static final Logger log = Logger.getLogger(WebSocketRelayInstance.class.getName());

    private final RelayInstanceId id;
    private final AppProperties.Relay settings;
    private final RelayTransportConnector connector;
    private final RelayMessageCodec codec;
    private final SchedulerPort scheduler;
    private final MetricsPort metrics;
    private final ReconnectPolicy reconnectPolicy;
    private final TimerRegistry<TimerKind> timers;
    private final EventChannel<RelayMessage> controlEvents = new EventChannel<>();
    private final AtomicInteger generation = new AtomicInteger();
    private final AtomicReference<String> currentVideo = new AtomicReference<>();
    private volatile RelayConnectionState connectionState = RelayConnectionState.DISCONNECTED;
    private volatile RelayTransport transport;
    private volatile boolean authenticated;
    private volatile boolean control;
    private volatile boolean kicked;
    private volatile String sessionId;
    private volatile String controlHost;
    private volatile Instant lastUsedAt = Instant.EPOCH;
    private volatile int reconnectAttempts;
    private volatile List<BrowserCookie> cookies = List.of();
    private volatile CompletableFuture<Void> pendingControl;

    public WebSocketRelayInstance(RelayInstanceId id,
                                  AppProperties.Relay settings,
                                  RelayTransportConnector connector,
                                  RelayMessageCodec codec,
                                  SchedulerPort scheduler,
                                  MetricsPort metrics) {
        this.id = id;
        this.settings = settings;
        this.connector = connector;
        this.codec = codec;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.reconnectPolicy = ReconnectPolicy.of(
                Duration.ofMillis(settings.getReconnectBaseDelayMs()), settings.getMaxReconnectAttempts());
        this.timers = new TimerRegistry<>(scheduler);
    }

    @Override
    public RelayInstanceId id() {
        return id;
    }

    @Override
    public RelayConnectionState connectionState() {
        return connectionState;
    }

    @Override
    public boolean isAuthenticated() {
        return authenticated;
    }

    @Override
    public boolean hasControl() {
        return control;
    }

    @Override
    public Optional<String> currentVideo() {
        return Optional.ofNullable(currentVideo.get());
    }

    @Override
    public Instant lastUsedAt() {
        return lastUsedAt;
    }

    @Override
    public Optional<String> sessionId() {
        return Optional.ofNullable(sessionId);
    }

    @Override
    public Optional<String> controlHost() {
        return Optional.ofNullable(controlHost);
    }

    @Override
    public int reconnectAttempts() {
        return reconnectAttempts;
    }

    boolean isKicked() {
        return kicked;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        if (kicked) {
            log.warning("relay.connect skipped instance=" + id + " reason=kicked");
            return CompletableFuture.completedFuture(null);
        }
        return connect().handle((ignored, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                log.warning("relay.connect failure instance=" + id + " message=" + cause.getMessage());
                connectionState = RelayConnectionState.DISCONNECTED;
                scheduleReconnect();
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> requestControl() {
        if (control) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> inFlight = pendingControl;
        if (inFlight != null && !inFlight.isDone()) {
            return inFlight;
        }
        CompletableFuture<Void> granted = new CompletableFuture<>();
        pendingControl = granted;
        Subscription subscription = controlEvents.subscribe(message -> {
            if (message instanceof RelayMessage.ControlLocked locked && locked.id().equals(sessionId)) {
                granted.complete(null);
            }
        });
        timers.arm(TimerKind.CONTROL_TIMEOUT, Duration.ofMillis(settings.getControlTimeoutMs()),
                () -> granted.completeExceptionally(new RelayProtocolTimeoutException("control/request",
                        "Control request timed out for " + id)));
        granted.whenComplete((ignored, error) -> {
            subscription.unsubscribe();
            timers.cancel(TimerKind.CONTROL_TIMEOUT);
        });
        send(new RelayCommand.RequestControl());
        return granted;
    }

    @Override
    public void releaseControl() {
        if (!control) {
            return;
        }
        send(new RelayCommand.ReleaseControl());
        control = false;
    }

    @Override
    public CompletableFuture<Void> sendMouseMove(int x, int y) {
        return requestControl().thenCompose(ignored -> send(new RelayCommand.MouseMove(x, y)));
    }

    @Override
    public CompletableFuture<Void> sendMouseClick(int x, int y) {
        return requestControl()
                .thenCompose(ignored -> send(new RelayCommand.MouseDown(x, y, 0)))
                .thenCompose(ignored -> scheduler.delay(CLICK_HOLD))
                .thenCompose(ignored -> send(new RelayCommand.MouseUp(x, y, 0)));
    }

    @Override
    public CompletableFuture<Void> sendKey(int keysym, boolean pressed) {
        RelayCommand command = pressed ? new RelayCommand.KeyDown(keysym) : new RelayCommand.KeyUp(keysym);
        return requestControl().thenCompose(ignored -> send(command));
    }

    @Override
    public CompletableFuture<Void> sendText(String text) {
        CompletableFuture<Void> chain = requestControl();
        for (int codePoint : text.codePoints().toArray()) {
            int keysym = keysymFor(codePoint);
            chain = chain
                    .thenCompose(ignored -> tapKey(keysym))
                    .thenCompose(ignored -> scheduler.delay(KEY_SPACING));
        }
        return chain;
    }

    @Override
    public CompletableFuture<Void> navigate(String url) {
        return releasingControl(navigateSequence(url));
    }

    @Override
    public CompletableFuture<Void> playVideo(String url) {
        currentVideo.set(url);
        lastUsedAt = scheduler.now();
        log.info("relay.play instance=" + id + " url=" + url);
        CompletableFuture<Void> sequence = navigateSequence(url)
                .thenCompose(ignored -> scheduler.delay(Duration.ofMillis(settings.getSettleDelayMs())))
                .thenCompose(ignored -> sendMouseClick(CLICK_X, CLICK_Y));
        return releasingControl(sequence).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warning("relay.play failure instance=" + id + " message=" + unwrap(error).getMessage());
            }
        });
    }

    @Override
    public CompletableFuture<Void> pause() {
        return releasingControl(tapKey(KEY_SPACE));
    }

    @Override
    public CompletableFuture<Void> resume() {
        // 스페이스 키는 재생/일시정지 토글이다.
        return releasingControl(tapKey(KEY_SPACE));
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        RelayTransport current = transport;
        if (current == null || !current.isOpen() || !authenticated) {
            return CompletableFuture.completedFuture(false);
        }
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        ScheduledHandle timeout = scheduler.schedule(() -> {
            if (result.complete(false)) {
                log.warning("relay.health timeout instance=" + id);
            }
        }, Duration.ofMillis(settings.getHealthCheckTimeoutMs()));
        current.ping().whenComplete((ignored, error) -> {
            timeout.cancel();
            if (error != null) {
                log.warning("relay.health failure instance=" + id + " message=" + unwrap(error).getMessage());
            }
            result.complete(error == null);
        });
        return result;
    }

    @Override
    public CompletableFuture<Void> restart() {
        log.info("relay.restart instance=" + id);
        shutdown();
        kicked = false;
        return scheduler.delay(Duration.ofMillis(settings.getRestartDelayMs()))
                .thenCompose(ignored -> initialize());
    }

    @Override
    public void shutdown() {
        generation.incrementAndGet();
        timers.cancelAll();
        CompletableFuture<Void> inFlight = pendingControl;
        if (inFlight != null) {
            inFlight.completeExceptionally(new IllegalStateException("Relay instance " + id + " shut down"));
        }
        pendingControl = null;
        if (control) {
            releaseControl();
        }
        RelayTransport current = transport;
        transport = null;
        if (current != null) {
            current.close();
        }
        authenticated = false;
        control = false;
        currentVideo.set(null);
        sessionId = null;
        controlHost = null;
        reconnectAttempts = 0;
        connectionState = RelayConnectionState.DISCONNECTED;
        log.info("relay.shutdown instance=" + id);
    }

    @Override
    public boolean assignVideo(String url) {
        if (!currentVideo.compareAndSet(null, url)) {
            return false;
        }
        lastUsedAt = scheduler.now();
        return true;
    }

    @Override
    public boolean releaseVideo(String url) {
        return currentVideo.compareAndSet(url, null);
    }

    @Override
    public List<BrowserCookie> authCookies() {
        return cookies;
    }

    @Override
    public void restoreSession(List<BrowserCookie> restored) {
        cookies = List.copyOf(restored);
        log.info("relay.session restored instance=" + id + " cookies=" + restored.size());
    }

    URI endpoint() {
        String base = settings.getBaseUrl();
        String wsBase = base.startsWith("https://") ? "wss://" + base.substring("https://".length())
                : base.startsWith("http://") ? "ws://" + base.substring("http://".length())
                : base;
        if (wsBase.endsWith("/")) {
            wsBase = wsBase.substring(0, wsBase.length() - 1);
        }
        return URI.create(wsBase + "/ws?username=" + encode(settings.getUsername())
                + "&password=" + encode(settings.getPassword()));
    }

    Map<String, String> handshakeHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        List<BrowserCookie> jar = cookies;
        if (!jar.isEmpty()) {
            headers.put("Cookie", jar.stream().map(BrowserCookie::toHeaderPair).collect(Collectors.joining("; ")));
        }
        return headers;
    }

    static int keysymFor(int codePoint) {
        // Latin-1 범위는 코드포인트가 곧 keysym이고, 그 외 유니코드는 0x01000000 오프셋을 쓴다.
        return codePoint <= 0xFF ? codePoint : 0x01000000 | codePoint;
    }

    private CompletableFuture<Void> connect() {
        int attempt = generation.incrementAndGet();
        connectionState = RelayConnectionState.CONNECTING;
        CompletableFuture<Void> opened = new CompletableFuture<>();
        timers.arm(TimerKind.CONNECT_TIMEOUT, Duration.ofMillis(settings.getConnectTimeoutMs()),
                () -> opened.completeExceptionally(new RelayProtocolTimeoutException("connect",
                        "Connection timeout after " + settings.getConnectTimeoutMs() + "ms")));
        TransportEvents events = new TransportEvents(attempt);
        connector.connect(endpoint(), handshakeHeaders(), events).whenComplete((connected, error) -> {
            if (error != null) {
                timers.cancel(TimerKind.CONNECT_TIMEOUT);
                opened.completeExceptionally(unwrap(error));
                return;
            }
            if (attempt != generation.get() || opened.isDone()) {
                connected.close();
                return;
            }
            timers.cancel(TimerKind.CONNECT_TIMEOUT);
            transport = connected;
            events.adopted = true;
            connectionState = RelayConnectionState.READY;
            reconnectAttempts = 0;
            timers.repeat(TimerKind.PING, Duration.ofMillis(settings.getPingIntervalMs()), this::sendPing);
            log.info("relay.connect success instance=" + id);
            opened.complete(null);
        });
        return opened;
    }

    private void scheduleReconnect() {
        if (kicked || timers.isArmed(TimerKind.RECONNECT)) {
            return;
        }
        int attempt = reconnectAttempts + 1;
        if (!reconnectPolicy.allowsAttempt(attempt)) {
            log.severe("relay.reconnect exhausted instance=" + id + " attempts=" + reconnectAttempts);
            return;
        }
        reconnectAttempts = attempt;
        Duration delay = reconnectPolicy.delayFor(attempt);
        metrics.incrementRelayReconnect();
        log.info("relay.reconnect scheduled instance=" + id + " attempt=" + attempt + "/"
                + reconnectPolicy.maxAttempts() + " delay=" + delay.toMillis() + "ms");
        timers.arm(TimerKind.RECONNECT, delay, this::initialize);
    }

    private void handleText(int attempt, String payload) {
        if (attempt != generation.get()) {
            return;
        }
        RelayMessage message;
        try {
            message = codec.decode(payload);
        } catch (IllegalArgumentException e) {
            log.warning("relay.message unparseable instance=" + id + " message=" + e.getMessage());
            return;
        }
        log.fine(() -> "relay.message instance=" + id + " event=" + message.event());
        if (message instanceof RelayMessage.SystemInit init) {
            onSystemInit(init);
        } else if (message instanceof RelayMessage.ControlLocked locked) {
            controlHost = locked.id();
            control = locked.id().equals(sessionId);
            controlEvents.publish(locked);
        } else if (message instanceof RelayMessage.ControlRelease release) {
            if (release.id().equals(controlHost)) {
                controlHost = null;
                control = false;
            }
            controlEvents.publish(release);
        } else if (message instanceof RelayMessage.SystemDisconnect disconnect) {
            onSystemDisconnect(disconnect);
        } else if (message instanceof RelayMessage.SystemError systemError) {
            log.warning("relay.system error instance=" + id + " message=" + systemError.message());
        } else if (message instanceof RelayMessage.ControlRequesting requesting) {
            log.fine(() -> "relay.control requested instance=" + id + " by=" + requesting.id());
        }
    }

    private void onSystemInit(RelayMessage.SystemInit init) {
        sessionId = init.sessionId();
        controlHost = init.controlHost();
        authenticated = true;
        timers.repeat(TimerKind.HEARTBEAT, Duration.ofMillis(settings.getHeartbeatIntervalMs()), this::sendHeartbeat);
        log.info("relay.session initialized instance=" + id + " session=" + sessionId
                + " members=" + init.members().size());
    }

    private void onSystemDisconnect(RelayMessage.SystemDisconnect disconnect) {
        log.warning("relay.disconnect kicked instance=" + id + " message=" + disconnect.message());
        kicked = true;
        authenticated = false;
        control = false;
        timers.cancel(TimerKind.RECONNECT);
        RelayTransport current = transport;
        if (current != null) {
            current.close();
        }
    }

    private void handleClose(TransportEvents events, String reason) {
        if (!events.adopted || events.attempt != generation.get()) {
            return;
        }
        transport = null;
        authenticated = false;
        control = false;
        connectionState = RelayConnectionState.DISCONNECTED;
        timers.cancel(TimerKind.HEARTBEAT);
        timers.cancel(TimerKind.PING);
        log.warning("relay.connection closed instance=" + id + " reason=" + reason);
        scheduleReconnect();
    }

    private void sendHeartbeat() {
        if (authenticated) {
            send(new RelayCommand.Heartbeat());
        }
    }

    private void sendPing() {
        RelayTransport current = transport;
        if (current == null || !current.isOpen()) {
            return;
        }
        current.ping().whenComplete((ignored, error) -> {
            if (error != null) {
                log.warning("relay.ping failure instance=" + id + " message=" + unwrap(error).getMessage());
            }
        });
    }

    private CompletableFuture<Void> navigateSequence(String url) {
        return requestControl()
                .thenCompose(ignored -> sendKey(KEY_CONTROL_L, true))
                .thenCompose(ignored -> sendKey(KEY_L, true))
                .thenCompose(ignored -> sendKey(KEY_L, false))
                .thenCompose(ignored -> sendKey(KEY_CONTROL_L, false))
                .thenCompose(ignored -> scheduler.delay(NAVIGATION_PAUSE))
                .thenCompose(ignored -> sendText(url))
                .thenCompose(ignored -> scheduler.delay(NAVIGATION_PAUSE))
                .thenCompose(ignored -> tapKey(KEY_RETURN));
    }

    private CompletableFuture<Void> tapKey(int keysym) {
        return sendKey(keysym, true).thenCompose(ignored -> sendKey(keysym, false));
    }

    private CompletableFuture<Void> releasingControl(CompletableFuture<Void> sequence) {
        return sequence.whenComplete((ignored, error) -> releaseControl());
    }

    private CompletableFuture<Void> send(RelayCommand command) {
        RelayTransport current = transport;
        if (current == null || !current.isOpen()) {
            log.warning("relay.send skipped instance=" + id + " event=" + command.event() + " reason=not_open");
            return CompletableFuture.completedFuture(null);
        }
        log.fine(() -> "relay.send instance=" + id + " event=" + command.event());
        return current.sendText(codec.encode(command));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private enum TimerKind {
        CONNECT_TIMEOUT,
        RECONNECT,
        HEARTBEAT,
        PING,
        CONTROL_TIMEOUT
    }

    private final class TransportEvents implements RelayTransportListener {
        private final int attempt;
        private volatile boolean adopted;

        private TransportEvents(int attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onText(String payload) {
            handleText(attempt, payload);
        }

        @Override
        public void onClose(int statusCode, String reason) {
            handleClose(this, "code=" + statusCode + " " + reason);
        }

        @Override
        public void onError(Throwable error) {
            log.log(Level.WARNING, "relay.connection error instance=" + id, error);
            handleClose(this, "error");
        }
    }
}
