package me.go_gradually.soundrelay.application.relay.port;

import me.go_gradually.soundrelay.domain.relay.BrowserCookie;
import me.go_gradually.soundrelay.domain.relay.RelayConnectionState;
import me.go_gradually.soundrelay.domain.relay.RelayInstanceId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 원격으로 조작하는 브라우저 하나. 입력 명령은 먼저 호스트 제어권을 얻는다.
 */
public interface RelayInstance {
    RelayInstanceId id();

    RelayConnectionState connectionState();

    boolean isAuthenticated();

    boolean hasControl();

    Optional<String> currentVideo();

    Instant lastUsedAt();

    Optional<String> sessionId();

    Optional<String> controlHost();

    int reconnectAttempts();

    /**
     * 연결 실패 시 future를 실패시키지 않고 재연결을 예약한다.
     */
    CompletableFuture<Void> initialize();

    CompletableFuture<Void> requestControl();

    void releaseControl();

    CompletableFuture<Void> sendMouseMove(int x, int y);

    CompletableFuture<Void> sendMouseClick(int x, int y);

    CompletableFuture<Void> sendKey(int keysym, boolean pressed);

    CompletableFuture<Void> sendText(String text);

    CompletableFuture<Void> navigate(String url);

    CompletableFuture<Void> playVideo(String url);

    CompletableFuture<Void> pause();

    CompletableFuture<Void> resume();

    CompletableFuture<Boolean> healthCheck();

    CompletableFuture<Void> restart();

    void shutdown();

    /**
     * 인스턴스를 영상에 할당한다. 이미 다른 영상이 있으면 false
     */
    boolean assignVideo(String url);

    /**
     * 지정한 영상이 아직 할당돼 있을 때만 해제한다. 다른 영상이 할당돼 있으면 false
     */
    boolean releaseVideo(String url);

    List<BrowserCookie> authCookies();

    void restoreSession(List<BrowserCookie> cookies);
}
