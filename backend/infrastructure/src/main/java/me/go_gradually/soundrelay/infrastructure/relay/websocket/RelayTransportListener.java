package me.go_gradually.soundrelay.infrastructure.relay.websocket;

public interface RelayTransportListener {
    void onText(String payload);

    void onClose(int statusCode, String reason);

    void onError(Throwable error);
}
