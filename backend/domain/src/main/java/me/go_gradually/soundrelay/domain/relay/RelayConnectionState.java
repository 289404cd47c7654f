package me.go_gradually.soundrelay.domain.relay;

public enum RelayConnectionState {
    DISCONNECTED,
    CONNECTING,
    READY
}
