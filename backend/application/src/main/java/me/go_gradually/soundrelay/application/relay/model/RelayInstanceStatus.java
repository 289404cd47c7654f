package me.go_gradually.soundrelay.application.relay.model;

import me.go_gradually.soundrelay.application.relay.port.RelayInstance;
import me.go_gradually.soundrelay.domain.relay.RelayConnectionState;

import java.time.Instant;

public record RelayInstanceStatus(String id,
                                  RelayConnectionState connectionState,
                                  boolean authenticated,
                                  boolean hasControl,
                                  String currentVideo,
                                  Instant lastUsedAt,
                                  int reconnectAttempts) {
    public static RelayInstanceStatus of(RelayInstance instance) {
        return new RelayInstanceStatus(
                instance.id().value(),
                instance.connectionState(),
                instance.isAuthenticated(),
                instance.hasControl(),
                instance.currentVideo().orElse(null),
                instance.lastUsedAt(),
                instance.reconnectAttempts()
        );
    }

    public boolean isBusy() {
        return currentVideo != null;
    }
}
