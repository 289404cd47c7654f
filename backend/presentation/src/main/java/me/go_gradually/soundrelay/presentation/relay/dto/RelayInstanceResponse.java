package me.go_gradually.soundrelay.presentation.relay.dto;

import me.go_gradually.soundrelay.application.relay.model.RelayInstanceStatus;

import java.time.Instant;

public record RelayInstanceResponse(String id,
                                    String connectionState,
                                    boolean authenticated,
                                    boolean hasControl,
                                    boolean busy,
                                    String currentVideo,
                                    Instant lastUsedAt,
                                    int reconnectAttempts) {
    public static RelayInstanceResponse from(RelayInstanceStatus status) {
        return new RelayInstanceResponse(
                status.id(),
                status.connectionState().name(),
                status.authenticated(),
                status.hasControl(),
                status.isBusy(),
                status.currentVideo(),
                status.lastUsedAt(),
                status.reconnectAttempts()
        );
    }
}
