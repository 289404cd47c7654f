package me.go_gradually.soundrelay.infrastructure.voice;

import me.go_gradually.soundrelay.domain.voice.ConnectionState;
import net.dv8tion.jda.api.audio.hooks.ConnectionStatus;

final class ConnectionStatusMapper {
    private ConnectionStatusMapper() {
    }

    static ConnectionState map(ConnectionStatus status) {
        if (status == ConnectionStatus.CONNECTED) {
            return ConnectionState.READY;
        }
        if (status == ConnectionStatus.NOT_CONNECTED || status == ConnectionStatus.SHUTTING_DOWN) {
            return ConnectionState.DESTROYED;
        }
        String name = status.name();
        if (name.equals("CONNECTING_AWAITING_ENDPOINT")
                || name.startsWith("CONNECTING_AWAITING_WEBSOCKET")
                || name.equals("CONNECTING_AWAITING_AUTHENTICATION")) {
            return ConnectionState.SIGNALLING;
        }
        if (name.startsWith("CONNECTING") || name.equals("AUDIO_REGION_CHANGE")) {
            return ConnectionState.CONNECTING;
        }
        // DISCONNECTED_*, ERROR_*: 복구 대기 구간에서 재연결 여부를 판단한다.
        return ConnectionState.DISCONNECTED;
    }
}
