package me.go_gradually.soundrelay.infrastructure.relay.websocket;

import java.util.List;

/**
 * 원격 브라우저 프로토콜 수신 이벤트
 */
public sealed interface RelayMessage {
    String event();

    record SystemInit(String sessionId, String controlHost, List<String> members) implements RelayMessage {
        public SystemInit {
            members = members == null ? List.of() : List.copyOf(members);
        }

        @Override
        public String event() {
            return "system/init";
        }
    }

    record SystemDisconnect(String message) implements RelayMessage {
        @Override
        public String event() {
            return "system/disconnect";
        }
    }

    record SystemError(String message) implements RelayMessage {
        @Override
        public String event() {
            return "system/error";
        }
    }

    record ControlLocked(String id) implements RelayMessage {
        @Override
        public String event() {
            return "control/locked";
        }
    }

    record ControlRelease(String id) implements RelayMessage {
        @Override
        public String event() {
            return "control/release";
        }
    }

    record ControlRequesting(String id) implements RelayMessage {
        @Override
        public String event() {
            return "control/requesting";
        }
    }

    record MemberList(int size) implements RelayMessage {
        @Override
        public String event() {
            return "member/list";
        }
    }

    record MemberConnected(String id) implements RelayMessage {
        @Override
        public String event() {
            return "member/connected";
        }
    }

    record MemberDisconnected(String id) implements RelayMessage {
        @Override
        public String event() {
            return "member/disconnected";
        }
    }

    record ScreenResolution(int width, int height, int rate) implements RelayMessage {
        @Override
        public String event() {
            return "screen/resolution";
        }
    }

    record Unknown(String event) implements RelayMessage {
    }
}
