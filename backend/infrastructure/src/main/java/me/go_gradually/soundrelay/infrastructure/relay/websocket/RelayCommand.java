package me.go_gradually.soundrelay.infrastructure.relay.websocket;

/**
 * 원격 브라우저 프로토콜 송신 이벤트
 */
public sealed interface RelayCommand {
    String event();

    record Heartbeat() implements RelayCommand {
        @Override
        public String event() {
            return "client/heartbeat";
        }
    }

    record RequestControl() implements RelayCommand {
        @Override
        public String event() {
            return "control/request";
        }
    }

    record ReleaseControl() implements RelayCommand {
        @Override
        public String event() {
            return "control/release";
        }
    }

    record MouseMove(int x, int y) implements RelayCommand {
        @Override
        public String event() {
            return "mousemove";
        }
    }

    record MouseDown(int x, int y, int button) implements RelayCommand {
        @Override
        public String event() {
            return "mousedown";
        }
    }

    record MouseUp(int x, int y, int button) implements RelayCommand {
        @Override
        public String event() {
            return "mouseup";
        }
    }

    record KeyDown(int keysym) implements RelayCommand {
        @Override
        public String event() {
            return "keydown";
        }
    }

    record KeyUp(int keysym) implements RelayCommand {
        @Override
        public String event() {
            return "keyup";
        }
    }
}
