package me.go_gradually.soundrelay.application.shared.port;

import me.go_gradually.soundrelay.application.shared.model.OperatorAlert;

public interface NotificationPort {
    void notifyOperator(OperatorAlert alert);
}
