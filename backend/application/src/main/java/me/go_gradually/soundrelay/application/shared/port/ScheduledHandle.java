package me.go_gradually.soundrelay.application.shared.port;

public interface ScheduledHandle {
    void cancel();

    boolean isActive();
}
