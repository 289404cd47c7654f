package me.go_gradually.soundrelay.application.shared.port;

@FunctionalInterface
public interface AsyncExecutor {
    void execute(Runnable task);
}
