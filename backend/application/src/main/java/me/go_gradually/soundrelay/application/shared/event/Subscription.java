package me.go_gradually.soundrelay.application.shared.event;

@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
