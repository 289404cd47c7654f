package me.go_gradually.soundrelay.application.shared.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

public class EventChannel<E> {
    private static final Logger log = Logger.getLogger(EventChannel.class.getName());
    private final List<Consumer<? super E>> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public Subscription subscribe(Consumer<? super E> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener is required");
        }
        if (closed) {
            return () -> {
            };
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(E event) {
        if (closed) {
            return;
        }
        for (Consumer<? super E> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "event.listener failure event=" + event, e);
            }
        }
    }

    public void close() {
        closed = true;
        listeners.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    public int subscriberCount() {
        return listeners.size();
    }
}
