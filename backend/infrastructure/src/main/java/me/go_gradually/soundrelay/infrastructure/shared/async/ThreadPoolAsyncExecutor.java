package me.go_gradually.soundrelay.infrastructure.shared.async;

import jakarta.annotation.PreDestroy;
import me.go_gradually.soundrelay.application.shared.port.AsyncExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class ThreadPoolAsyncExecutor implements AsyncExecutor {
    private final ExecutorService executor;

    public ThreadPoolAsyncExecutor() {
        AtomicInteger sequence = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "soundrelay-async-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(task);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
