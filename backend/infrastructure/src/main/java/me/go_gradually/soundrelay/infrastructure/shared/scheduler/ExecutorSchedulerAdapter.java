package me.go_gradually.soundrelay.infrastructure.shared.scheduler;

import jakarta.annotation.PreDestroy;
import me.go_gradually.soundrelay.application.shared.port.ScheduledHandle;
import me.go_gradually.soundrelay.application.shared.port.SchedulerPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

@Component
public class ExecutorSchedulerAdapter implements SchedulerPort {
    private static final Logger log = Logger.getLogger(ExecutorSchedulerAdapter.class.getName());
    private final ScheduledExecutorService executor;
    private final Clock clock;

    public ExecutorSchedulerAdapter() {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "soundrelay-scheduler");
            thread.setDaemon(true);
            return thread;
        }), Clock.systemUTC());
    }

    ExecutorSchedulerAdapter(ScheduledExecutorService executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public ScheduledHandle schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(guarded(task), Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    @Override
    public ScheduledHandle scheduleAtFixedRate(Runnable task, Duration period) {
        long millis = Math.max(1, period.toMillis());
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(guarded(task), millis, millis, TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // 주기 작업이 예외로 중단되지 않도록 여기서 기록만 한다.
                log.log(Level.WARNING, "scheduler.task failure", e);
            }
        };
    }

    private record FutureHandle(ScheduledFuture<?> future) implements ScheduledHandle {
        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isActive() {
            return !future.isDone();
        }
    }
}
