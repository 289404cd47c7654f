package me.go_gradually.soundrelay.application.shared.port;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * 시간과 타이머 제공자. 유스케이스는 직접 sleep 하거나 시스템 시계를 읽지 않는다.
 */
public interface SchedulerPort {
    ScheduledHandle schedule(Runnable task, Duration delay);

    ScheduledHandle scheduleAtFixedRate(Runnable task, Duration period);

    Instant now();

    default CompletableFuture<Void> delay(Duration delay) {
        CompletableFuture<Void> elapsed = new CompletableFuture<>();
        schedule(() -> elapsed.complete(null), delay);
        return elapsed;
    }
}
