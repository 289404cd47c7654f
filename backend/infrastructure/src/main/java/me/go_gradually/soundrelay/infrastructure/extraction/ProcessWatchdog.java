package me.go_gradually.soundrelay.infrastructure.extraction;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 제한 시간 안에 닫히지 않으면 외부 프로세스를 강제 종료한다. 막힌 읽기는 스트림이 끊기면서 풀린다.
 */
final class ProcessWatchdog implements AutoCloseable {
    private static final ScheduledExecutorService TIMER = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "yt-dlp-watchdog");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicBoolean fired = new AtomicBoolean();
    private final ScheduledFuture<?> task;

    private ProcessWatchdog(Process process, Duration timeout) {
        this.task = TIMER.schedule(() -> {
            fired.set(true);
            process.destroyForcibly();
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    static ProcessWatchdog arm(Process process, Duration timeout) {
        return new ProcessWatchdog(process, timeout);
    }

    boolean fired() {
        return fired.get();
    }

    @Override
    public void close() {
        task.cancel(false);
    }
}
