package me.go_gradually.soundrelay.infrastructure.shared.scheduler;

import me.go_gradually.soundrelay.application.shared.port.ScheduledHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutorSchedulerAdapterTest {
    private final Instant fixedNow = Instant.parse("2026-03-01T12:00:00Z");
    private final ExecutorSchedulerAdapter scheduler = new ExecutorSchedulerAdapter(
            Executors.newSingleThreadScheduledExecutor(), Clock.fixed(fixedNow, ZoneOffset.UTC));

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void now_readsInjectedClock() {
        assertEquals(fixedNow, scheduler.now());
    }

    @Test
    void schedule_runsTaskAndCancelPreventsIt() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        AtomicInteger cancelledRuns = new AtomicInteger();

        ScheduledHandle cancelled = scheduler.schedule(cancelledRuns::incrementAndGet, Duration.ofMillis(200));
        cancelled.cancel();
        scheduler.schedule(ran::countDown, Duration.ofMillis(10));

        assertTrue(ran.await(2, TimeUnit.SECONDS));
        assertFalse(cancelled.isActive());
        Thread.sleep(300);
        assertEquals(0, cancelledRuns.get());
    }

    @Test
    void scheduleAtFixedRate_keepsRunningAfterTaskFailure() throws Exception {
        CountDownLatch runs = new CountDownLatch(3);

        ScheduledHandle handle = scheduler.scheduleAtFixedRate(() -> {
            runs.countDown();
            throw new IllegalStateException("boom");
        }, Duration.ofMillis(10));

        assertTrue(runs.await(2, TimeUnit.SECONDS));
        handle.cancel();
    }
}
