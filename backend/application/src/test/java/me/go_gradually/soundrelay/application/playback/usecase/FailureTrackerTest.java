package me.go_gradually.soundrelay.application.playback.usecase;

import me.go_gradually.soundrelay.application.playback.policy.PlaybackPolicy;
import me.go_gradually.soundrelay.application.support.FakeKeyValueStore;
import me.go_gradually.soundrelay.application.support.VirtualScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FailureTrackerTest {
    private VirtualScheduler scheduler;
    private FakeKeyValueStore store;
    private FailureTracker tracker;

    @BeforeEach
    void setUp() {
        scheduler = new VirtualScheduler();
        store = new FakeKeyValueStore(scheduler);
        tracker = new FailureTracker(store, scheduler, new TestPolicy());
    }

    @Test
    void recordFailure_incrementsAndMirrorsToStoreWithTtl() {
        tracker.recordFailure("vid");
        int count = tracker.recordFailure("vid");

        assertEquals(2, count);
        assertEquals(2, tracker.count("vid"));
        assertEquals("2", store.get("failure:vid").orElseThrow());
        assertEquals(Duration.ofHours(1), store.ttlOf("failure:vid").orElseThrow());
    }

    @Test
    void count_resetsToZeroAfterTtl() {
        tracker.recordFailure("vid");
        tracker.recordFailure("vid");
        tracker.recordFailure("vid");

        scheduler.advance(Duration.ofMinutes(59));
        assertEquals(3, tracker.count("vid"));

        scheduler.advance(Duration.ofMinutes(1));
        assertEquals(0, tracker.count("vid"));
        assertEquals(0, tracker.recentFailures());
    }

    @Test
    void count_readsDurableValueWhenCacheIsCold() {
        store.set("failure:vid", "4", Duration.ofHours(1));

        assertEquals(4, tracker.count("vid"));
        assertEquals(5, tracker.recordFailure("vid"));
    }

    @Test
    void clear_removesCachedAndDurableCounts() {
        tracker.recordFailure("vid");

        tracker.clear("vid");

        assertEquals(0, tracker.count("vid"));
        assertEquals(0, tracker.recentFailures());
    }

    private static final class TestPolicy implements PlaybackPolicy {
        @Override
        public Duration failureTtl() {
            return Duration.ofHours(1);
        }

        @Override
        public int failureThreshold() {
            return 2;
        }

        @Override
        public Duration forceRelayTtl() {
            return Duration.ofMinutes(5);
        }
    }
}
