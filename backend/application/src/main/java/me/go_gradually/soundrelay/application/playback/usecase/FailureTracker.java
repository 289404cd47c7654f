package me.go_gradually.soundrelay.application.playback.usecase;

import me.go_gradually.soundrelay.application.playback.policy.PlaybackPolicy;
import me.go_gradually.soundrelay.application.shared.port.KeyValueStorePort;
import me.go_gradually.soundrelay.application.shared.port.SchedulerPort;
import me.go_gradually.soundrelay.domain.playback.FailureRecord;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 영상별 최근 직접 재생 실패 횟수. 프로세스 내 캐시와 TTL이 걸린 키-값 저장소에 함께 기록한다.
 */
public class FailureTracker {
    private static final String KEY_PREFIX = "failure:";
    private final KeyValueStorePort store;
    private final SchedulerPort scheduler;
    private final PlaybackPolicy policy;
    private final Map<String, FailureRecord> cache = new ConcurrentHashMap<>();

    public FailureTracker(KeyValueStorePort store, SchedulerPort scheduler, PlaybackPolicy policy) {
        this.store = store;
        this.scheduler = scheduler;
        this.policy = policy;
    }

    public int count(String videoId) {
        Instant now = scheduler.now();
        FailureRecord cached = cache.get(videoId);
        if (cached != null) {
            if (!cached.isExpired(now)) {
                return cached.count();
            }
            cache.remove(videoId, cached);
        }
        return storedCount(videoId);
    }

    public int recordFailure(String videoId) {
        Instant now = scheduler.now();
        FailureRecord updated = cache.compute(videoId, (id, existing) -> {
            if (existing != null) {
                return existing.incremented(now, policy.failureTtl());
            }
            int stored = storedCount(id);
            return new FailureRecord(stored + 1, now.plus(policy.failureTtl()));
        });
        store.set(key(videoId), Integer.toString(updated.count()), policy.failureTtl());
        return updated.count();
    }

    public void clear(String videoId) {
        cache.remove(videoId);
        store.delete(key(videoId));
    }

    public int recentFailures() {
        Instant now = scheduler.now();
        cache.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        return cache.size();
    }

    private int storedCount(String videoId) {
        Optional<String> raw = store.get(key(videoId));
        if (raw.isEmpty()) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(raw.get().trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String key(String videoId) {
        return KEY_PREFIX + videoId;
    }
}
