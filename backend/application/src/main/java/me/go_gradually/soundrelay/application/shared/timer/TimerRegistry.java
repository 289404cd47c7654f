package me.go_gradually.soundrelay.application.shared.timer;

import me.go_gradually.soundrelay.application.shared.port.ScheduledHandle;
import me.go_gradually.soundrelay.application.shared.port.SchedulerPort;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 한 엔티티가 소유하는 이름 붙은 타이머 묶음. 같은 키로 다시 걸면 기존 타이머는 취소된다.
 */
public class TimerRegistry<K> {
    private final SchedulerPort scheduler;
    private final Map<K, Entry> timers = new ConcurrentHashMap<>();

    public TimerRegistry(SchedulerPort scheduler) {
        this.scheduler = scheduler;
    }

    public void arm(K key, Duration delay, Runnable task) {
        cancel(key);
        Entry entry = new Entry();
        timers.put(key, entry);
        entry.handle = scheduler.schedule(() -> {
            if (timers.remove(key, entry)) {
                task.run();
            }
        }, delay);
    }

    public void repeat(K key, Duration period, Runnable task) {
        cancel(key);
        Entry entry = new Entry();
        timers.put(key, entry);
        entry.handle = scheduler.scheduleAtFixedRate(() -> {
            if (timers.get(key) == entry) {
                task.run();
            }
        }, period);
    }

    public boolean cancel(K key) {
        Entry entry = timers.remove(key);
        if (entry == null) {
            return false;
        }
        entry.cancel();
        return true;
    }

    public void cancelAll() {
        for (K key : Set.copyOf(timers.keySet())) {
            cancel(key);
        }
    }

    public boolean isArmed(K key) {
        return timers.containsKey(key);
    }

    public Set<K> armedKeys() {
        return Set.copyOf(timers.keySet());
    }

    private static final class Entry {
        private volatile ScheduledHandle handle;

        private void cancel() {
            ScheduledHandle current = handle;
            if (current != null) {
                current.cancel();
            }
        }
    }
}
