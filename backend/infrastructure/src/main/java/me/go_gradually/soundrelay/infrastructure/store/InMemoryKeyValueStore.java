package me.go_gradually.soundrelay.infrastructure.store;

import me.go_gradually.soundrelay.application.shared.port.KeyValueStorePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(prefix = "soundrelay.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryKeyValueStore implements KeyValueStorePort {
    private final Clock clock;
    private final Map<String, Entry> values = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> hashes = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sets = new ConcurrentHashMap<>();

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = values.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            values.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value) {
        values.put(key, new Entry(value, null));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        values.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void delete(String key) {
        values.remove(key);
        hashes.remove(key);
        sets.remove(key);
    }

    @Override
    public void hashPut(String key, String field, String value) {
        hashes.computeIfAbsent(key, ignored -> new ConcurrentHashMap<>()).put(field, value);
    }

    @Override
    public Optional<String> hashGet(String key, String field) {
        return Optional.ofNullable(hashes.getOrDefault(key, Map.of()).get(field));
    }

    @Override
    public Map<String, String> hashEntries(String key) {
        return Map.copyOf(hashes.getOrDefault(key, Map.of()));
    }

    @Override
    public void setAdd(String key, String member) {
        sets.computeIfAbsent(key, ignored -> ConcurrentHashMap.newKeySet()).add(member);
    }

    @Override
    public Set<String> setMembers(String key) {
        return Set.copyOf(sets.getOrDefault(key, Set.of()));
    }

    private record Entry(String value, Instant expiresAt) {
        private boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
