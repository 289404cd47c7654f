package me.go_gradually.soundrelay.application.shared.port;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public interface KeyValueStorePort {
    Optional<String> get(String key);

    void set(String key, String value);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    void hashPut(String key, String field, String value);

    Optional<String> hashGet(String key, String field);

    Map<String, String> hashEntries(String key);

    void setAdd(String key, String member);

    Set<String> setMembers(String key);
}
