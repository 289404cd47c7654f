package me.go_gradually.soundrelay.infrastructure.store;

import me.go_gradually.soundrelay.application.shared.port.KeyValueStorePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
@ConditionalOnProperty(prefix = "soundrelay.store", name = "type", havingValue = "redis")
public class RedisKeyValueStore implements KeyValueStorePort {
    private final StringRedisTemplate redisTemplate;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value) {
        redisTemplate.opsForValue().set(key, value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    @Override
    public void hashPut(String key, String field, String value) {
        redisTemplate.opsForHash().put(key, field, value);
    }

    @Override
    public Optional<String> hashGet(String key, String field) {
        Object value = redisTemplate.opsForHash().get(key, field);
        return Optional.ofNullable(value).map(Object::toString);
    }

    @Override
    public Map<String, String> hashEntries(String key) {
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(key);
        Map<String, String> result = new LinkedHashMap<>();
        entries.forEach((field, value) -> result.put(String.valueOf(field), String.valueOf(value)));
        return result;
    }

    @Override
    public void setAdd(String key, String member) {
        redisTemplate.opsForSet().add(key, member);
    }

    @Override
    public Set<String> setMembers(String key) {
        Set<String> members = redisTemplate.opsForSet().members(key);
        return members == null ? Set.of() : Set.copyOf(members);
    }
}
