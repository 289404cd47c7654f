package me.go_gradually.soundrelay.application.relay.usecase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.soundrelay.application.shared.port.KeyValueStorePort;
import me.go_gradually.soundrelay.domain.relay.BrowserCookie;
import me.go_gradually.soundrelay.domain.relay.RelayInstanceId;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

public class RelaySessionStore {
    private static final Logger log = Logger.getLogger(RelaySessionStore.class.getName());
    private static final String KEY_PREFIX = "session:";
    private static final TypeReference<List<BrowserCookie>> COOKIE_LIST = new TypeReference<>() {
    };
    private final KeyValueStorePort store;
    private final ObjectMapper objectMapper;

    public RelaySessionStore(KeyValueStorePort store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public void save(RelayInstanceId instanceId, List<BrowserCookie> cookies, Duration ttl) {
        if (cookies == null || cookies.isEmpty()) {
            return;
        }
        try {
            store.set(key(instanceId), objectMapper.writeValueAsString(cookies), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cookies for " + instanceId, e);
        }
    }

    public Optional<List<BrowserCookie>> load(RelayInstanceId instanceId) {
        Optional<String> raw = store.get(key(instanceId));
        if (raw.isEmpty() || raw.get().isBlank()) {
            return Optional.empty();
        }
        try {
            List<BrowserCookie> cookies = objectMapper.readValue(raw.get(), COOKIE_LIST);
            return cookies.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(cookies));
        } catch (JsonProcessingException e) {
            log.warning("relay.session.decode failure instance=" + instanceId + " message=" + e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public void clear(RelayInstanceId instanceId) {
        store.delete(key(instanceId));
    }

    private static String key(RelayInstanceId instanceId) {
        return KEY_PREFIX + instanceId.value();
    }
}
