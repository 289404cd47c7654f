package me.go_gradually.soundrelay.application.relay.usecase;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.soundrelay.application.support.FakeKeyValueStore;
import me.go_gradually.soundrelay.application.support.VirtualScheduler;
import me.go_gradually.soundrelay.domain.relay.BrowserCookie;
import me.go_gradually.soundrelay.domain.relay.RelayInstanceId;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelaySessionStoreTest {
    private final VirtualScheduler scheduler = new VirtualScheduler();
    private final FakeKeyValueStore store = new FakeKeyValueStore(scheduler);
    private final RelaySessionStore sessionStore = new RelaySessionStore(store, new ObjectMapper());

    @Test
    void save_persistsCookiesUntilTtlExpires() {
        RelayInstanceId id = RelayInstanceId.of("neko-1");
        List<BrowserCookie> cookies = List.of(
                new BrowserCookie("SID", "abc", ".youtube.com", "/", 1893456000L, true, true, "Lax"));

        sessionStore.save(id, cookies, Duration.ofDays(7));

        assertEquals(cookies, sessionStore.load(id).orElseThrow());
        scheduler.advance(Duration.ofDays(7));
        assertTrue(sessionStore.load(id).isEmpty());
    }

    @Test
    void save_ignoresEmptyCookieJar() {
        RelayInstanceId id = RelayInstanceId.of("neko-1");

        sessionStore.save(id, List.of(), Duration.ofDays(7));

        assertTrue(store.get("session:neko-1").isEmpty());
    }

    @Test
    void load_returnsEmptyForCorruptPayload() {
        store.set("session:neko-1", "{not json");

        assertTrue(sessionStore.load(RelayInstanceId.of("neko-1")).isEmpty());
    }
}
