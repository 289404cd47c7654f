package me.go_gradually.soundrelay.domain.relay;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BrowserCookieTest {

    @Test
    void constructor_defaultsPathAndValue() {
        BrowserCookie cookie = new BrowserCookie("SID", null, ".youtube.com", null, null, true, true, "Lax");

        assertEquals("/", cookie.path());
        assertEquals("SID=", cookie.toHeaderPair());
    }

    @Test
    void constructor_requiresName() {
        assertThrows(IllegalArgumentException.class, () -> BrowserCookie.of("", "v", ".youtube.com"));
    }
}
