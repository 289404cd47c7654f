package me.go_gradually.soundrelay.domain.track;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TrackTest {

    @Test
    void constructor_rejectsBlankIdOrUrl() {
        assertThrows(IllegalArgumentException.class, () -> Track.of(" ", "https://youtu.be/x"));
        assertThrows(IllegalArgumentException.class, () -> Track.of("abc", ""));
    }

    @Test
    void constructor_rejectsNegativeDuration() {
        assertThrows(IllegalArgumentException.class,
                () -> new Track("abc", "t", "https://youtu.be/abc", -1, null, null));
    }

    @Test
    void constructor_fallsBackToIdWhenTitleMissing() {
        Track track = new Track("abc", null, "https://youtu.be/abc", 10, null, "user-1");

        assertEquals("abc", track.title());
    }
}
