package me.go_gradually.soundrelay.domain.relay;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconnectPolicyTest {

    @Test
    void delayFor_growsLinearlyAndCapsAtThirtySeconds() {
        ReconnectPolicy policy = ReconnectPolicy.of(Duration.ofSeconds(5), 10);

        assertEquals(Duration.ofSeconds(5), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(10), policy.delayFor(2));
        assertEquals(Duration.ofSeconds(25), policy.delayFor(5));
        assertEquals(Duration.ofSeconds(30), policy.delayFor(6));
        assertEquals(Duration.ofSeconds(30), policy.delayFor(9));
    }

    @Test
    void allowsAttempt_respectsMaxAttempts() {
        ReconnectPolicy policy = ReconnectPolicy.of(Duration.ofSeconds(5), 5);

        assertFalse(policy.allowsAttempt(0));
        assertTrue(policy.allowsAttempt(1));
        assertTrue(policy.allowsAttempt(5));
        assertFalse(policy.allowsAttempt(6));
    }

    @Test
    void constructor_rejectsNonPositiveBase() {
        assertThrows(IllegalArgumentException.class, () -> ReconnectPolicy.of(Duration.ZERO, 5));
    }
}
