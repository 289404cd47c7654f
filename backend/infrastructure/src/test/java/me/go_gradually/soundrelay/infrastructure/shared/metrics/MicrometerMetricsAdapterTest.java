package me.go_gradually.soundrelay.infrastructure.shared.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class MicrometerMetricsAdapterTest {

    @Test
    void recordsTimersAndCounters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerMetricsAdapter adapter = new MicrometerMetricsAdapter(registry);

        adapter.recordPlaybackStartLatency(Duration.ofMillis(120));
        adapter.recordRelayAcquireLatency(Duration.ofMillis(40));
        adapter.incrementDirectPlayback();
        adapter.incrementDirectPlayback();
        adapter.incrementRelayPlayback();
        adapter.incrementDirectFailure();
        adapter.incrementBotDetection();
        adapter.incrementPlaybackUnavailable();
        adapter.incrementRelayReconnect();
        adapter.incrementRelayRestart();
        adapter.incrementRelayPoolExhausted();
        adapter.incrementVoiceRecovery();
        adapter.incrementVoiceConnectionLost();
        adapter.incrementPlayerError();

        assertNotNull(registry.find("playback.start.latency").timer());
        assertEquals(1, registry.find("playback.start.latency").timer().count());
        assertEquals(1, registry.find("relay.acquire.latency").timer().count());

        assertEquals(2.0, registry.find("playback.started").tag("method", "direct").counter().count());
        assertEquals(1.0, registry.find("playback.started").tag("method", "relay").counter().count());
        assertEquals(1.0, registry.find("playback.direct.failures").counter().count());
        assertEquals(1.0, registry.find("playback.direct.bot_detections").counter().count());
        assertEquals(1.0, registry.find("playback.unavailable").counter().count());
        assertEquals(1.0, registry.find("relay.reconnects").counter().count());
        assertEquals(1.0, registry.find("relay.restarts").counter().count());
        assertEquals(1.0, registry.find("relay.pool.exhausted").counter().count());
        assertEquals(1.0, registry.find("voice.connection.recoveries").counter().count());
        assertEquals(1.0, registry.find("voice.connection.lost").counter().count());
        assertEquals(1.0, registry.find("voice.player.errors").counter().count());
    }
}
